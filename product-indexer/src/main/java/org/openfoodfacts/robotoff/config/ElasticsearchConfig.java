package org.openfoodfacts.robotoff.config;

import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.client.CredentialsProvider;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;
import org.elasticsearch.client.RestHighLevelClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static io.micrometer.common.util.StringUtils.isNotBlank;

@Configuration
@RequiredArgsConstructor
@Data
public class ElasticsearchConfig {

    private final EsFieldsConfig esFieldsConfig;

    @Bean(name = "esClient", destroyMethod = "close")
    public RestHighLevelClient getEsClient() {
        EsFieldsConfig.Property property = esFieldsConfig.getProperty();
        String user = property.getUser();
        String password = property.getPassword();

        RestClientBuilder restClientBuilder = RestClient.builder(HttpHost.create(property.getEsHost()));
        if (isNotBlank(user) && isNotBlank(password)) {
            final CredentialsProvider credentialsProvider = new BasicCredentialsProvider();
            credentialsProvider.setCredentials(AuthScope.ANY,
                    new UsernamePasswordCredentials(user, password));
            restClientBuilder.setHttpClientConfigCallback(
                    httpClientBuilder -> httpClientBuilder.setDefaultCredentialsProvider(credentialsProvider));
        }

        return new RestHighLevelClient(restClientBuilder);
    }
}
