package org.openfoodfacts.robotoff.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
@RequiredArgsConstructor
public class RestTemplateConfig {

    private final OffProperties offProperties;

    @Bean
    public RestTemplate offRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(offProperties.getConnectTimeout())
                .setReadTimeout(offProperties.getReadTimeout())
                .build();
    }
}
