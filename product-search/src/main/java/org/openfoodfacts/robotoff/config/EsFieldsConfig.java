package org.openfoodfacts.robotoff.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "elasticsearch")
@Data
public class EsFieldsConfig {

    private Request request;
    private Fields fields;
    private Index index;
    private Query query;

    @Data
    public static class Request {
        private Integer defaultQuerySize;
        private Integer defaultQueryPage;
        private Integer maxQuerySize;
        // index.max_result_window of the product index
        private Integer maxResultWindow;
    }

    @Data
    public static class Fields {
        private String code;
        private String ingredientsTextFr;
        private String trigram;
        private String reverse;
    }

    @Data
    public static class Index {
        private String alias;
    }

    @Data
    public static class Query {
        private Double tieBreaker;
    }
}
