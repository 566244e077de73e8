package org.openfoodfacts.robotoff.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "elasticsearch")
@Data
public class EsFieldsConfig {
    private Property property;
    private Index index;
    private File file;
    private Export export;

    @Data
    public static class Index {
        private String alias;
        private Long indicesAmount;
    }

    @Data
    public static class Property {
        private String esHost;
        private String user;
        private String password;
    }

    @Data
    public static class File {
        private Resource mappings;
        private Resource settings;
        private Resource dataset;
    }

    /**
     * Selection rules applied to the product dataset before it is sent to the index.
     */
    @Data
    public static class Export {
        private Integer batchSize;
        private String countryTag;
        private String stateTag;
        private List<String> excludedQualityTags = new ArrayList<>();
    }
}
