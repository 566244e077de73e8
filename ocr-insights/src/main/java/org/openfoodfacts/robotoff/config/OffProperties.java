package org.openfoodfacts.robotoff.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "openfoodfacts")
@Data
public class OffProperties {
    private String apiUrl;
    private String staticUrl;
    private Duration connectTimeout;
    private Duration readTimeout;
}
