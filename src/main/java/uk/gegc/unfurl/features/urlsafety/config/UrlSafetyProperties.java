package uk.gegc.unfurl.features.urlsafety.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Limits applied by the outbound URL safety gate.
 */
@Configuration
@ConfigurationProperties(prefix = "unfurl.safety")
@Data
public class UrlSafetyProperties {

    /**
     * Maximum accepted URL length in characters.
     * Default: 2000
     */
    private int maxUrlLength = 2000;
}
