package uk.gegc.unfurl.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Single source of time for retry scheduling and store timestamps.
 * Tests replace it with {@link Clock#fixed}.
 */
@Configuration
public class ClockConfig {

    /**
     * Default timezone for the application.
     * Can be overridden via application properties.
     */
    @Value("${app.timezone:UTC}")
    private String timezone;

    @Bean
    @Primary
    public Clock clock() {
        String configuredZone = timezone == null || timezone.isBlank()
                ? "UTC"
                : timezone.trim();
        return Clock.system(ZoneId.of(configuredZone));
    }
}
