package uk.gegc.unfurl.shared.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables {@code @Scheduled} jobs unless the retry poller is switched off.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "unfurl.retry.poller", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
