package uk.gegc.unfurl.features.retry.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the scheduler-level retry policy and the poller that re-attempts due items.
 */
@Configuration
@ConfigurationProperties(prefix = "unfurl.retry")
@Data
public class RetryProperties {

    /**
     * Failed attempts after which an article is marked permanently failed.
     * Default: 3
     */
    private int maxRetries = 3;

    /**
     * Base backoff in seconds, doubled for every previous retry.
     * Default: 60 seconds (60, 120, 240 ...)
     */
    private long baseBackoffSeconds = 60L;

    /**
     * Upper bound (exclusive) of the random jitter added to every backoff, in milliseconds.
     * Default: 10000 ms (10 seconds)
     */
    private long maxJitterMs = 10_000L;

    private Poller poller = new Poller();

    @Data
    public static class Poller {

        /**
         * Whether the background poller is registered at all.
         */
        private boolean enabled = true;

        /**
         * Delay between the end of one poll and the start of the next, in milliseconds.
         * Default: 60000 ms
         */
        private long fixedDelayMs = 60_000L;

        /**
         * Maximum number of due articles re-attempted per poll.
         */
        private int batchSize = 50;
    }
}
