package uk.gegc.unfurl.features.decoder.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for wrapped-link decoding and the live redirect-follow path.
 */
@Configuration
@ConfigurationProperties(prefix = "unfurl.decoder")
@Data
public class DecoderProperties {

    /**
     * Per-request timeout in milliseconds, applied to both connect and read.
     * Default: 10000 ms (10 seconds)
     */
    private int timeoutMs = 10_000;

    /**
     * Maximum number of redirects to follow.
     * Default: 10
     */
    private int maxRedirects = 10;

    /**
     * Minimum spacing between outbound redirect-follow requests, in milliseconds.
     * Default: 500 ms
     */
    private long rateLimitDelayMs = 500L;

    /**
     * Total attempts for the redirect-follow path before giving up.
     * Default: 3
     */
    private int maxRetries = 3;

    /**
     * Base delay between redirect-follow attempts. Pure exponential, no jitter.
     * Default: 200 ms (200, 400, 800 ...)
     */
    private long retryBackoffMs = 200L;

    /**
     * Host every wrapped link must belong to.
     */
    private String aggregatorHost = "news.google.com";

    /**
     * Identifiers at or above this length are treated as redirect-based even when they carry a
     * legacy marker. Empirical, not part of any published format.
     */
    private int legacyIdMaxLength = 150;

    /**
     * User agent sent on redirect-follow requests.
     */
    private String userAgent = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
}
