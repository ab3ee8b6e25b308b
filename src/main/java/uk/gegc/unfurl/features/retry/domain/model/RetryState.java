package uk.gegc.unfurl.features.retry.domain.model;

import java.time.Instant;

/**
 * Retry bookkeeping of one article as the store holds it.
 *
 * @param retryCount  number of scheduled retries so far, never decreases
 * @param nextRetryAt when the article becomes due, {@code null} when nothing is scheduled
 * @param lastError   last human-readable error, kept for display
 * @param status      lifecycle status
 */
public record RetryState(
        int retryCount,
        Instant nextRetryAt,
        String lastError,
        ArticleResolutionStatus status
) {

    public RetryState {
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be non-negative");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
    }

    public static RetryState initial() {
        return new RetryState(0, null, null, ArticleResolutionStatus.PENDING);
    }

    /**
     * A permanently failed article accepts no further failure transitions.
     */
    public boolean isTerminal() {
        return status == ArticleResolutionStatus.FAILED && nextRetryAt == null;
    }
}
