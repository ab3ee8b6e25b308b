package uk.gegc.unfurl.features.retry.application;

import uk.gegc.unfurl.features.retry.domain.model.RetryClassification;
import uk.gegc.unfurl.features.retry.domain.model.ScheduleDecision;

import java.time.Duration;
import java.time.Instant;

/**
 * Pure failure transition: from the article's current retry count and the classified failure to
 * the next disposition. No I/O and no clock access; the caller supplies {@code now} and the backoff.
 */
public final class RetryTransitions {

    public static final String REASON_PERMANENT_ERROR = "permanent error";
    public static final String REASON_MAX_RETRIES = "max retries exceeded";

    private RetryTransitions() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static ScheduleDecision onFailure(
            int currentRetryCount,
            String error,
            RetryClassification classification,
            int maxRetries,
            Duration backoff,
            Instant now
    ) {
        if (currentRetryCount < 0) {
            throw new IllegalArgumentException("retryCount must be non-negative");
        }
        if (classification == RetryClassification.PERMANENT) {
            return ScheduleDecision.permanent(currentRetryCount, error, REASON_PERMANENT_ERROR);
        }
        if (currentRetryCount >= maxRetries) {
            return ScheduleDecision.permanent(currentRetryCount, error, REASON_MAX_RETRIES);
        }
        return ScheduleDecision.retry(currentRetryCount + 1, now.plus(backoff), backoff, error);
    }
}
