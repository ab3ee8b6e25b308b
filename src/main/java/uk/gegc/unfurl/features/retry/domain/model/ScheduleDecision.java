package uk.gegc.unfurl.features.retry.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Disposition computed for one reported outcome.
 *
 * @param action      what the store was asked to do
 * @param retryCount  retry count after the transition
 * @param nextRetryAt due time, only for {@link ScheduleAction#RETRY_SCHEDULED}
 * @param backoff     delay used to compute {@code nextRetryAt}
 * @param error       raw error text persisted with the transition
 * @param reason      why the failure is permanent, only for {@link ScheduleAction#PERMANENT_FAILURE}
 * @param applied     {@code false} when the store rejected the conditional update
 */
public record ScheduleDecision(
        ScheduleAction action,
        int retryCount,
        Instant nextRetryAt,
        Duration backoff,
        String error,
        String reason,
        boolean applied
) {

    public static ScheduleDecision retry(int retryCount, Instant nextRetryAt, Duration backoff, String error) {
        return new ScheduleDecision(ScheduleAction.RETRY_SCHEDULED, retryCount, nextRetryAt, backoff, error, null, true);
    }

    public static ScheduleDecision permanent(int retryCount, String error, String reason) {
        return new ScheduleDecision(ScheduleAction.PERMANENT_FAILURE, retryCount, null, null, error, reason, true);
    }

    public static ScheduleDecision completed(int retryCount) {
        return new ScheduleDecision(ScheduleAction.COMPLETED, retryCount, null, null, null, null, true);
    }

    public ScheduleDecision withApplied(boolean wasApplied) {
        return new ScheduleDecision(action, retryCount, nextRetryAt, backoff, error, reason, wasApplied);
    }

    public boolean isRetryScheduled() {
        return action == ScheduleAction.RETRY_SCHEDULED;
    }
}
