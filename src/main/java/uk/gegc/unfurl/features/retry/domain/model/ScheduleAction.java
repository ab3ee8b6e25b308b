package uk.gegc.unfurl.features.retry.domain.model;

public enum ScheduleAction {
    RETRY_SCHEDULED,
    PERMANENT_FAILURE,
    COMPLETED
}
