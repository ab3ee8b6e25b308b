package uk.gegc.unfurl.features.retry.domain.model;

public enum RetryClassification {
    RETRYABLE,
    PERMANENT
}
