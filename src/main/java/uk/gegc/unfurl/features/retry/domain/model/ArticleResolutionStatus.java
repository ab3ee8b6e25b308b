package uk.gegc.unfurl.features.retry.domain.model;

/**
 * Lifecycle of a tracked article's resolution. {@code PENDING} while attempts remain,
 * {@code FAILED} once permanent.
 */
public enum ArticleResolutionStatus {
    PENDING,
    RESOLVED,
    FAILED
}
