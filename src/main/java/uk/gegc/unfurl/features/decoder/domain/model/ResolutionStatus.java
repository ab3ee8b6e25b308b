package uk.gegc.unfurl.features.decoder.domain.model;

public enum ResolutionStatus {
    RESOLVED,
    BLOCKED,
    FAILED
}
