package uk.gegc.unfurl.features.decoder.domain.model;

import java.util.Objects;

/**
 * Result of one decode attempt. Never mutated; a new attempt produces a new outcome.
 * A {@link ResolutionStatus#RESOLVED} outcome always carries a URL that passed the safety gate.
 */
public record ResolutionOutcome(
        ResolutionStatus status,
        String canonicalUrl,
        EncodingVariant variant,
        ResolutionFailure failure
) {

    public ResolutionOutcome {
        Objects.requireNonNull(status, "status");
        if (status == ResolutionStatus.RESOLVED && canonicalUrl == null) {
            throw new IllegalArgumentException("Resolved outcome requires a canonical URL");
        }
        if (status != ResolutionStatus.RESOLVED && failure == null) {
            throw new IllegalArgumentException(status + " outcome requires a failure");
        }
    }

    public static ResolutionOutcome resolved(String canonicalUrl, EncodingVariant variant) {
        return new ResolutionOutcome(ResolutionStatus.RESOLVED, canonicalUrl, variant, null);
    }

    public static ResolutionOutcome blocked(ResolutionFailure failure, EncodingVariant variant) {
        return new ResolutionOutcome(ResolutionStatus.BLOCKED, null, variant, failure);
    }

    public static ResolutionOutcome failed(ResolutionFailure failure, EncodingVariant variant) {
        return new ResolutionOutcome(ResolutionStatus.FAILED, null, variant, failure);
    }

    public boolean isResolved() {
        return status == ResolutionStatus.RESOLVED;
    }

    public String errorMessage() {
        return failure == null ? null : failure.message();
    }
}
