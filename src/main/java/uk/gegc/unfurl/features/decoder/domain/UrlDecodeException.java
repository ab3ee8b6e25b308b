package uk.gegc.unfurl.features.decoder.domain;

import uk.gegc.unfurl.features.decoder.domain.model.FailureReason;
import uk.gegc.unfurl.features.decoder.domain.model.ResolutionFailure;

/**
 * Thrown inside the decoder when a wrapped link cannot be decoded.
 * Converted to a failed outcome at the decoder boundary.
 */
public class UrlDecodeException extends RuntimeException {

    private final ResolutionFailure failure;

    public UrlDecodeException(ResolutionFailure failure) {
        super(failure.message());
        this.failure = failure;
    }

    public UrlDecodeException(ResolutionFailure failure, Throwable cause) {
        super(failure.message(), cause);
        this.failure = failure;
    }

    public UrlDecodeException(FailureReason reason, String message) {
        this(ResolutionFailure.of(reason, message));
    }

    public UrlDecodeException(FailureReason reason, String message, Throwable cause) {
        this(ResolutionFailure.of(reason, message), cause);
    }

    public ResolutionFailure getFailure() {
        return failure;
    }

    public FailureReason getReason() {
        return failure.reason();
    }
}
