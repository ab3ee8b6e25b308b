package uk.gegc.unfurl.features.decoder.domain.model;

import java.util.Objects;

/**
 * Tagged description of a failed or blocked resolution attempt.
 *
 * @param reason     failure variant
 * @param httpStatus response status, only for {@link FailureReason#HTTP_STATUS}
 * @param message    human-readable detail, preserved for display
 */
public record ResolutionFailure(FailureReason reason, Integer httpStatus, String message) {

    public ResolutionFailure {
        Objects.requireNonNull(reason, "reason");
        message = message == null ? reason.name() : message;
    }

    public static ResolutionFailure of(FailureReason reason, String message) {
        return new ResolutionFailure(reason, null, message);
    }

    public static ResolutionFailure httpStatus(int status) {
        return new ResolutionFailure(FailureReason.HTTP_STATUS, status,
                "HTTP error " + status + " when fetching URL");
    }

    public static ResolutionFailure blocked(String message) {
        return new ResolutionFailure(FailureReason.BLOCKED_BY_POLICY, null, message);
    }

    public ResolutionFailure withMessage(String newMessage) {
        return new ResolutionFailure(reason, httpStatus, newMessage);
    }
}
