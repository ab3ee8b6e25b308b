package uk.gegc.unfurl.features.urlsafety.domain;

/**
 * Exception thrown when a URL fails SSRF protection checks.
 * A rejection is terminal: callers must never retry the same URL.
 */
public class SsrfProtectionException extends RuntimeException {

    public SsrfProtectionException(String message) {
        super(message);
    }

    public SsrfProtectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
