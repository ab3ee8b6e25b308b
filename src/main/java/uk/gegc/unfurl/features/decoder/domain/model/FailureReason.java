package uk.gegc.unfurl.features.decoder.domain.model;

/**
 * Closed set of reasons a resolution attempt can fail.
 * Produced directly by the decoding and HTTP layers so callers never parse error text.
 */
public enum FailureReason {
    INVALID_INPUT,          // empty link, not an aggregator link
    MALFORMED_PAYLOAD,      // legacy identifier is not valid base64
    NO_URL_FOUND,           // legacy payload decoded but holds no URL
    TIMEOUT,                // connect or read timeout
    CONNECTION,             // DNS failure, refused connection, other I/O
    HTTP_STATUS,            // response status >= 400
    NO_REDIRECT,            // request never left the wrapper URL
    TOO_MANY_REDIRECTS,     // redirect chain exceeded the configured maximum
    BLOCKED_BY_POLICY,      // safety gate rejected a candidate URL
    NO_PARSEABLE_CONTENT    // reported by content collaborators
}
