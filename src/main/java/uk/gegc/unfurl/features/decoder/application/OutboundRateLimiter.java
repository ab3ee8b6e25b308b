package uk.gegc.unfurl.features.decoder.application;

/**
 * Spaces outbound requests. Called once before every request is issued.
 * The default implementation is process-local; a shared-quota implementation can be swapped in
 * without touching the decoder.
 */
public interface OutboundRateLimiter {

    /**
     * Blocks until the caller may issue its next request.
     *
     * @throws uk.gegc.unfurl.features.decoder.domain.UrlDecodeException with reason
     *         {@code CONNECTION} when interrupted while waiting
     */
    void acquire();
}
