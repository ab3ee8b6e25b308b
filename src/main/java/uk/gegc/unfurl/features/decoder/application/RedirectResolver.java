package uk.gegc.unfurl.features.decoder.application;

import uk.gegc.unfurl.features.decoder.domain.UrlDecodeException;
import uk.gegc.unfurl.features.urlsafety.domain.SsrfProtectionException;

/**
 * Performs a single redirect-follow attempt against a wrapped link.
 */
public interface RedirectResolver {

    /**
     * Issues one GET and follows redirects to the final destination.
     *
     * @param url wrapped link
     * @return URL after the last redirect
     * @throws UrlDecodeException      when the attempt fails (timeout, HTTP error, no redirect ...)
     * @throws SsrfProtectionException when a redirect points at a disallowed destination
     */
    String resolve(String url);
}
