package uk.gegc.unfurl.features.decoder.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.unfurl.features.decoder.application.RedirectResolver;
import uk.gegc.unfurl.features.decoder.config.DecoderProperties;
import uk.gegc.unfurl.features.decoder.domain.UrlDecodeException;
import uk.gegc.unfurl.features.decoder.domain.model.FailureReason;
import uk.gegc.unfurl.features.decoder.domain.model.ResolutionFailure;
import uk.gegc.unfurl.features.urlsafety.application.UrlSafetyValidator;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;

/**
 * Follows HTTP redirects with {@link HttpURLConnection}, one hop at a time.
 *
 * <p>Redirects are followed manually rather than by the connection so every hop target passes the
 * safety gate before it is requested, and the hop count honours {@code unfurl.decoder.max-redirects}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HttpRedirectResolver implements RedirectResolver {

    private final DecoderProperties config;
    private final UrlSafetyValidator urlSafetyValidator;

    @Override
    public String resolve(String url) {
        URI startingUri = toUri(url);
        urlSafetyValidator.validate(url);

        HttpURLConnection connection = null;
        URI currentUri = startingUri;
        int redirectCount = 0;

        try {
            connection = openConnection(currentUri);
            int responseCode = connection.getResponseCode();

            while (isRedirect(responseCode)) {
                redirectCount++;
                if (redirectCount > config.getMaxRedirects()) {
                    throw new UrlDecodeException(FailureReason.TOO_MANY_REDIRECTS,
                            "Too many redirects (max: " + config.getMaxRedirects() + ")");
                }

                String location = connection.getHeaderField("Location");
                if (location == null || location.isBlank()) {
                    throw new UrlDecodeException(FailureReason.CONNECTION, "Redirect without Location header");
                }

                URI redirectUri = resolveRedirect(currentUri, location);
                urlSafetyValidator.validate(redirectUri.toString());
                log.debug("Following redirect {} -> {}", currentUri, redirectUri);

                connection.disconnect();
                currentUri = redirectUri;
                connection = openConnection(currentUri);
                responseCode = connection.getResponseCode();
            }

            if (responseCode >= 400) {
                throw new UrlDecodeException(ResolutionFailure.httpStatus(responseCode));
            }

            String finalUrl = currentUri.toString();
            if (finalUrl.equals(url)) {
                throw new UrlDecodeException(FailureReason.NO_REDIRECT,
                        "No redirect occurred - still on the wrapper URL");
            }
            return finalUrl;
        } catch (SocketTimeoutException ex) {
            throw new UrlDecodeException(FailureReason.TIMEOUT,
                    "HTTP request failed: timeout after " + config.getTimeoutMs() + " ms", ex);
        } catch (UnknownHostException ex) {
            throw new UrlDecodeException(FailureReason.CONNECTION,
                    "HTTP request failed: dns lookup failed for " + ex.getMessage(), ex);
        } catch (IOException ex) {
            throw new UrlDecodeException(FailureReason.CONNECTION,
                    "HTTP request failed: connection error: " + ex.getMessage(), ex);
        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private HttpURLConnection openConnection(URI targetUri) throws IOException {
        HttpURLConnection connection = (HttpURLConnection) targetUri.toURL().openConnection();

        connection.setRequestMethod("GET");
        connection.setConnectTimeout(config.getTimeoutMs());
        connection.setReadTimeout(config.getTimeoutMs());
        connection.setInstanceFollowRedirects(false);
        connection.setRequestProperty("User-Agent", config.getUserAgent());
        connection.setRequestProperty("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8");
        connection.connect();
        return connection;
    }

    private boolean isRedirect(int responseCode) {
        return responseCode == HttpURLConnection.HTTP_MOVED_PERM
                || responseCode == HttpURLConnection.HTTP_MOVED_TEMP
                || responseCode == HttpURLConnection.HTTP_SEE_OTHER
                || responseCode == 307
                || responseCode == 308;
    }

    private URI toUri(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException ex) {
            throw new UrlDecodeException(FailureReason.INVALID_INPUT, "Invalid URL: " + ex.getMessage(), ex);
        }
    }

    private URI resolveRedirect(URI baseUri, String locationHeader) {
        try {
            URI locationUri = new URI(locationHeader.trim());
            if (!locationUri.isAbsolute()) {
                locationUri = baseUri.resolve(locationUri);
            }
            return locationUri.normalize();
        } catch (URISyntaxException ex) {
            throw new UrlDecodeException(FailureReason.CONNECTION, "Invalid redirect URL: " + locationHeader, ex);
        }
    }
}
