package uk.gegc.unfurl.features.decoder.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.unfurl.features.decoder.domain.UrlDecodeException;
import uk.gegc.unfurl.features.decoder.domain.model.FailureReason;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers a destination URL from a legacy article identifier.
 *
 * <p>The identifier is a 3-character marker followed by base64 of a loosely structured binary
 * record. The record embeds one or more URL strings delimited by control bytes; there is no
 * published schema, so extraction is pattern based:
 * <ol>
 *   <li>a scheme-prefixed run of non-control bytes followed by a control byte</li>
 *   <li>a scheme-prefixed run of non-whitespace bytes</li>
 *   <li>the first {@code https://}, {@code http://}, {@code ftp://} or {@code ftps://}, walked
 *       forward until a control byte or the end of the buffer</li>
 * </ol>
 * Any scheme is extracted here; rejecting non-HTTP schemes is the safety gate's job.
 */
@Component
@Slf4j
public class LegacyPayloadExtractor {

    private static final Pattern CONTROL_TERMINATED =
            Pattern.compile("([a-z][a-z0-9+.-]*://[^\\x00-\\x1F\\x7F]+?)[\\x00-\\x1F\\x7F]");
    private static final Pattern WHITESPACE_TERMINATED =
            Pattern.compile("([a-z][a-z0-9+.-]*://\\S+)");
    private static final List<String> FALLBACK_SCHEMES = List.of("https://", "http://", "ftp://", "ftps://");
    private static final List<String> KNOWN_SCHEMES = List.of("https", "ftps", "http", "ftp");

    /**
     * Decodes the identifier (marker included) and extracts the first embedded URL.
     *
     * @throws UrlDecodeException with {@link FailureReason#MALFORMED_PAYLOAD} or
     *                            {@link FailureReason#NO_URL_FOUND}
     */
    public String extract(String articleId) {
        if (articleId == null || articleId.length() <= EncodingVariantDetector.MARKER_LENGTH) {
            throw new UrlDecodeException(FailureReason.MALFORMED_PAYLOAD, "Article ID too short");
        }
        byte[] payload = decodeBase64(articleId.substring(EncodingVariantDetector.MARKER_LENGTH));
        return extractUrl(payload);
    }

    /**
     * Extracts the first URL from a decoded payload. Usable directly with synthetic payloads.
     */
    public String extractUrl(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new UrlDecodeException(FailureReason.NO_URL_FOUND, "Decoded payload is empty");
        }
        // ISO-8859-1 maps every byte to exactly one char, so regex offsets are byte offsets
        String data = new String(payload, StandardCharsets.ISO_8859_1);

        String candidate = null;
        Matcher matcher = CONTROL_TERMINATED.matcher(data);
        if (matcher.find()) {
            candidate = matcher.group(1);
        } else {
            matcher = WHITESPACE_TERMINATED.matcher(data);
            if (matcher.find()) {
                candidate = matcher.group(1);
            }
        }
        if (candidate == null) {
            candidate = scanForScheme(data);
        }

        String url = toUtf8(trimTrailingControl(stripLengthPrefix(candidate)));
        if (url.isEmpty()) {
            throw new UrlDecodeException(FailureReason.NO_URL_FOUND, "Decoded URL is empty");
        }
        log.debug("Extracted legacy URL ({} chars) from {} byte payload", url.length(), payload.length);
        return url;
    }

    private byte[] decodeBase64(String encoded) {
        String normalized = encoded.replace('-', '+').replace('_', '/');
        int padding = (4 - normalized.length() % 4) % 4;
        if (padding == 3) {
            throw new UrlDecodeException(FailureReason.MALFORMED_PAYLOAD, "Invalid base64 encoding in article ID");
        }
        if (!normalized.endsWith("=")) {
            normalized = normalized + "=".repeat(padding);
        }
        try {
            return Base64.getDecoder().decode(normalized);
        } catch (IllegalArgumentException ex) {
            throw new UrlDecodeException(FailureReason.MALFORMED_PAYLOAD,
                    "Invalid base64 encoding in article ID", ex);
        }
    }

    private String scanForScheme(String data) {
        String lower = data.toLowerCase(Locale.ROOT);
        int start = -1;
        for (String scheme : FALLBACK_SCHEMES) {
            int position = lower.indexOf(scheme);
            if (position >= 0 && (start < 0 || position < start)) {
                start = position;
            }
        }
        if (start < 0) {
            throw new UrlDecodeException(FailureReason.NO_URL_FOUND, "No URL found in decoded data");
        }
        int end = start;
        while (end < data.length() && !isControl(data.charAt(end))) {
            end++;
        }
        return data.substring(start, end);
    }

    /**
     * A printable length byte in front of the URL reads as part of the scheme ({@code "hhttps://"}
     * for a 104-byte URL). Cut the scheme back to the known one it ends with.
     */
    private String stripLengthPrefix(String candidate) {
        int separator = candidate.indexOf("://");
        if (separator <= 0) {
            return candidate;
        }
        String scheme = candidate.substring(0, separator);
        for (String known : KNOWN_SCHEMES) {
            if (scheme.equals(known)) {
                return candidate;
            }
        }
        for (String known : KNOWN_SCHEMES) {
            if (scheme.endsWith(known)) {
                return candidate.substring(separator - known.length());
            }
        }
        return candidate;
    }

    private String trimTrailingControl(String value) {
        int end = value.length();
        while (end > 0 && isControl(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(0, end);
    }

    /**
     * Re-reads the Latin-1 view as UTF-8. A dangling multi-byte sequence at the end belongs to the
     * next record field, not the URL, and is dropped.
     */
    private String toUtf8(String latin1) {
        String decoded = new String(latin1.getBytes(StandardCharsets.ISO_8859_1), StandardCharsets.UTF_8);
        int end = decoded.length();
        while (end > 0 && decoded.charAt(end - 1) == '\uFFFD') {
            end--;
        }
        return decoded.substring(0, end);
    }

    private boolean isControl(char c) {
        return c < 0x20 || c == 0x7F;
    }
}
