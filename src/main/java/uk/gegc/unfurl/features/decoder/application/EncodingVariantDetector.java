package uk.gegc.unfurl.features.decoder.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.unfurl.features.decoder.config.DecoderProperties;
import uk.gegc.unfurl.features.decoder.domain.model.EncodingVariant;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides which encoding a wrapped link uses. Pure string inspection, no I/O.
 *
 * <p>A link is {@link EncodingVariant#LEGACY_EMBEDDED} when its path has an {@code /articles/}
 * segment whose identifier starts with a known marker and is shorter than
 * {@code unfurl.decoder.legacy-id-max-length}. Long identifiers keep the marker but moved to the
 * redirect-based scheme, so both conditions are required.
 */
@Component
@RequiredArgsConstructor
public class EncodingVariantDetector {

    public static final List<String> LEGACY_MARKERS = List.of("CBM", "CWM");
    public static final int MARKER_LENGTH = 3;

    private static final String ARTICLES_SEGMENT = "/articles/";

    private final DecoderProperties properties;

    public EncodingVariant detectVariant(String wrappedLink) {
        Optional<String> articleId = extractArticleId(wrappedLink);
        if (articleId.isEmpty()) {
            return EncodingVariant.REDIRECT_BASED;
        }
        String id = articleId.get();
        if (id.length() >= properties.getLegacyIdMaxLength()) {
            return EncodingVariant.REDIRECT_BASED;
        }
        String prefix = id.length() >= MARKER_LENGTH
                ? id.substring(0, MARKER_LENGTH).toUpperCase(Locale.ROOT)
                : "";
        return LEGACY_MARKERS.contains(prefix)
                ? EncodingVariant.LEGACY_EMBEDDED
                : EncodingVariant.REDIRECT_BASED;
    }

    /**
     * Returns the identifier following {@code /articles/}, without query string or fragment.
     */
    public Optional<String> extractArticleId(String wrappedLink) {
        if (wrappedLink == null || wrappedLink.isBlank()) {
            return Optional.empty();
        }
        String path = stripQueryAndFragment(wrappedLink.trim());
        int segment = path.indexOf(ARTICLES_SEGMENT);
        if (segment < 0) {
            return Optional.empty();
        }
        String id = path.substring(segment + ARTICLES_SEGMENT.length());
        int slash = id.indexOf('/');
        if (slash >= 0) {
            id = id.substring(0, slash);
        }
        return id.isEmpty() ? Optional.empty() : Optional.of(id);
    }

    private String stripQueryAndFragment(String url) {
        int end = url.length();
        int query = url.indexOf('?');
        if (query >= 0) {
            end = query;
        }
        int fragment = url.indexOf('#');
        if (fragment >= 0 && fragment < end) {
            end = fragment;
        }
        return url.substring(0, end);
    }
}
