package uk.gegc.unfurl.features.decoder.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.unfurl.features.decoder.config.DecoderProperties;
import uk.gegc.unfurl.features.decoder.domain.UrlDecodeException;
import uk.gegc.unfurl.features.decoder.domain.model.EncodingVariant;
import uk.gegc.unfurl.features.decoder.domain.model.FailureReason;
import uk.gegc.unfurl.features.decoder.domain.model.ResolutionFailure;
import uk.gegc.unfurl.features.decoder.domain.model.ResolutionOutcome;
import uk.gegc.unfurl.features.urlsafety.application.UrlSafetyValidator;
import uk.gegc.unfurl.features.urlsafety.domain.SsrfProtectionException;

import java.net.URI;
import java.util.Locale;

/**
 * Recovers the canonical destination behind an aggregator's wrapped link.
 *
 * <p>Legacy links are decoded locally from their embedded payload. Redirect-based links are
 * resolved by following live redirects, rate limited and retried with pure exponential backoff
 * ({@code retryBackoffMs * 2^attempt}). Whatever path produced the candidate, it is passed through
 * {@link UrlSafetyValidator} before a resolved outcome is returned.
 *
 * <p>{@link #decode(String)} never throws for decoding or safety problems; they are reported as
 * {@code FAILED} or {@code BLOCKED} outcomes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WrapperDecoder {

    private final DecoderProperties config;
    private final EncodingVariantDetector variantDetector;
    private final LegacyPayloadExtractor payloadExtractor;
    private final RedirectResolver redirectResolver;
    private final OutboundRateLimiter rateLimiter;
    private final UrlSafetyValidator urlSafetyValidator;

    public ResolutionOutcome decode(String wrappedLink) {
        if (wrappedLink == null || wrappedLink.isBlank()) {
            return ResolutionOutcome.failed(
                    ResolutionFailure.of(FailureReason.INVALID_INPUT, "URL cannot be empty"), null);
        }
        String link = wrappedLink.trim();
        if (!isAggregatorLink(link)) {
            return ResolutionOutcome.failed(
                    ResolutionFailure.of(FailureReason.INVALID_INPUT, "Invalid URL: not an aggregator link: " + link),
                    null);
        }

        EncodingVariant variant = variantDetector.detectVariant(link);
        String candidate;
        try {
            candidate = variant == EncodingVariant.LEGACY_EMBEDDED
                    ? decodeLegacy(link)
                    : decodeRedirect(link);
        } catch (UrlDecodeException ex) {
            log.warn("Failed to decode wrapped link variant={} reason={}: {}", variant, ex.getReason(), ex.getMessage());
            return ResolutionOutcome.failed(ex.getFailure(), variant);
        } catch (SsrfProtectionException ex) {
            log.warn("Redirect chain blocked by safety gate variant={}: {}", variant, ex.getMessage());
            return ResolutionOutcome.blocked(ResolutionFailure.blocked(ex.getMessage()), variant);
        }

        try {
            urlSafetyValidator.validate(candidate);
        } catch (SsrfProtectionException ex) {
            log.warn("Decoded URL blocked by safety gate variant={}: {}", variant, ex.getMessage());
            return ResolutionOutcome.blocked(ResolutionFailure.blocked(ex.getMessage()), variant);
        }

        log.info("Resolved wrapped link variant={} -> {}", variant, candidate);
        return ResolutionOutcome.resolved(candidate, variant);
    }

    /**
     * Format check. Deterministic, performs no network access.
     */
    public boolean isLegacyEncoding(String wrappedLink) {
        return detectVariant(wrappedLink) == EncodingVariant.LEGACY_EMBEDDED;
    }

    public EncodingVariant detectVariant(String wrappedLink) {
        return variantDetector.detectVariant(wrappedLink);
    }

    private String decodeLegacy(String link) {
        String articleId = variantDetector.extractArticleId(link)
                .orElseThrow(() -> new UrlDecodeException(FailureReason.MALFORMED_PAYLOAD,
                        "Could not extract article ID from URL"));
        return payloadExtractor.extract(articleId);
    }

    private String decodeRedirect(String link) {
        int maxAttempts = Math.max(1, config.getMaxRetries());
        UrlDecodeException lastError = null;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (attempt > 0) {
                sleepBeforeRetry(calculateRetryDelay(attempt));
            }
            rateLimiter.acquire();
            try {
                return redirectResolver.resolve(link);
            } catch (UrlDecodeException ex) {
                lastError = ex;
                log.debug("Redirect attempt {}/{} failed: {}", attempt + 1, maxAttempts, ex.getMessage());
            }
        }

        ResolutionFailure last = lastError.getFailure();
        throw new UrlDecodeException(
                last.withMessage("Failed to decode after " + maxAttempts + " retries: " + last.message()),
                lastError);
    }

    /**
     * Delay before retry number {@code attempt} (1-based): 200 ms, 400 ms, 800 ms ... with the defaults.
     */
    public long calculateRetryDelay(int attempt) {
        return config.getRetryBackoffMs() * (1L << Math.max(0, attempt - 1));
    }

    protected void sleepBeforeRetry(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new UrlDecodeException(FailureReason.CONNECTION, "Interrupted while waiting to retry", ex);
        }
    }

    private boolean isAggregatorLink(String link) {
        try {
            String host = URI.create(link).getHost();
            if (host == null) {
                return false;
            }
            String normalizedHost = host.toLowerCase(Locale.ROOT);
            String aggregatorHost = config.getAggregatorHost().toLowerCase(Locale.ROOT);
            return normalizedHost.equals(aggregatorHost) || normalizedHost.endsWith("." + aggregatorHost);
        } catch (IllegalArgumentException ex) {
            log.debug("Unparseable wrapped link: {}", ex.getMessage());
            return false;
        }
    }
}
