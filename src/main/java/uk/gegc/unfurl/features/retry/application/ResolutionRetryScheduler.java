package uk.gegc.unfurl.features.retry.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.unfurl.features.decoder.domain.model.ResolutionFailure;
import uk.gegc.unfurl.features.retry.config.RetryProperties;
import uk.gegc.unfurl.features.retry.domain.model.ArticleRef;
import uk.gegc.unfurl.features.retry.domain.model.RetryClassification;
import uk.gegc.unfurl.features.retry.domain.model.ScheduleDecision;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Turns failed resolution attempts into deferred work or a permanent failure.
 *
 * <p>Backoff is {@code baseBackoff * 2^retryCount} plus a jitter drawn uniformly from
 * {@code [0, maxJitter)}. With the defaults that is 60s, 120s and 240s nominal, each up to 10s
 * later. Once {@code maxRetries} retries have been scheduled the next failure is permanent
 * whatever its text says.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResolutionRetryScheduler {

    // Checked first; a message matching both lists is permanent
    private static final List<String> PERMANENT_PATTERNS = List.of(
            "not found",
            "404",
            "forbidden",
            "403",
            "invalid url",
            "ssrf",
            "blocked",
            "parseable content"
    );

    private static final List<String> RETRYABLE_PATTERNS = List.of(
            "timeout",
            "timed out",
            "connection",
            "network",
            "dns",
            "429",
            "502",
            "503",
            "504",
            "rate limit"
    );

    private final RetryProperties properties;
    private final ArticleRetryStore retryStore;
    private final Clock clock;

    /**
     * Classifies a free-text error. Unknown errors are permanent.
     */
    public RetryClassification classifyFailure(String error) {
        if (error == null || error.isBlank()) {
            return RetryClassification.PERMANENT;
        }
        String lower = error.toLowerCase(Locale.ROOT);
        for (String pattern : PERMANENT_PATTERNS) {
            if (lower.contains(pattern)) {
                return RetryClassification.PERMANENT;
            }
        }
        for (String pattern : RETRYABLE_PATTERNS) {
            if (lower.contains(pattern)) {
                return RetryClassification.RETRYABLE;
            }
        }
        return RetryClassification.PERMANENT;
    }

    /**
     * Classifies a tagged failure produced by the decoder.
     */
    public RetryClassification classify(ResolutionFailure failure) {
        return switch (failure.reason()) {
            case TIMEOUT, CONNECTION -> RetryClassification.RETRYABLE;
            case HTTP_STATUS -> isRetryableStatus(failure.httpStatus())
                    ? RetryClassification.RETRYABLE
                    : RetryClassification.PERMANENT;
            case INVALID_INPUT, MALFORMED_PAYLOAD, NO_URL_FOUND, NO_REDIRECT, TOO_MANY_REDIRECTS,
                 BLOCKED_BY_POLICY, NO_PARSEABLE_CONTENT -> RetryClassification.PERMANENT;
        };
    }

    public Duration computeBackoff(int retryCount) {
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be non-negative");
        }
        long baseMs = properties.getBaseBackoffSeconds() * 1000L * (1L << Math.min(retryCount, 30));
        long jitterMs = properties.getMaxJitterMs() > 0
                ? ThreadLocalRandom.current().nextLong(properties.getMaxJitterMs())
                : 0L;
        return Duration.ofMillis(baseMs + jitterMs);
    }

    /**
     * Schedules another attempt, or fails permanently once the retry budget is spent.
     */
    public ScheduleDecision enqueue(Long articleId, String error, int retryCount) {
        return transition(articleId, error, retryCount, RetryClassification.RETRYABLE);
    }

    public ScheduleDecision markFailed(Long articleId, String error, int retryCount) {
        return transition(articleId, error, retryCount, classifyFailure(error));
    }

    public ScheduleDecision markFailed(Long articleId, ResolutionFailure failure, int retryCount) {
        return transition(articleId, failure.message(), retryCount, classify(failure));
    }

    public boolean markComplete(Long articleId, String canonicalUrl) {
        boolean applied = retryStore.recordSuccess(articleId, canonicalUrl);
        if (applied) {
            log.info("Article {} resolved to {}", articleId, canonicalUrl);
        } else {
            log.warn("Article {} was already resolved or is not tracked; success not recorded", articleId);
        }
        return applied;
    }

    public List<ArticleRef> getPendingRetries() {
        return retryStore.findDueForRetry(Instant.now(clock));
    }

    private ScheduleDecision transition(Long articleId, String error, int retryCount,
                                        RetryClassification classification) {
        Duration backoff = computeBackoff(Math.max(0, retryCount));
        ScheduleDecision decision = RetryTransitions.onFailure(
                retryCount, error, classification, properties.getMaxRetries(), backoff, Instant.now(clock));

        boolean applied = decision.isRetryScheduled()
                ? retryStore.recordFailure(articleId, error, decision.retryCount(), decision.nextRetryAt())
                : retryStore.recordPermanentFailure(articleId, error);

        if (!applied) {
            log.warn("Retry bookkeeping for article {} changed concurrently; {} not applied",
                    articleId, decision.action());
        } else if (decision.isRetryScheduled()) {
            log.warn("Article {} queued for retry {} at {} (backoff {} s): {}",
                    articleId, decision.retryCount(), decision.nextRetryAt(), backoff.toSeconds(), error);
        } else {
            log.error("Article {} permanently failed ({}): {}", articleId, decision.reason(), error);
        }
        return decision.withApplied(applied);
    }

    private boolean isRetryableStatus(Integer status) {
        return status != null && (status == 429 || status == 502 || status == 503 || status == 504);
    }
}
