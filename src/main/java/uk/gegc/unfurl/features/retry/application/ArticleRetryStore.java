package uk.gegc.unfurl.features.retry.application;

import uk.gegc.unfurl.features.retry.domain.model.ArticleRef;
import uk.gegc.unfurl.features.retry.domain.model.RetryState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence port for per-article retry bookkeeping.
 *
 * <p>Every write is a single conditional update. It returns {@code false} instead of overwriting
 * when the stored row no longer matches what the transition was computed from.
 */
public interface ArticleRetryStore {

    /**
     * Starts tracking an article. Returns {@code false} when it is already tracked.
     */
    boolean track(Long articleId, String wrappedUrl);

    /**
     * Marks the article resolved and clears its schedule. Applies only while the article is pending;
     * resolved and permanently failed articles are left untouched.
     */
    boolean recordSuccess(Long articleId, String canonicalUrl);

    /**
     * Schedules a retry. Applied only when the article is pending and its stored retry count is
     * {@code retryCount - 1}.
     */
    boolean recordFailure(Long articleId, String error, int retryCount, Instant nextRetryAt);

    /**
     * Terminal failure with no further schedule. Applied only when the article is pending.
     */
    boolean recordPermanentFailure(Long articleId, String error);

    /**
     * Pending articles whose {@code nextRetryAt} is at or before {@code now}, earliest first.
     */
    List<ArticleRef> findDueForRetry(Instant now);

    Optional<ArticleRef> findTracked(Long articleId);

    Optional<RetryState> findState(Long articleId);
}
