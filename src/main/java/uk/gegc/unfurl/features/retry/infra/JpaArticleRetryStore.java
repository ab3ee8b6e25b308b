package uk.gegc.unfurl.features.retry.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.unfurl.features.retry.application.ArticleRetryStore;
import uk.gegc.unfurl.features.retry.domain.model.ArticleRef;
import uk.gegc.unfurl.features.retry.domain.model.ArticleResolution;
import uk.gegc.unfurl.features.retry.domain.model.ArticleResolutionStatus;
import uk.gegc.unfurl.features.retry.domain.model.RetryState;
import uk.gegc.unfurl.features.retry.domain.repository.ArticleResolutionRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * {@link ArticleRetryStore} over JPA. Each transition is one conditional {@code UPDATE}, so two
 * schedulers racing on the same article cannot both apply a transition computed from the same state.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaArticleRetryStore implements ArticleRetryStore {

    private final ArticleResolutionRepository repository;
    private final Clock clock;

    @Override
    @Transactional
    public boolean track(Long articleId, String wrappedUrl) {
        if (repository.existsById(articleId)) {
            return false;
        }
        ArticleResolution resolution = new ArticleResolution();
        resolution.setId(articleId);
        resolution.setWrappedUrl(wrappedUrl);
        resolution.setStatus(ArticleResolutionStatus.PENDING);
        resolution.setRetryCount(0);
        repository.save(resolution);
        log.debug("Tracking article {} for resolution", articleId);
        return true;
    }

    @Override
    @Transactional
    public boolean recordSuccess(Long articleId, String canonicalUrl) {
        return repository.markResolved(articleId, canonicalUrl, ArticleResolutionStatus.PENDING,
                ArticleResolutionStatus.RESOLVED, Instant.now(clock)) == 1;
    }

    @Override
    @Transactional
    public boolean recordFailure(Long articleId, String error, int retryCount, Instant nextRetryAt) {
        if (retryCount < 1) {
            throw new IllegalArgumentException("A scheduled retry count starts at 1, got " + retryCount);
        }
        return repository.scheduleRetry(articleId, retryCount - 1, retryCount, nextRetryAt, truncate(error),
                ArticleResolutionStatus.PENDING, Instant.now(clock)) == 1;
    }

    @Override
    @Transactional
    public boolean recordPermanentFailure(Long articleId, String error) {
        return repository.markPermanentlyFailed(articleId, truncate(error), ArticleResolutionStatus.PENDING,
                ArticleResolutionStatus.FAILED, Instant.now(clock)) == 1;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ArticleRef> findDueForRetry(Instant now) {
        return repository.findDue(ArticleResolutionStatus.PENDING, now).stream()
                .map(ArticleResolution::toRef)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ArticleRef> findTracked(Long articleId) {
        return repository.findById(articleId).map(ArticleResolution::toRef);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RetryState> findState(Long articleId) {
        return repository.findById(articleId).map(ArticleResolution::toRetryState);
    }

    private String truncate(String error) {
        if (error == null || error.length() <= ArticleResolution.MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, ArticleResolution.MAX_ERROR_LENGTH);
    }
}
