package uk.gegc.unfurl.features.resolution.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.unfurl.features.decoder.application.WrapperDecoder;
import uk.gegc.unfurl.features.decoder.domain.model.ResolutionOutcome;
import uk.gegc.unfurl.features.resolution.domain.model.ResolutionReport;
import uk.gegc.unfurl.features.retry.application.ArticleRetryStore;
import uk.gegc.unfurl.features.retry.application.ResolutionRetryScheduler;
import uk.gegc.unfurl.features.retry.domain.model.ArticleRef;
import uk.gegc.unfurl.features.retry.domain.model.ArticleResolutionStatus;
import uk.gegc.unfurl.features.retry.domain.model.RetryState;
import uk.gegc.unfurl.features.retry.domain.model.ScheduleDecision;
import uk.gegc.unfurl.shared.exception.ArticleNotPendingException;
import uk.gegc.unfurl.shared.exception.ResourceNotFoundException;

/**
 * Runs one resolution attempt for a tracked article and reports the outcome to the retry scheduler.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResolutionService {

    private final WrapperDecoder wrapperDecoder;
    private final ResolutionRetryScheduler retryScheduler;
    private final ArticleRetryStore retryStore;

    public ResolutionReport resolve(ArticleRef article) {
        log.debug("Resolving article {} (retry {})", article.articleId(), article.retryCount());
        ResolutionOutcome outcome = wrapperDecoder.decode(article.wrappedUrl());

        ScheduleDecision decision;
        if (outcome.isResolved()) {
            boolean applied = retryScheduler.markComplete(article.articleId(), outcome.canonicalUrl());
            decision = ScheduleDecision.completed(article.retryCount()).withApplied(applied);
        } else {
            decision = retryScheduler.markFailed(article.articleId(), outcome.failure(), article.retryCount());
        }
        return new ResolutionReport(article.articleId(), outcome, decision);
    }

    public ResolutionReport resolveTracked(Long articleId) {
        RetryState state = getState(articleId);
        if (state.status() != ArticleResolutionStatus.PENDING) {
            throw new ArticleNotPendingException(
                    "Article " + articleId + " is " + state.status() + " and accepts no further attempts");
        }
        ArticleRef article = retryStore.findTracked(articleId)
                .orElseThrow(() -> notTracked(articleId));
        return resolve(article);
    }

    public boolean track(Long articleId, String wrappedUrl) {
        boolean created = retryStore.track(articleId, wrappedUrl);
        if (!created) {
            log.debug("Article {} is already tracked", articleId);
        }
        return created;
    }

    public RetryState getState(Long articleId) {
        return retryStore.findState(articleId)
                .orElseThrow(() -> notTracked(articleId));
    }

    private ResourceNotFoundException notTracked(Long articleId) {
        return new ResourceNotFoundException("Article " + articleId + " is not tracked for resolution");
    }
}
