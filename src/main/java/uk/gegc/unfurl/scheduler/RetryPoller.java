package uk.gegc.unfurl.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.unfurl.features.resolution.application.ResolutionService;
import uk.gegc.unfurl.features.resolution.domain.model.ResolutionReport;
import uk.gegc.unfurl.features.retry.application.ResolutionRetryScheduler;
import uk.gegc.unfurl.features.retry.config.RetryProperties;
import uk.gegc.unfurl.features.retry.domain.model.ArticleRef;

import java.util.List;

/**
 * Re-attempts articles whose {@code nextRetryAt} has passed, one at a time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "unfurl.retry.poller", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RetryPoller {

    private final ResolutionRetryScheduler retryScheduler;
    private final ResolutionService resolutionService;
    private final RetryProperties properties;

    @Scheduled(
            fixedDelayString = "${unfurl.retry.poller.fixed-delay-ms:60000}",
            initialDelayString = "${unfurl.retry.poller.fixed-delay-ms:60000}"
    )
    public void processDueRetries() {
        List<ArticleRef> due;
        try {
            due = retryScheduler.getPendingRetries();
        } catch (Exception e) {
            log.error("Failed to load articles due for retry", e);
            return;
        }
        if (due.isEmpty()) {
            return;
        }

        int limit = Math.min(due.size(), Math.max(1, properties.getPoller().getBatchSize()));
        int resolved = 0;
        for (ArticleRef article : due.subList(0, limit)) {
            try {
                ResolutionReport report = resolutionService.resolve(article);
                if (report.outcome().isResolved()) {
                    resolved++;
                }
            } catch (Exception e) {
                log.error("Retry of article {} crashed", article.articleId(), e);
            }
        }
        log.info("Retry poll finished: {} due, {} attempted, {} resolved", due.size(), limit, resolved);
    }
}
