package uk.gegc.unfurl.features.resolution.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.unfurl.features.decoder.domain.model.ResolutionFailure;
import uk.gegc.unfurl.features.decoder.domain.model.ResolutionOutcome;
import uk.gegc.unfurl.features.resolution.api.dto.ArticleResolutionResponse;
import uk.gegc.unfurl.features.resolution.api.dto.DecodeResponse;
import uk.gegc.unfurl.features.resolution.api.dto.RetryStateResponse;
import uk.gegc.unfurl.features.resolution.domain.model.ResolutionReport;
import uk.gegc.unfurl.features.retry.domain.model.RetryState;
import uk.gegc.unfurl.features.retry.domain.model.ScheduleDecision;

@Component
public class ResolutionMapper {

    public DecodeResponse toDecodeResponse(ResolutionOutcome outcome) {
        ResolutionFailure failure = outcome.failure();
        return new DecodeResponse(
                outcome.status(),
                outcome.canonicalUrl(),
                outcome.variant(),
                failure != null ? failure.reason() : null,
                failure != null ? failure.httpStatus() : null,
                failure != null ? failure.message() : null
        );
    }

    public ArticleResolutionResponse toArticleResponse(ResolutionReport report) {
        ScheduleDecision decision = report.decision();
        return new ArticleResolutionResponse(
                report.articleId(),
                toDecodeResponse(report.outcome()),
                decision.action(),
                decision.retryCount(),
                decision.nextRetryAt(),
                decision.reason(),
                decision.applied()
        );
    }

    public RetryStateResponse toStateResponse(Long articleId, RetryState state) {
        return new RetryStateResponse(
                articleId,
                state.status(),
                state.retryCount(),
                state.nextRetryAt(),
                state.lastError(),
                state.isTerminal()
        );
    }
}
