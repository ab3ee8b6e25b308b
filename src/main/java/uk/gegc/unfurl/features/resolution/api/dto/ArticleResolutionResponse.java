package uk.gegc.unfurl.features.resolution.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.unfurl.features.retry.domain.model.ScheduleAction;

import java.time.Instant;

@Schema(name = "ArticleResolutionResponse", description = "Result of resolving a tracked article now")
public record ArticleResolutionResponse(
        @Schema(description = "Article id", example = "42")
        Long articleId,

        @Schema(description = "Decode outcome")
        DecodeResponse outcome,

        @Schema(description = "What the scheduler did", example = "RETRY_SCHEDULED")
        ScheduleAction action,

        @Schema(description = "Retry count after the transition", example = "1")
        int retryCount,

        @Schema(description = "When the next attempt is due, if one was scheduled")
        Instant nextRetryAt,

        @Schema(description = "Why the failure is permanent", example = "max retries exceeded")
        String reason,

        @Schema(description = "False when a concurrent update won and this transition was dropped", example = "true")
        boolean applied
) {
}
