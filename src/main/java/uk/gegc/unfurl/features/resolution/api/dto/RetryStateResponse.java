package uk.gegc.unfurl.features.resolution.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.unfurl.features.retry.domain.model.ArticleResolutionStatus;

import java.time.Instant;

@Schema(name = "RetryStateResponse", description = "Stored retry bookkeeping of a tracked article")
public record RetryStateResponse(
        @Schema(description = "Article id", example = "42")
        Long articleId,

        @Schema(description = "Lifecycle status", example = "PENDING")
        ArticleResolutionStatus status,

        @Schema(description = "Retries scheduled so far", example = "2")
        int retryCount,

        @Schema(description = "Next due time")
        Instant nextRetryAt,

        @Schema(description = "Last error, kept for display")
        String lastError,

        @Schema(description = "Whether no further attempts will be made", example = "false")
        boolean terminal
) {
}
