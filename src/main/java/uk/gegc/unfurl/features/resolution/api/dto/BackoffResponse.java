package uk.gegc.unfurl.features.resolution.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "BackoffResponse", description = "One sample of the retry backoff, jitter included")
public record BackoffResponse(
        @Schema(description = "Retry count the backoff was computed for", example = "1")
        int retryCount,

        @Schema(description = "Backoff in whole seconds", example = "124")
        long backoffSeconds,

        @Schema(description = "Backoff in milliseconds", example = "124381")
        long backoffMillis
) {
}
