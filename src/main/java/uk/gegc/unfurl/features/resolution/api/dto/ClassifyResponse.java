package uk.gegc.unfurl.features.resolution.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.unfurl.features.retry.domain.model.RetryClassification;

@Schema(name = "ClassifyResponse", description = "Retry classification of an error")
public record ClassifyResponse(
        @Schema(description = "Classification", example = "RETRYABLE")
        RetryClassification classification,

        @Schema(description = "Whether a retry would be scheduled", example = "true")
        boolean retryable
) {
}
