package uk.gegc.unfurl.features.resolution.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.unfurl.features.decoder.domain.model.EncodingVariant;
import uk.gegc.unfurl.features.decoder.domain.model.FailureReason;
import uk.gegc.unfurl.features.decoder.domain.model.ResolutionStatus;

@Schema(name = "DecodeResponse", description = "Outcome of decoding one wrapped link")
public record DecodeResponse(
        @Schema(description = "Outcome", example = "RESOLVED")
        ResolutionStatus status,

        @Schema(description = "Canonical destination, only when resolved", example = "https://example.com/a")
        String canonicalUrl,

        @Schema(description = "Encoding variant that was used", example = "LEGACY_EMBEDDED")
        EncodingVariant variant,

        @Schema(description = "Failure variant when blocked or failed", example = "TIMEOUT")
        FailureReason reason,

        @Schema(description = "Response status when the failure was an HTTP error", example = "503")
        Integer httpStatus,

        @Schema(description = "Human-readable failure detail")
        String message
) {
}
