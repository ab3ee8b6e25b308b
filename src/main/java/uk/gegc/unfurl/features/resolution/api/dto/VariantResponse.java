package uk.gegc.unfurl.features.resolution.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.unfurl.features.decoder.domain.model.EncodingVariant;

@Schema(name = "VariantResponse", description = "Encoding variant detected for a wrapped link")
public record VariantResponse(
        @Schema(description = "Inspected link")
        String url,

        @Schema(description = "Detected variant", example = "REDIRECT_BASED")
        EncodingVariant variant,

        @Schema(description = "Whether the link can be decoded without network access", example = "false")
        boolean legacy
) {
}
