package uk.gegc.unfurl.features.resolution.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "ClassifyRequest", description = "Free-text error to classify")
public record ClassifyRequest(
        @Schema(description = "Error text", example = "HTTP request failed: timeout after 10000 ms")
        @NotBlank(message = "error must not be blank")
        String error
) {
}
