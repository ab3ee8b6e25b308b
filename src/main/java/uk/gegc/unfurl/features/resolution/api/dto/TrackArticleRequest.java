package uk.gegc.unfurl.features.resolution.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

@Schema(name = "TrackArticleRequest", description = "Registers an ingested article for resolution")
public record TrackArticleRequest(
        @Schema(description = "Article id assigned by ingestion", example = "42")
        @NotNull(message = "articleId is required")
        @Positive(message = "articleId must be positive")
        Long articleId,

        @Schema(description = "Wrapped link as found in the feed")
        @NotBlank(message = "wrappedUrl must not be blank")
        String wrappedUrl
) {
}
