package uk.gegc.unfurl.features.resolution.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "UrlRequest", description = "A single URL to decode or validate")
public record UrlRequest(
        @Schema(description = "URL", example = "https://news.google.com/rss/articles/CBMiK2h0dHBzOi8vZXhhbXBsZS5jb20vYQ")
        @NotBlank(message = "url must not be blank")
        String url
) {
}
