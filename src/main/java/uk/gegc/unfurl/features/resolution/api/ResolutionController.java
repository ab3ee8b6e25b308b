package uk.gegc.unfurl.features.resolution.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.unfurl.features.decoder.application.WrapperDecoder;
import uk.gegc.unfurl.features.decoder.domain.model.EncodingVariant;
import uk.gegc.unfurl.features.resolution.api.dto.ArticleResolutionResponse;
import uk.gegc.unfurl.features.resolution.api.dto.BackoffResponse;
import uk.gegc.unfurl.features.resolution.api.dto.ClassifyRequest;
import uk.gegc.unfurl.features.resolution.api.dto.ClassifyResponse;
import uk.gegc.unfurl.features.resolution.api.dto.DecodeResponse;
import uk.gegc.unfurl.features.resolution.api.dto.RetryStateResponse;
import uk.gegc.unfurl.features.resolution.api.dto.TrackArticleRequest;
import uk.gegc.unfurl.features.resolution.api.dto.UrlRequest;
import uk.gegc.unfurl.features.resolution.api.dto.VariantResponse;
import uk.gegc.unfurl.features.resolution.application.ResolutionService;
import uk.gegc.unfurl.features.resolution.infra.mapping.ResolutionMapper;
import uk.gegc.unfurl.features.retry.application.ResolutionRetryScheduler;
import uk.gegc.unfurl.features.retry.domain.model.RetryClassification;
import uk.gegc.unfurl.features.urlsafety.application.UrlSafetyValidator;

import java.net.URI;
import java.time.Duration;

/**
 * REST controller for wrapped-link resolution.
 * Exposes the decoder, the safety gate and the retry policy, plus on-demand resolution of tracked articles.
 */
@RestController
@RequestMapping("/api/v1/resolutions")
@RequiredArgsConstructor
@Validated
@Slf4j
@Tag(name = "Resolution", description = "Wrapped link decoding, outbound URL safety checks and retry policy")
public class ResolutionController {

    private final WrapperDecoder wrapperDecoder;
    private final UrlSafetyValidator urlSafetyValidator;
    private final ResolutionRetryScheduler retryScheduler;
    private final ResolutionService resolutionService;
    private final ResolutionMapper mapper;

    @Operation(
            summary = "Decode a wrapped link",
            description = "Recovers the canonical destination. Blocked and failed decodes are reported in the body, not as errors"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Decode attempted",
                    content = @Content(schema = @Schema(implementation = DecodeResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "URL missing or blank")
    })
    @PostMapping(value = "/decode", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DecodeResponse> decode(@Valid @RequestBody UrlRequest request) {
        log.info("Decode requested");
        return ResponseEntity.ok(mapper.toDecodeResponse(wrapperDecoder.decode(request.url())));
    }

    @Operation(summary = "Detect encoding variant", description = "Pure string inspection, performs no network access")
    @GetMapping("/variant")
    public ResponseEntity<VariantResponse> variant(
            @Parameter(description = "Wrapped link", required = true) @RequestParam("url") @NotBlank String url) {
        EncodingVariant variant = wrapperDecoder.detectVariant(url);
        return ResponseEntity.ok(new VariantResponse(url, variant, variant == EncodingVariant.LEGACY_EMBEDDED));
    }

    @Operation(summary = "Validate an outbound URL", description = "Runs the full safety gate, DNS resolution included")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "URL is safe to fetch"),
            @ApiResponse(responseCode = "400", description = "URL missing or blank"),
            @ApiResponse(responseCode = "422", description = "URL blocked by the safety gate")
    })
    @PostMapping(value = "/validate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Void> validate(@Valid @RequestBody UrlRequest request) {
        urlSafetyValidator.validate(request.url());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Classify an error", description = "Whether the error text would be retried or fail permanently")
    @PostMapping(value = "/classify", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ClassifyResponse> classify(@Valid @RequestBody ClassifyRequest request) {
        RetryClassification classification = retryScheduler.classifyFailure(request.error());
        return ResponseEntity.ok(new ClassifyResponse(classification, classification == RetryClassification.RETRYABLE));
    }

    @Operation(summary = "Sample the retry backoff", description = "Exponential backoff with jitter for the given retry count")
    @GetMapping("/backoff")
    public ResponseEntity<BackoffResponse> backoff(
            @Parameter(description = "Retries already scheduled", example = "0")
            @RequestParam("retryCount") @Min(0) @Max(30) int retryCount) {
        Duration backoff = retryScheduler.computeBackoff(retryCount);
        return ResponseEntity.ok(new BackoffResponse(retryCount, backoff.toSeconds(), backoff.toMillis()));
    }

    @Operation(summary = "Track an article", description = "Registers an ingested article so failed attempts can be retried")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Article is now tracked"),
            @ApiResponse(responseCode = "200", description = "Article was already tracked"),
            @ApiResponse(responseCode = "400", description = "Validation failed")
    })
    @PostMapping(value = "/articles", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RetryStateResponse> track(@Valid @RequestBody TrackArticleRequest request) {
        boolean created = resolutionService.track(request.articleId(), request.wrappedUrl());
        RetryStateResponse body = mapper.toStateResponse(
                request.articleId(), resolutionService.getState(request.articleId()));
        if (!created) {
            return ResponseEntity.ok(body);
        }
        URI location = URI.create("/api/v1/resolutions/articles/" + request.articleId());
        return ResponseEntity.created(location).body(body);
    }

    @Operation(summary = "Get retry state of a tracked article")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "State returned"),
            @ApiResponse(responseCode = "404", description = "Article is not tracked")
    })
    @GetMapping("/articles/{articleId}")
    public ResponseEntity<RetryStateResponse> getState(@PathVariable Long articleId) {
        return ResponseEntity.ok(mapper.toStateResponse(articleId, resolutionService.getState(articleId)));
    }

    @Operation(
            summary = "Resolve a tracked article now",
            description = "Runs one attempt and reports the outcome to the retry scheduler"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Attempt made",
                    content = @Content(schema = @Schema(implementation = ArticleResolutionResponse.class))
            ),
            @ApiResponse(responseCode = "404", description = "Article is not tracked"),
            @ApiResponse(responseCode = "409", description = "Article is already resolved or permanently failed")
    })
    @PostMapping("/articles/{articleId}/resolve")
    @ResponseStatus(HttpStatus.OK)
    public ArticleResolutionResponse resolve(@PathVariable Long articleId) {
        log.info("On-demand resolution of article {}", articleId);
        return mapper.toArticleResponse(resolutionService.resolveTracked(articleId));
    }
}
