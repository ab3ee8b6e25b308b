package uk.gegc.unfurl.features.retry.domain.model;

/**
 * Identity of a tracked article plus what is needed to re-attempt it.
 */
public record ArticleRef(Long articleId, String wrappedUrl, int retryCount) {
}
