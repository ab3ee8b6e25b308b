package uk.gegc.unfurl.shared.exception;

/**
 * Thrown when a resolution attempt is requested for an article that is already resolved or
 * permanently failed.
 */
public class ArticleNotPendingException extends RuntimeException {

    public ArticleNotPendingException(String message) {
        super(message);
    }
}
