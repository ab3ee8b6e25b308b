package uk.gegc.unfurl.features.retry.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

@Entity
@Getter
@Setter
@Table(
        name = "article_resolution",
        indexes = {
                @Index(name = "idx_article_resolution_due", columnList = "status, next_retry_at")
        }
)
public class ArticleResolution {

    public static final int MAX_ERROR_LENGTH = 2000;

    // Article ids are owned by the ingestion side, never generated here
    @Id
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "wrapped_url", nullable = false, length = 2048)
    private String wrappedUrl;

    @Column(name = "canonical_url", length = 2048)
    private String canonicalUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ArticleResolutionStatus status = ArticleResolutionStatus.PENDING;

    @Column(name = "retry_count", nullable = false)
    private Integer retryCount = 0;

    @Column(name = "next_retry_at")
    private Instant nextRetryAt;

    @Column(name = "last_error", length = MAX_ERROR_LENGTH)
    private String lastError;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public ArticleRef toRef() {
        return new ArticleRef(id, wrappedUrl, retryCount);
    }

    public RetryState toRetryState() {
        return new RetryState(retryCount, nextRetryAt, lastError, status);
    }
}
