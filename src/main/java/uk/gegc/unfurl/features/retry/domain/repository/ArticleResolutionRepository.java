package uk.gegc.unfurl.features.retry.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.unfurl.features.retry.domain.model.ArticleResolution;
import uk.gegc.unfurl.features.retry.domain.model.ArticleResolutionStatus;

import java.time.Instant;
import java.util.List;

@Repository
public interface ArticleResolutionRepository extends JpaRepository<ArticleResolution, Long> {

    @Query("""
            SELECT a FROM ArticleResolution a
            WHERE a.status = :status
              AND a.nextRetryAt IS NOT NULL
              AND a.nextRetryAt <= :now
            ORDER BY a.nextRetryAt ASC
            """)
    List<ArticleResolution> findDue(@Param("status") ArticleResolutionStatus status,
                                    @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ArticleResolution a
            SET a.retryCount = :newRetryCount,
                a.nextRetryAt = :nextRetryAt,
                a.lastError = :error,
                a.version = a.version + 1,
                a.updatedAt = :now
            WHERE a.id = :id
              AND a.status = :pending
              AND a.retryCount = :expectedRetryCount
            """)
    int scheduleRetry(@Param("id") Long id,
                      @Param("expectedRetryCount") int expectedRetryCount,
                      @Param("newRetryCount") int newRetryCount,
                      @Param("nextRetryAt") Instant nextRetryAt,
                      @Param("error") String error,
                      @Param("pending") ArticleResolutionStatus pending,
                      @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ArticleResolution a
            SET a.status = :failed,
                a.nextRetryAt = NULL,
                a.lastError = :error,
                a.version = a.version + 1,
                a.updatedAt = :now
            WHERE a.id = :id
              AND a.status = :pending
            """)
    int markPermanentlyFailed(@Param("id") Long id,
                              @Param("error") String error,
                              @Param("pending") ArticleResolutionStatus pending,
                              @Param("failed") ArticleResolutionStatus failed,
                              @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ArticleResolution a
            SET a.status = :resolved,
                a.canonicalUrl = :canonicalUrl,
                a.nextRetryAt = NULL,
                a.lastError = NULL,
                a.processedAt = :now,
                a.version = a.version + 1,
                a.updatedAt = :now
            WHERE a.id = :id
              AND a.status = :pending
            """)
    int markResolved(@Param("id") Long id,
                     @Param("canonicalUrl") String canonicalUrl,
                     @Param("pending") ArticleResolutionStatus pending,
                     @Param("resolved") ArticleResolutionStatus resolved,
                     @Param("now") Instant now);
}
