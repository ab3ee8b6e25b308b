package uk.gegc.unfurl.features.retry.infra;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import uk.gegc.unfurl.features.retry.domain.model.ArticleRef;
import uk.gegc.unfurl.features.retry.domain.model.ArticleResolution;
import uk.gegc.unfurl.features.retry.domain.model.ArticleResolutionStatus;
import uk.gegc.unfurl.features.retry.domain.model.RetryState;
import uk.gegc.unfurl.features.retry.domain.repository.ArticleResolutionRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({JpaArticleRetryStore.class, JpaArticleRetryStoreTest.FixedClockConfig.class})
@DisplayName("JpaArticleRetryStore Tests")
class JpaArticleRetryStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");
    private static final String WRAPPED = "https://news.google.com/rss/articles/AU_yqLPrOVZ5tjs";

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private JpaArticleRetryStore store;

    @Autowired
    private ArticleResolutionRepository repository;

    @BeforeEach
    void setUp() {
        store.track(1L, WRAPPED);
    }

    @Test
    @DisplayName("track: new article starts pending with no retries")
    void track_newArticle_isPending() {
        RetryState state = store.findState(1L).orElseThrow();

        assertThat(state.status()).isEqualTo(ArticleResolutionStatus.PENDING);
        assertThat(state.retryCount()).isZero();
        assertThat(state.nextRetryAt()).isNull();
        assertThat(store.findTracked(1L)).contains(new ArticleRef(1L, WRAPPED, 0));
    }

    @Test
    @DisplayName("track: already tracked article is left untouched")
    void track_duplicate_returnsFalse() {
        assertThat(store.track(1L, "https://news.google.com/rss/articles/other")).isFalse();
        assertThat(store.findTracked(1L).orElseThrow().wrappedUrl()).isEqualTo(WRAPPED);
    }

    @Test
    @DisplayName("recordFailure: applies only when the stored count is one behind")
    void recordFailure_conditionalOnCount() {
        Instant due = NOW.plusSeconds(65);

        assertThat(store.recordFailure(1L, "timeout", 1, due)).isTrue();
        // Same transition computed from the same stale state loses
        assertThat(store.recordFailure(1L, "timeout", 1, due)).isFalse();

        RetryState state = store.findState(1L).orElseThrow();
        assertThat(state.retryCount()).isEqualTo(1);
        assertThat(state.nextRetryAt()).isEqualTo(due);
        assertThat(state.lastError()).isEqualTo("timeout");
        assertThat(state.status()).isEqualTo(ArticleResolutionStatus.PENDING);
    }

    @Test
    @DisplayName("recordFailure: rejects a count below one")
    void recordFailure_zeroCount_throws() {
        assertThatThrownBy(() -> store.recordFailure(1L, "timeout", 0, NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("recordFailure: long error text is truncated")
    void recordFailure_truncatesError() {
        store.recordFailure(1L, "x".repeat(5000), 1, NOW.plusSeconds(60));

        assertThat(store.findState(1L).orElseThrow().lastError())
                .hasSize(ArticleResolution.MAX_ERROR_LENGTH);
    }

    @Test
    @DisplayName("recordPermanentFailure: terminal state keeps the count and clears the due time")
    void recordPermanentFailure_isTerminal() {
        store.recordFailure(1L, "timeout", 1, NOW.plusSeconds(60));

        assertThat(store.recordPermanentFailure(1L, "HTTP error 404 when fetching URL")).isTrue();

        RetryState state = store.findState(1L).orElseThrow();
        assertThat(state.isTerminal()).isTrue();
        assertThat(state.retryCount()).isEqualTo(1);
        assertThat(state.lastError()).isEqualTo("HTTP error 404 when fetching URL");
        assertThat(store.recordPermanentFailure(1L, "again")).isFalse();
        assertThat(store.recordFailure(1L, "timeout", 2, NOW.plusSeconds(120))).isFalse();
    }

    @Test
    @DisplayName("recordSuccess: resolves once and clears retry bookkeeping")
    void recordSuccess_resolvesOnce() {
        store.recordFailure(1L, "timeout", 1, NOW.plusSeconds(60));

        assertThat(store.recordSuccess(1L, "https://example.com/story")).isTrue();
        assertThat(store.recordSuccess(1L, "https://example.com/story")).isFalse();

        ArticleResolution row = repository.findById(1L).orElseThrow();
        assertThat(row.getStatus()).isEqualTo(ArticleResolutionStatus.RESOLVED);
        assertThat(row.getCanonicalUrl()).isEqualTo("https://example.com/story");
        assertThat(row.getNextRetryAt()).isNull();
        assertThat(row.getLastError()).isNull();
        assertThat(row.getProcessedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("recordSuccess: permanently failed article stays failed")
    void recordSuccess_afterPermanentFailure_notApplied() {
        store.recordPermanentFailure(1L, "HTTP error 404 when fetching URL");

        assertThat(store.recordSuccess(1L, "https://example.com/story")).isFalse();

        ArticleResolution row = repository.findById(1L).orElseThrow();
        assertThat(row.getStatus()).isEqualTo(ArticleResolutionStatus.FAILED);
        assertThat(row.getCanonicalUrl()).isNull();
        assertThat(row.getProcessedAt()).isNull();
        assertThat(row.getLastError()).isEqualTo("HTTP error 404 when fetching URL");
    }

    @Test
    @DisplayName("recordSuccess: unknown article is not applied")
    void recordSuccess_unknownArticle_returnsFalse() {
        assertThat(store.recordSuccess(404L, "https://example.com")).isFalse();
    }

    @Test
    @DisplayName("findDueForRetry: returns pending rows that are due, oldest first")
    void findDueForRetry_returnsDueRowsInOrder() {
        store.track(2L, WRAPPED + "2");
        store.track(3L, WRAPPED + "3");
        store.track(4L, WRAPPED + "4");
        store.recordFailure(1L, "timeout", 1, NOW.minusSeconds(10));
        store.recordFailure(2L, "timeout", 1, NOW.minusSeconds(120));
        store.recordFailure(3L, "timeout", 1, NOW.plusSeconds(60));
        store.recordFailure(4L, "timeout", 1, NOW.minusSeconds(30));
        store.recordPermanentFailure(4L, "max retries exceeded");

        List<ArticleRef> due = store.findDueForRetry(NOW);

        assertThat(due).extracting(ArticleRef::articleId).containsExactly(2L, 1L);
        assertThat(due).allSatisfy(ref -> assertThat(ref.retryCount()).isEqualTo(1));
    }
}
