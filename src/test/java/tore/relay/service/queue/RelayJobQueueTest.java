package tore.relay.service.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCreator;
import org.springframework.jdbc.support.KeyHolder;
import tore.relay.dto.CanonicalEvent;
import tore.relay.exception.EnqueueException;
import tore.relay.support.MutableClock;
import tore.relay.support.QueueFixtures;

@DisplayName("RelayJobQueue Tests")
class RelayJobQueueTest {

    private static final Instant START = Instant.parse("2026-01-15T10:00:00Z");

    private MutableClock clock;
    private RelayJobQueue queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        queue = QueueFixtures.newQueue(clock, 3, 500);
    }

    @Nested
    @DisplayName("Enqueue and claim")
    class EnqueueAndClaim {

        @Test
        @DisplayName("Should hand out jobs in insertion order with the payload intact")
        void shouldClaimInInsertionOrder() {
            CanonicalEvent first = QueueFixtures.event("NftLocked", 100, 1);
            CanonicalEvent second = QueueFixtures.event("NftUnlocked", 100, 2);
            JobHandle firstHandle = queue.enqueue("NftLocked", first);
            queue.enqueue("NftUnlocked", second);

            QueueJob claimed = queue.claimNext().orElseThrow();

            assertThat(claimed.id()).isEqualTo(firstHandle.id());
            assertThat(claimed.name()).isEqualTo("NftLocked");
            assertThat(claimed.payload()).isEqualTo(first);
            assertThat(claimed.status()).isEqualTo(JobStatus.ACTIVE);
            assertThat(claimed.attemptCount()).isEqualTo(1);
            assertThat(queue.claimNext().orElseThrow().payload()).isEqualTo(second);
            assertThat(queue.claimNext()).isEmpty();
        }

        @Test
        @DisplayName("Should reject blank job names")
        void shouldRejectBlankName() {
            assertThatThrownBy(() -> queue.enqueue(" ", QueueFixtures.event("NftLocked", 1, 0)))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should raise EnqueueException when storage is unavailable")
        void shouldWrapStorageErrors() {
            JdbcTemplate brokenTemplate = mock(JdbcTemplate.class);
            when(brokenTemplate.update(any(PreparedStatementCreator.class), any(KeyHolder.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));
            RelayJobQueue broken = new RelayJobQueue(brokenTemplate, new ObjectMapper(), "relay_jobs", 3,
                ExponentialBackoff.of(Duration.ofSeconds(5)), 500, clock);

            assertThatThrownBy(() -> broken.enqueue("NftLocked", QueueFixtures.event("NftLocked", 1, 0)))
                .isInstanceOf(EnqueueException.class)
                .hasMessageContaining("connection refused");
        }

        @Test
        @DisplayName("Should reject unsafe table names")
        void shouldRejectUnsafeTableName() {
            assertThatThrownBy(() -> new RelayJobQueue(mock(JdbcTemplate.class), new ObjectMapper(),
                "jobs; DROP TABLE x", 3, ExponentialBackoff.of(Duration.ofSeconds(5)), 500, clock))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Retries")
    class Retries {

        @Test
        @DisplayName("Should delay retries exponentially and park the job after the last attempt")
        void shouldRetryWithBackoffThenFail() {
            queue.enqueue("NftLocked", QueueFixtures.event("NftLocked", 100, 1));

            QueueJob attempt1 = queue.claimNext().orElseThrow();
            assertThat(queue.fail(attempt1, "HTTP 500")).isEqualTo(JobStatus.WAITING);
            assertThat(queue.find(attempt1.id()).orElseThrow().availableAt()).isEqualTo(START.plusSeconds(5));
            assertThat(queue.claimNext()).isEmpty();

            clock.advance(Duration.ofSeconds(5));
            QueueJob attempt2 = queue.claimNext().orElseThrow();
            assertThat(attempt2.attemptCount()).isEqualTo(2);
            assertThat(queue.fail(attempt2, "HTTP 500")).isEqualTo(JobStatus.WAITING);
            assertThat(queue.find(attempt2.id()).orElseThrow().availableAt()).isEqualTo(START.plusSeconds(15));

            clock.advance(Duration.ofSeconds(9));
            assertThat(queue.claimNext()).isEmpty();
            clock.advance(Duration.ofSeconds(1));
            QueueJob attempt3 = queue.claimNext().orElseThrow();
            assertThat(attempt3.hasAttemptsLeft()).isFalse();
            assertThat(queue.fail(attempt3, "HTTP 500 again")).isEqualTo(JobStatus.FAILED);

            clock.advance(Duration.ofHours(1));
            assertThat(queue.claimNext()).isEmpty();
            assertThat(queue.failedJobs(10))
                .singleElement()
                .satisfies(job -> {
                    assertThat(job.lastError()).isEqualTo("HTTP 500 again");
                    assertThat(job.attemptCount()).isEqualTo(3);
                });
            assertThat(queue.counts()).isEqualTo(new QueueCounts(0, 0, 0, 1));
        }

        @Test
        @DisplayName("Should move a failed job back to waiting with a fresh budget")
        void shouldRetryFailedJob() {
            RelayJobQueue singleAttempt = QueueFixtures.newQueue(clock, 1, 500);
            long id = singleAttempt.enqueue("NftLocked", QueueFixtures.event("NftLocked", 1, 0)).id();
            singleAttempt.fail(singleAttempt.claimNext().orElseThrow(), "boom");

            assertThat(singleAttempt.retryFailed(id)).isTrue();
            assertThat(singleAttempt.retryFailed(id)).isFalse();
            assertThat(singleAttempt.retryFailed(9999)).isFalse();

            QueueJob again = singleAttempt.claimNext().orElseThrow();
            assertThat(again.id()).isEqualTo(id);
            assertThat(again.attemptCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should truncate long error messages")
        void shouldTruncateErrors() {
            RelayJobQueue singleAttempt = QueueFixtures.newQueue(clock, 1, 500);
            singleAttempt.enqueue("NftLocked", QueueFixtures.event("NftLocked", 1, 0));
            singleAttempt.fail(singleAttempt.claimNext().orElseThrow(), "e".repeat(5000));

            assertThat(singleAttempt.failedJobs(1).get(0).lastError()).hasSize(1024);
        }
    }

    @Nested
    @DisplayName("Maintenance")
    class Maintenance {

        @Test
        @DisplayName("Should keep only the newest completed jobs")
        void shouldPruneCompletedJobs() {
            RelayJobQueue small = QueueFixtures.newQueue(clock, 3, 2);
            for (int i = 0; i < 4; i++) {
                small.enqueue("NftLocked", QueueFixtures.event("NftLocked", 100 + i, 0));
            }
            Optional<QueueJob> next;
            while ((next = small.claimNext()).isPresent()) {
                small.complete(next.get());
            }

            assertThat(small.jobs(JobStatus.COMPLETED))
                .extracting(job -> job.payload().blockNumber())
                .containsExactly(102L, 103L);
        }

        @Test
        @DisplayName("Should hand stalled jobs out again")
        void shouldRecoverStalledJobs() {
            queue.enqueue("NftLocked", QueueFixtures.event("NftLocked", 100, 1));
            QueueJob claimed = queue.claimNext().orElseThrow();

            assertThat(queue.recoverStalled(Duration.ofMinutes(5))).isZero();
            clock.advance(Duration.ofMinutes(6));
            assertThat(queue.recoverStalled(Duration.ofMinutes(5))).isEqualTo(1);

            QueueJob reclaimed = queue.claimNext().orElseThrow();
            assertThat(reclaimed.id()).isEqualTo(claimed.id());
            assertThat(reclaimed.attemptCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should count jobs per status")
        void shouldCountJobs() {
            queue.enqueue("NftLocked", QueueFixtures.event("NftLocked", 1, 0));
            queue.enqueue("NftLocked", QueueFixtures.event("NftLocked", 2, 0));
            queue.complete(queue.claimNext().orElseThrow());

            QueueCounts counts = queue.counts();
            assertThat(counts).isEqualTo(new QueueCounts(1, 0, 1, 0));
            assertThat(counts.total()).isEqualTo(2);
        }
    }
}
