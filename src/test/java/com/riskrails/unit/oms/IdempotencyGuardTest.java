package com.riskrails.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.riskrails.config.IdempotencyProperties;
import com.riskrails.domain.enums.ExecutionStatus;
import com.riskrails.domain.model.ExecutionResult;
import com.riskrails.exception.IdempotencyConflictException;
import com.riskrails.oms.IdempotencyGuard;
import com.riskrails.oms.IdempotencyStore;
import com.riskrails.oms.InMemoryIdempotencyStore;
import com.riskrails.support.MutableClock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for IdempotencyGuard over the in-memory store: reserve, complete, release, claim
 * expiry and concurrent claims on one key.
 */
class IdempotencyGuardTest {

    private MutableClock clock;
    private IdempotencyProperties properties;
    private IdempotencyGuard guard;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-05T10:00:00Z");
        properties = new IdempotencyProperties();
        guard = new IdempotencyGuard(new InMemoryIdempotencyStore(properties, clock), properties);
    }

    private static ExecutionResult submitted(String key) {
        return ExecutionResult.builder().status(ExecutionStatus.SUBMITTED).idempotencyKey(key).symbol("BTCUSDT").build();
    }

    // ==============================
    // PROTOCOL
    // ==============================

    @Nested
    @DisplayName("Reserve / complete / release")
    class Protocol {

        @Test
        @DisplayName("Second reserve while the first is in flight is PENDING")
        void inFlight_pending() {
            guard.reserve("k1");

            IdempotencyConflictException conflict =
                    catchThrowableOfType(() -> guard.reserve("k1"), IdempotencyConflictException.class);

            assertThat(conflict.getKind()).isEqualTo(IdempotencyConflictException.Kind.PENDING);
            assertThat(conflict.getStoredResult()).isNull();
        }

        @Test
        @DisplayName("Completed key replays the stored result")
        void completed_replays() {
            guard.reserve("k1");
            guard.complete("k1", submitted("k1"));

            IdempotencyConflictException conflict =
                    catchThrowableOfType(() -> guard.reserve("k1"), IdempotencyConflictException.class);

            assertThat(conflict.getKind()).isEqualTo(IdempotencyConflictException.Kind.REPLAYED);
            assertThat(conflict.getStoredResult().getStatus()).isEqualTo(ExecutionStatus.SUBMITTED);
            assertThat(conflict.getKey()).isEqualTo("k1");
        }

        @Test
        @DisplayName("Released key can be reserved again and nothing is replayed")
        void released_freesKey() {
            guard.reserve("k1");
            guard.release("k1");

            assertThatCode(() -> guard.reserve("k1")).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Abandoned claim lapses after its TTL")
        void abandonedClaim_expires() {
            guard.reserve("k1");

            clock.advance(properties.getClaimTtl().minusSeconds(1));
            assertThat(catchThrowableOfType(() -> guard.reserve("k1"), IdempotencyConflictException.class))
                    .isNotNull();

            clock.advance(Duration.ofSeconds(2));
            assertThatCode(() -> guard.reserve("k1")).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Stored result stops replaying once the response TTL has passed on the clock")
        void storedResult_expiresWithClock() {
            guard.reserve("k1");
            guard.complete("k1", submitted("k1"));

            clock.advance(properties.getResponseTtl().minusSeconds(1));
            assertThat(catchThrowableOfType(() -> guard.reserve("k1"), IdempotencyConflictException.class)
                    .getKind()).isEqualTo(IdempotencyConflictException.Kind.REPLAYED);

            clock.advance(Duration.ofSeconds(2));
            assertThatCode(() -> guard.reserve("k1")).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Holder completing between the two reads is reported as a replay")
        void completedDuringClaim_replays() {
            IdempotencyStore store = mock(IdempotencyStore.class);
            when(store.findResult("k1")).thenReturn(Optional.empty(), Optional.of(submitted("k1")));
            when(store.tryClaim(anyString(), any())).thenReturn(false);
            IdempotencyGuard racingGuard = new IdempotencyGuard(store, properties);

            IdempotencyConflictException conflict =
                    catchThrowableOfType(() -> racingGuard.reserve("k1"), IdempotencyConflictException.class);

            assertThat(conflict.getKind()).isEqualTo(IdempotencyConflictException.Kind.REPLAYED);
        }
    }

    // ==============================
    // CONCURRENCY
    // ==============================

    @Test
    @DisplayName("Concurrent reserves on one key: exactly one wins")
    void concurrentReserve_singleWinner() throws Exception {
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Boolean>> outcomes = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                outcomes.add(pool.submit(() -> {
                    start.await(5, TimeUnit.SECONDS);
                    try {
                        guard.reserve("shared");
                        return true;
                    } catch (IdempotencyConflictException e) {
                        return false;
                    }
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> outcome : outcomes) {
                if (outcome.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
