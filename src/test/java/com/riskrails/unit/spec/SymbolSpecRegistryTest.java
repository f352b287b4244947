package com.riskrails.unit.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.riskrails.domain.model.SymbolSpec;
import com.riskrails.exception.VenueErrorType;
import com.riskrails.exception.VenueException;
import com.riskrails.risk.VenueHealthMonitor;
import com.riskrails.spec.StaticSpecCatalog;
import com.riskrails.spec.SymbolSpecRegistry;
import com.riskrails.venue.VenueClient;
import com.riskrails.venue.VenueRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class SymbolSpecRegistryTest {

    private static final SymbolSpec LIVE = SymbolSpec.builder()
            .minQuantity(new BigDecimal("0.001"))
            .quantityStep(new BigDecimal("0.001"))
            .minNotional(new BigDecimal("10"))
            .build();

    private VenueClient binance;
    private VenueHealthMonitor healthMonitor;
    private SymbolSpecRegistry registry;

    @BeforeEach
    void setUp() {
        binance = mock(VenueClient.class);
        when(binance.name()).thenReturn("BINANCE");
        healthMonitor = mock(VenueHealthMonitor.class);
        registry = new SymbolSpecRegistry(
                new VenueRegistry(List.of(binance)), new StaticSpecCatalog(""), healthMonitor, Duration.ofHours(12));
    }

    // ==============================
    // SOURCES
    // ==============================

    @Nested
    @DisplayName("Spec sources")
    class Sources {

        @Test
        @DisplayName("Live constraints are cached after the first lookup")
        void liveSpec_cached() {
            when(binance.lotConstraints("BTCUSDT")).thenReturn(Optional.of(LIVE));

            Optional<SymbolSpec> first = registry.get("BINANCE", "BTCUSDT");
            Optional<SymbolSpec> second = registry.get("binance", "btcusdt");

            assertThat(first).contains(LIVE.normalized());
            assertThat(second).isEqualTo(first);
            verify(binance, times(1)).lotConstraints("BTCUSDT");
            verify(healthMonitor).recordResult(true);
        }

        @Test
        @DisplayName("Venue without published constraints falls back to the static catalog")
        void staticFallback() {
            when(binance.lotConstraints("ETHUSDT")).thenReturn(Optional.empty());

            Optional<SymbolSpec> spec = registry.get("BINANCE", "ETHUSDT");

            assertThat(spec).hasValueSatisfying(s -> {
                assertThat(s.getQuantityStep()).isEqualByComparingTo("0.0001");
                assertThat(s.getMinNotional()).isEqualByComparingTo("5");
            });
        }

        @Test
        @DisplayName("Venue failure serves the static default uncached, then retries the venue")
        void venueFailure_notCached() {
            when(binance.lotConstraints("BTCUSDT"))
                    .thenThrow(new VenueException("BINANCE", VenueErrorType.UNAVAILABLE, 503, "down"))
                    .thenReturn(Optional.of(LIVE));

            Optional<SymbolSpec> degraded = registry.get("BINANCE", "BTCUSDT");
            Optional<SymbolSpec> recovered = registry.get("BINANCE", "BTCUSDT");

            assertThat(degraded).hasValueSatisfying(s -> assertThat(s.getQuantityStep()).isEqualByComparingTo("0.00001"));
            assertThat(recovered).contains(LIVE.normalized());
            InOrder order = inOrder(healthMonitor);
            order.verify(healthMonitor).recordResult(false);
            order.verify(healthMonitor).recordResult(true);
        }

        @Test
        @DisplayName("Alias venues resolve through the catalog")
        void aliasVenue() {
            Optional<SymbolSpec> spec = registry.get("BINANCE_MARGIN", "BTCUSDT");

            assertThat(spec).hasValueSatisfying(s -> assertThat(s.getPriceTick()).isEqualByComparingTo("0.01"));
        }

        @Test
        @DisplayName("Unknown venue and symbol yields empty")
        void unknown() {
            assertThat(registry.get("BYBIT", "XYZUSDT")).isEmpty();
        }
    }

    // ==============================
    // NORMALIZATION AND CONCURRENCY
    // ==============================

    @Test
    @DisplayName("Invalid live values are repaired before caching")
    void normalizesLiveSpec() {
        when(binance.lotConstraints("BNBUSDT")).thenReturn(Optional.of(SymbolSpec.builder()
                .minQuantity(new BigDecimal("-1"))
                .quantityStep(BigDecimal.ZERO)
                .maxNotional(BigDecimal.ZERO)
                .build()));

        SymbolSpec spec = registry.get("BINANCE", "BNBUSDT").orElseThrow();

        assertThat(spec.getMinQuantity()).isEqualByComparingTo("0");
        assertThat(spec.getQuantityStep()).isEqualByComparingTo(SymbolSpec.DEFAULT_STEP);
        assertThat(spec.getMinNotional()).isEqualByComparingTo("0");
        assertThat(spec.getMaxNotional()).isNull();
    }

    @Test
    @DisplayName("Concurrent cold lookups of one symbol make a single venue call")
    void concurrentLookups_singleFlight() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        when(binance.lotConstraints("BTCUSDT")).thenAnswer(invocation -> {
            calls.incrementAndGet();
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return Optional.of(LIVE);
        });

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            Future<Optional<SymbolSpec>> first = pool.submit(() -> registry.get("BINANCE", "BTCUSDT"));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
            List<Future<Optional<SymbolSpec>>> waiters = List.of(
                    pool.submit(() -> registry.get("BINANCE", "BTCUSDT")),
                    pool.submit(() -> registry.get("BINANCE", "BTCUSDT")),
                    pool.submit(() -> registry.get("BINANCE", "BTCUSDT")));
            release.countDown();

            assertThat(first.get(5, TimeUnit.SECONDS)).contains(LIVE.normalized());
            for (Future<Optional<SymbolSpec>> waiter : waiters) {
                assertThat(waiter.get(5, TimeUnit.SECONDS)).contains(LIVE.normalized());
            }
            assertThat(calls.get()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
