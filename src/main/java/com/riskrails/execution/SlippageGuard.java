package com.riskrails.execution;

import com.riskrails.config.ExecutionProperties;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-symbol slippage cutback.
 *
 * <p>Two independent states, both self-expiring:
 * <ul>
 *   <li><b>Size cutback:</b> when the average slippage over the rolling window exceeds the cap,
 *       new orders for the symbol are scaled by the size multiplier for the cutback duration.</li>
 *   <li><b>Scalp mute:</b> each fill whose slippage exceeds the cap is a violation; after
 *       {@code maxViolations} inside the violation window, intents tagged with the scalp tag
 *       are refused for the mute duration.</li>
 * </ul>
 */
@Component
public class SlippageGuard {

    private static final Logger log = LoggerFactory.getLogger(SlippageGuard.class);

    private record Sample(Instant at, BigDecimal bps) {}

    private static final class SymbolState {
        private final Deque<Sample> samples = new ArrayDeque<>();
        private final Deque<Instant> violations = new ArrayDeque<>();
        private Instant cutbackUntil = Instant.MIN;
        private Instant scalpMutedUntil = Instant.MIN;
    }

    private final ExecutionProperties.Slippage settings;
    private final Clock clock;
    private final Map<String, SymbolState> states = new ConcurrentHashMap<>();

    public SlippageGuard(ExecutionProperties executionProperties, Clock clock) {
        this.settings = executionProperties.getSlippage();
        this.clock = clock;
    }

    public void record(String symbol, BigDecimal slippageBps) {
        if (slippageBps == null) {
            return;
        }
        Instant now = clock.instant();
        SymbolState state = states.computeIfAbsent(key(symbol), k -> new SymbolState());
        synchronized (state) {
            state.samples.addLast(new Sample(now, slippageBps));
            Instant windowStart = now.minus(settings.getWindow());
            while (!state.samples.isEmpty() && state.samples.peekFirst().at().isBefore(windowStart)) {
                state.samples.removeFirst();
            }
            BigDecimal average = state.samples.stream()
                    .map(Sample::bps)
                    .reduce(BigDecimal.ZERO, BigDecimal::add)
                    .divide(BigDecimal.valueOf(state.samples.size()), 4, RoundingMode.HALF_UP);
            if (average.compareTo(settings.getCapBps()) > 0 && !now.isBefore(state.cutbackUntil)) {
                state.cutbackUntil = now.plus(settings.getCutbackDuration());
                log.warn("Slippage cutback ON: symbol={}, avgBps={}, capBps={}, multiplier={}, until={}",
                        symbol, average, settings.getCapBps(), settings.getSizeMultiplier(), state.cutbackUntil);
            }

            if (slippageBps.compareTo(settings.getCapBps()) > 0) {
                state.violations.addLast(now);
                Instant violationStart = now.minus(settings.getViolationWindow());
                while (!state.violations.isEmpty() && state.violations.peekFirst().isBefore(violationStart)) {
                    state.violations.removeFirst();
                }
                if (state.violations.size() >= settings.getMaxViolations()) {
                    state.scalpMutedUntil = now.plus(settings.getScalpMuteDuration());
                    state.violations.clear();
                    log.warn("Scalp style MUTED: symbol={}, violations={}, until={}",
                            symbol, settings.getMaxViolations(), state.scalpMutedUntil);
                }
            }
        }
    }

    /** Multiplier to apply to new order sizes for this symbol; 1 when no cutback is active. */
    public BigDecimal sizeMultiplier(String symbol) {
        SymbolState state = states.get(key(symbol));
        if (state == null) {
            return BigDecimal.ONE;
        }
        synchronized (state) {
            return clock.instant().isBefore(state.cutbackUntil) ? settings.getSizeMultiplier() : BigDecimal.ONE;
        }
    }

    public boolean isScalpMuted(String symbol) {
        SymbolState state = states.get(key(symbol));
        if (state == null) {
            return false;
        }
        synchronized (state) {
            return clock.instant().isBefore(state.scalpMutedUntil);
        }
    }

    public boolean isScalpTag(String tag) {
        return tag != null && tag.equalsIgnoreCase(settings.getScalpTag());
    }

    private static String key(String symbol) {
        return symbol.toUpperCase(Locale.ROOT);
    }
}
