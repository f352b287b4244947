package com.riskrails.domain.model;

import com.riskrails.domain.enums.ExecutionAlgorithm;
import com.riskrails.domain.enums.OrderSide;
import com.riskrails.domain.enums.TimeInForce;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * An instruction to trade, as produced by a strategy, a CLI or the REST API.
 *
 * <p>Exactly one of {@code quote} (notional in quote currency) or {@code quantity}
 * (base units) is expected; the admission controller rejects any other shape.
 * The symbol may be venue-qualified ({@code "BTCUSDT.BINANCE"}) or bare.
 *
 * <p>{@code marketHint} is either a registered venue name, which pins routing to
 * that venue, or a market label such as {@code spot} or {@code margin} which is
 * passed through to the venue unchanged.
 *
 * <p>{@code algorithm} selects how the router works the order. {@code limitPrice} and
 * {@code timeInForce} apply to {@link ExecutionAlgorithm#LIMIT}; {@code slices} and
 * {@code sliceInterval} to {@link ExecutionAlgorithm#TWAP}, falling back to configured
 * defaults when absent.
 */
@Value
@Builder(toBuilder = true)
public class OrderIntent {

    public static final String META_DRY_RUN = "dry_run";

    String symbol;
    OrderSide side;
    BigDecimal quote;
    BigDecimal quantity;
    String marketHint;
    String tag;
    String strategy;

    @Singular("meta")
    Map<String, Object> metadata;

    String idempotencyKey;
    Instant timestamp;

    @Builder.Default
    ExecutionAlgorithm algorithm = ExecutionAlgorithm.MARKET;

    BigDecimal limitPrice;
    TimeInForce timeInForce;
    Integer slices;
    Duration sliceInterval;

    public boolean isQuoteMode() {
        return quote != null && quantity == null;
    }

    /** Dry-run flag carried in metadata. Null when the intent does not say. */
    public Boolean dryRunFlag() {
        Object flag = metadata != null ? metadata.get(META_DRY_RUN) : null;
        if (flag == null) {
            return null;
        }
        if (flag instanceof Boolean bool) {
            return bool;
        }
        return Boolean.parseBoolean(flag.toString());
    }
}
