package com.riskrails.config;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Venue routing and fee settings.
 *
 * <pre>
 * riskrails.venues.crypto-venue=BINANCE
 * riskrails.venues.default-venue=IBKR
 * riskrails.venues.crypto-quote-suffixes=USDT,USDC,BUSD
 * riskrails.venues.round-up-venues=KRAKEN
 * riskrails.venues.fee-bps.BINANCE=10
 * riskrails.venues.paper[0].name=BINANCE
 * riskrails.venues.paper[0].prices.BTCUSDT=50000
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "riskrails.venues")
public class VenueProperties {

    /** Venue for unqualified symbols quoted in a stablecoin. */
    private String cryptoVenue = "BINANCE";

    /** Venue for every other unqualified symbol. */
    private String defaultVenue = "IBKR";

    private List<String> cryptoQuoteSuffixes = new ArrayList<>(List.of("USDT", "USDC", "BUSD"));

    /** Venues whose quote-mode sizing rounds up to the next step instead of down. */
    private List<String> roundUpVenues = new ArrayList<>(List.of("KRAKEN"));

    /** Taker fee per venue in basis points. Venues not listed pay no fee. */
    private Map<String, BigDecimal> feeBps = new HashMap<>(Map.of("BINANCE", BigDecimal.TEN));

    /** Simulated venues created at startup. */
    private List<PaperVenue> paper = new ArrayList<>();

    @Data
    public static class PaperVenue {

        private String name;
        private BigDecimal slippageBps = BigDecimal.ZERO;
        private BigDecimal spreadBps = BigDecimal.ZERO;
        private boolean notionalOrders = true;
        private BigDecimal startingCash = new BigDecimal("100000");
        private Map<String, BigDecimal> prices = new HashMap<>();
    }
}
