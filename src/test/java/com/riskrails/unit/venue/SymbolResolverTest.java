package com.riskrails.unit.venue;

import static org.assertj.core.api.Assertions.assertThat;

import com.riskrails.config.VenueProperties;
import com.riskrails.support.MutableClock;
import com.riskrails.venue.PaperVenueClient;
import com.riskrails.venue.ResolvedSymbol;
import com.riskrails.venue.SymbolResolver;
import com.riskrails.venue.VenueRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SymbolResolverTest {

    private SymbolResolver resolver;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2026-01-05T10:00:00Z");
        VenueRegistry registry = new VenueRegistry(List.of(
                new PaperVenueClient("BINANCE", clock),
                new PaperVenueClient("KRAKEN", clock),
                new PaperVenueClient("IBKR", clock)));
        resolver = new SymbolResolver(new VenueProperties(), registry);
    }

    @Test
    @DisplayName("Explicit venue suffix wins")
    void suffix() {
        ResolvedSymbol resolved = resolver.resolve(" solusd.kraken ", null);

        assertThat(resolved.getBase()).isEqualTo("SOLUSD");
        assertThat(resolved.getVenue()).isEqualTo("KRAKEN");
        assertThat(resolved.getMarket()).isNull();
    }

    @Test
    @DisplayName("Market hint naming a registered venue pins routing")
    void hintNamesVenue() {
        ResolvedSymbol resolved = resolver.resolve("BTCUSDT", "kraken");

        assertThat(resolved.getVenue()).isEqualTo("KRAKEN");
        assertThat(resolved.getMarket()).isNull();
    }

    @Test
    @DisplayName("Other market hints pass through and stablecoin pairs go to the crypto venue")
    void hintPassesThrough() {
        ResolvedSymbol resolved = resolver.resolve("ETHUSDC", "margin");

        assertThat(resolved.getVenue()).isEqualTo("BINANCE");
        assertThat(resolved.getMarket()).isEqualTo("margin");
    }

    @Test
    @DisplayName("Everything else goes to the default venue")
    void defaultVenue() {
        assertThat(resolver.resolve("MSFT", null).getVenue()).isEqualTo("IBKR");
        assertThat(SymbolResolver.baseOf("aapl.ibkr")).isEqualTo("AAPL");
    }
}
