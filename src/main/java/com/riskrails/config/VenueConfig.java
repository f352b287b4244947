package com.riskrails.config;

import com.riskrails.venue.PaperVenueClient;
import com.riskrails.venue.SymbolResolver;
import com.riskrails.venue.VenueClient;
import com.riskrails.venue.VenueRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Assembles the venue registry.
 *
 * <p>Paper venues listed under {@code riskrails.venues.paper[*]} are created here and seeded
 * with their configured prices. Any other {@link VenueClient} bean in the context is
 * registered alongside them. Components receive the registry by injection only.
 */
@Configuration
public class VenueConfig {

    private static final Logger log = LoggerFactory.getLogger(VenueConfig.class);

    @Bean
    public VenueRegistry venueRegistry(
            VenueProperties venueProperties, ObjectProvider<VenueClient> venueClients, Clock clock) {
        List<VenueClient> clients = new ArrayList<>();
        for (VenueProperties.PaperVenue paper : venueProperties.getPaper()) {
            clients.add(paperVenue(paper, clock));
        }
        venueClients.orderedStream().forEach(clients::add);
        return new VenueRegistry(clients);
    }

    @Bean
    public SymbolResolver symbolResolver(VenueProperties venueProperties, VenueRegistry venueRegistry) {
        return new SymbolResolver(venueProperties, venueRegistry);
    }

    static PaperVenueClient paperVenue(VenueProperties.PaperVenue paper, Clock clock) {
        PaperVenueClient client = new PaperVenueClient(
                paper.getName(),
                paper.getSlippageBps(),
                paper.getSpreadBps(),
                paper.isNotionalOrders(),
                paper.getStartingCash(),
                clock);
        for (Map.Entry<String, BigDecimal> price : paper.getPrices().entrySet()) {
            client.setPrice(price.getKey(), price.getValue());
        }
        log.info("Paper venue created: name={}, notionalOrders={}, symbols={}",
                client.name(), paper.isNotionalOrders(),
                paper.getPrices().keySet().stream().sorted().collect(Collectors.joining(",")));
        return client;
    }
}
