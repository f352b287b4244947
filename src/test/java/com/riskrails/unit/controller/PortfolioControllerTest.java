package com.riskrails.unit.controller;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.riskrails.api.controller.PortfolioController;
import com.riskrails.config.ApiResponseAdvice;
import com.riskrails.domain.enums.OrderSide;
import com.riskrails.exception.GlobalExceptionHandler;
import com.riskrails.ledger.PositionLedger;
import com.riskrails.support.MutableClock;
import com.riskrails.venue.PaperVenueClient;
import com.riskrails.venue.VenueRegistry;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class PortfolioControllerTest {

    private MockMvc mockMvc;
    private PositionLedger positionLedger;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2026-01-05T10:00:00Z");
        positionLedger = new PositionLedger(new BigDecimal("100000"), clock);
        VenueRegistry venueRegistry = new VenueRegistry(List.of(new PaperVenueClient("BINANCE", clock)));
        mockMvc = MockMvcBuilders.standaloneSetup(new PortfolioController(positionLedger, venueRegistry))
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice(clock))
                .build();
    }

    @Test
    @DisplayName("GET /api/portfolio returns the ledger snapshot")
    void getPortfolio() throws Exception {
        positionLedger.applyFill("BINANCE", "ETHUSDT", OrderSide.BUY, BigDecimal.ONE,
                new BigDecimal("3000"), new BigDecimal("3"));

        mockMvc.perform(get("/api/portfolio"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.path").value("/api/portfolio"))
                .andExpect(jsonPath("$.data.cash").value(99997))
                .andExpect(jsonPath("$.data.positions[0].symbol").value("ETHUSDT"))
                .andExpect(jsonPath("$.data.positions[0].quantity").value(1));
    }

    @Test
    @DisplayName("GET /api/portfolio/venues/{venue}/account returns the venue's balances")
    void getVenueAccount() throws Exception {
        mockMvc.perform(get("/api/portfolio/venues/binance/account"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.venue").value("BINANCE"))
                .andExpect(jsonPath("$.data.balances.CASH").value(100000));
    }

    @Test
    @DisplayName("Unknown venue is a 404")
    void unknownVenue() throws Exception {
        mockMvc.perform(get("/api/portfolio/venues/ftx/account"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.error.details.venue").value("FTX"));
    }
}
