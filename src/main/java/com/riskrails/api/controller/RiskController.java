package com.riskrails.api.controller;

import com.riskrails.api.dto.request.TradingSwitchRequest;
import com.riskrails.risk.AdmissionController;
import com.riskrails.risk.RiskLimits;
import com.riskrails.risk.RiskStatus;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the risk rails.
 *
 * <ul>
 *   <li>GET /api/risk/status -- trading switch, breaker states, error rate and rate window</li>
 *   <li>GET /api/risk/limits -- configured limits</li>
 *   <li>PUT /api/risk/trading -- flip the runtime trading switch</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/risk")
public class RiskController {

    private static final Logger log = LoggerFactory.getLogger(RiskController.class);

    private final AdmissionController admissionController;
    private final RiskLimits riskLimits;

    public RiskController(AdmissionController admissionController, RiskLimits riskLimits) {
        this.admissionController = admissionController;
        this.riskLimits = riskLimits;
    }

    @GetMapping("/status")
    public ResponseEntity<RiskStatus> getStatus() {
        return ResponseEntity.ok(admissionController.status());
    }

    @GetMapping("/limits")
    public ResponseEntity<RiskLimits> getLimits() {
        return ResponseEntity.ok(riskLimits);
    }

    @PutMapping("/trading")
    public ResponseEntity<RiskStatus> setTrading(@Valid @RequestBody TradingSwitchRequest request) {
        String reason = request.getReason() != null ? request.getReason() : "API";
        log.info("Trading switch change requested: enabled={}, reason={}", request.getEnabled(), reason);
        admissionController.setTradingEnabled(request.getEnabled(), reason);
        return ResponseEntity.ok(admissionController.status());
    }
}
