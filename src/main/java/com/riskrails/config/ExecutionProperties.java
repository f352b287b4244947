package com.riskrails.config;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Execution behaviour: dry-run, venue retry, slippage cutback and smart-order defaults.
 *
 * <pre>
 * riskrails.execution.dry-run=false
 * riskrails.execution.retry.max-attempts=3
 * riskrails.execution.retry.backoff-base=500ms
 * riskrails.execution.slippage.cap-bps=15
 * riskrails.execution.chase.max-chases=3
 * riskrails.execution.twap.default-slices=4
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "riskrails.execution")
public class ExecutionProperties {

    /** Global dry-run default, used when neither the request nor the intent says otherwise. */
    private boolean dryRun = false;

    private Retry retry = new Retry();
    private Slippage slippage = new Slippage();
    private Chase chase = new Chase();
    private Twap twap = new Twap();

    @Data
    public static class Retry {

        /** Total attempts including the first. */
        private int maxAttempts = 3;

        /** Wait before attempt n+1 is {@code backoffBase x n}. */
        private Duration backoffBase = Duration.ofMillis(500);
    }

    @Data
    public static class Slippage {

        private BigDecimal capBps = new BigDecimal("15");
        private Duration window = Duration.ofMinutes(5);
        private BigDecimal sizeMultiplier = new BigDecimal("0.5");
        private Duration cutbackDuration = Duration.ofMinutes(60);
        private Duration violationWindow = Duration.ofMinutes(10);
        private int maxViolations = 3;
        private Duration scalpMuteDuration = Duration.ofMinutes(60);

        /** Intent tag treated as the scalping style. */
        private String scalpTag = "SCALP";
    }

    @Data
    public static class Chase {

        private int maxChases = 3;
        private Duration interval = Duration.ofSeconds(2);
    }

    @Data
    public static class Twap {

        private int defaultSlices = 4;
        private Duration defaultInterval = Duration.ofSeconds(30);
    }
}
