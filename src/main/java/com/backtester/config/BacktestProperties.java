package com.backtester.config;

import java.math.BigDecimal;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for backtest runs.
 *
 * <p>Defaults for the run itself (initial cash) and for the simulated execution handler
 * (commission schedule and slippage). Request values take precedence where a request can
 * supply them.
 */
@Configuration
@ConfigurationProperties(prefix = "backtester")
@Getter
@Setter
public class BacktestProperties {

    /** Starting cash when a request does not specify one. */
    private BigDecimal defaultInitialCash = new BigDecimal("100000.00");

    /** Directory that CSV data files are resolved against. */
    private String dataDirectory = "data/bars";

    /** Completed runs kept in memory for lookup. Oldest runs are evicted first. */
    private int maxRetainedRuns = 50;

    private Commission commission = new Commission();

    /** Slippage in basis points applied against the trader (default: 0 = fill at reference price). */
    private int slippageBps = 0;

    @Getter
    @Setter
    public static class Commission {

        /** Flat fee per share traded. */
        private BigDecimal perShare = new BigDecimal("0.005");

        /** Fraction of traded value, e.g. 0.001 for 0.1%. */
        private BigDecimal percentage = BigDecimal.ZERO;

        /** Floor applied to every fill. */
        private BigDecimal minimum = new BigDecimal("1.00");
    }
}
