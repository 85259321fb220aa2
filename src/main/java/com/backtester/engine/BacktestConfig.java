package com.backtester.engine;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Parameters of a single backtest run.
 *
 * <p>{@code endTime} is inclusive: an event stamped exactly at the end time is processed, a
 * later one is not. The benchmark ticker is informational and only affects which tickers the
 * feed is asked to emit.
 */
@Value
public class BacktestConfig {

    LocalDateTime startTime;
    LocalDateTime endTime;
    BigDecimal initialCash;
    String benchmarkTicker;

    @Builder
    public BacktestConfig(
            LocalDateTime startTime, LocalDateTime endTime, BigDecimal initialCash, String benchmarkTicker) {
        if (startTime == null || endTime == null) {
            throw new IllegalArgumentException("Backtest start and end times are required");
        }
        if (endTime.isBefore(startTime)) {
            throw new IllegalArgumentException("End time " + endTime + " is before start time " + startTime);
        }
        if (initialCash == null || initialCash.signum() < 0) {
            throw new IllegalArgumentException("Initial cash must be a non-negative number: " + initialCash);
        }
        this.startTime = startTime;
        this.endTime = endTime;
        this.initialCash = initialCash;
        this.benchmarkTicker = benchmarkTicker != null && !benchmarkTicker.isBlank() ? benchmarkTicker : null;
    }
}
