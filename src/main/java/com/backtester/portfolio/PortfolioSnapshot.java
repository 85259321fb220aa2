package com.backtester.portfolio;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Valuation and composition of a portfolio as of {@code timestamp}. The backtest loop records
 * at most one per calendar date.
 */
@Value
@Builder
public class PortfolioSnapshot {

    LocalDateTime timestamp;
    BigDecimal netValue;
    BigDecimal cash;
    BigDecimal holdingsValue;

    /** Ticker -> holding detail, in the portfolio's holding order. Unmodifiable. */
    Map<String, HoldingSnapshot> holdings;

    public LocalDate getDate() {
        return timestamp.toLocalDate();
    }
}
