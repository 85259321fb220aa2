package com.backtester.engine;

import com.backtester.event.EventType;
import com.backtester.portfolio.DividendRecord;
import com.backtester.portfolio.HoldingSnapshot;
import com.backtester.portfolio.PortfolioSnapshot;
import com.backtester.portfolio.Transaction;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Everything a finished run produced: the daily snapshot series, the trade ledger, and summary
 * figures derived from the final portfolio.
 */
@Value
@Builder
public class BacktestResult {

    String runId;
    String strategyId;
    BacktestConfig config;
    BacktestState finalState;
    LocalDateTime completedAt;

    BigDecimal initialNetValue;
    BigDecimal finalNetValue;

    /** {@code finalNetValue / initialNetValue - 1}, scale 6. Zero when starting with no cash. */
    BigDecimal totalReturn;

    BigDecimal finalCash;
    BigDecimal realizedPnl;
    BigDecimal totalCommission;
    BigDecimal dividendIncome;

    Map<String, HoldingSnapshot> finalHoldings;
    List<PortfolioSnapshot> snapshots;
    List<Transaction> transactions;
    List<DividendRecord> dividends;
    List<RejectedEvent> rejectedEvents;
    Map<EventType, Integer> processedEvents;
}
