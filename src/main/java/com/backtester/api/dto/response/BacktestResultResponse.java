package com.backtester.api.dto.response;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Full outcome of a backtest run as returned by the REST API.
 *
 * <p>{@code processedEvents} counts successfully dispatched events per event type;
 * {@code rejectedEvents} lists the ones that were dropped.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BacktestResultResponse {

    private String runId;
    private String strategyId;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private BigDecimal initialCash;
    private String benchmarkTicker;
    private String finalState;
    private LocalDateTime completedAt;

    private BigDecimal initialNetValue;
    private BigDecimal finalNetValue;
    private BigDecimal totalReturn;
    private BigDecimal finalCash;
    private BigDecimal realizedPnl;
    private BigDecimal totalCommission;
    private BigDecimal dividendIncome;

    private Map<String, HoldingResponse> finalHoldings;
    private List<SnapshotResponse> snapshots;
    private List<TransactionResponse> transactions;
    private List<DividendResponse> dividends;
    private List<RejectedEventResponse> rejectedEvents;
    private Map<String, Integer> processedEvents;
}
