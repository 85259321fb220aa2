package com.backtester.api.dto.response;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One line in the list of retained runs. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BacktestSummaryResponse {

    private String runId;
    private String strategyId;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private String finalState;
    private BigDecimal initialNetValue;
    private BigDecimal finalNetValue;
    private BigDecimal totalReturn;
    private int transactionCount;
    private int snapshotCount;
    private int rejectedCount;
}
