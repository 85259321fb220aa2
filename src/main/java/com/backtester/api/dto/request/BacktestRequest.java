package com.backtester.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for running a backtest.
 *
 * <p>Market data comes from the inline {@code bars}, from {@code dataFile} (a CSV under the
 * configured data directory), or both. {@code initialCash} falls back to
 * {@code backtester.default-initial-cash}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BacktestRequest {

    @NotNull
    private LocalDateTime startTime;

    /** Inclusive. */
    @NotNull
    private LocalDateTime endTime;

    @PositiveOrZero
    private BigDecimal initialCash;

    private String benchmarkTicker;

    @NotNull
    @Valid
    private StrategyRequest strategy;

    @Valid
    @Builder.Default
    private List<PriceBarRequest> bars = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<DividendRequest> dividends = new ArrayList<>();

    private String dataFile;

    @AssertTrue(message = "endTime must not be before startTime")
    public boolean isTimeWindowValid() {
        return startTime == null || endTime == null || !endTime.isBefore(startTime);
    }

    @AssertTrue(message = "either bars or dataFile must be provided")
    public boolean isMarketDataPresent() {
        return (bars != null && !bars.isEmpty()) || (dataFile != null && !dataFile.isBlank());
    }
}
