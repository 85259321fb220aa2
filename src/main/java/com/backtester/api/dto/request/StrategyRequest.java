package com.backtester.api.dto.request;

import com.backtester.domain.enums.StrategyType;
import jakarta.validation.constraints.NotNull;
import java.util.HashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Strategy selection for a backtest request.
 *
 * <p>{@code params} is passed to {@link com.backtester.strategy.StrategyFactory}: e.g.
 * {@code {"tickers": ["AAPL"], "quantity": 10, "fastPeriod": 5, "slowPeriod": 20}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyRequest {

    @NotNull
    private StrategyType type;

    @Builder.Default
    private Map<String, Object> params = new HashMap<>();
}
