package com.backtester.portfolio;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Per-ticker detail captured inside a {@link PortfolioSnapshot}. */
@Value
@Builder
public class HoldingSnapshot {

    int quantity;
    BigDecimal averageCost;
    BigDecimal lastPrice;
    BigDecimal marketValue;

    public static HoldingSnapshot of(Holding holding) {
        return HoldingSnapshot.builder()
                .quantity(holding.getQuantity())
                .averageCost(holding.getAverageCost())
                .lastPrice(holding.getLastPrice())
                .marketValue(holding.getMarketValue())
                .build();
    }
}
