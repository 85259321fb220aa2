package com.backtester.api.dto.response;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Per-ticker position detail. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HoldingResponse {

    private int quantity;
    private BigDecimal averageCost;
    private BigDecimal lastPrice;
    private BigDecimal marketValue;
}
