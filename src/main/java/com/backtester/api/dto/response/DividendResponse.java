package com.backtester.api.dto.response;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A dividend credited to the portfolio. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DividendResponse {

    private LocalDateTime timestamp;
    private String ticker;
    private int quantity;
    private BigDecimal dividendPerShare;
    private BigDecimal amount;
}
