package com.backtester.portfolio;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * A credited dividend. Kept apart from the trade ledger since a dividend is not a trade.
 */
@Value
@Builder
public class DividendRecord {

    LocalDateTime timestamp;
    String ticker;
    int quantity;
    BigDecimal dividendPerShare;
    BigDecimal amount;
}
