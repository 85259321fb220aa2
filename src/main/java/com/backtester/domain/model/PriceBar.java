package com.backtester.domain.model;

import com.backtester.event.MarketEvent;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * One OHLCV bar of historical data for a ticker.
 *
 * <p>{@code timestamp} is the bar's end time as seen by the simulation. {@code close} is the
 * price the bar publishes as its {@link MarketEvent} and the price orders are filled against.
 */
@Data
@Builder
public class PriceBar {

    private LocalDateTime timestamp;
    private String ticker;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private long volume;

    public MarketEvent toMarketEvent() {
        return new MarketEvent(timestamp, ticker, close, open, high, low, volume);
    }
}
