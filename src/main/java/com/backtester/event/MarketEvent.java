package com.backtester.event;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Getter;
import lombok.ToString;

/**
 * A new price observation for one ticker, typically the close of a bar.
 *
 * <p>{@code price} drives valuation and strategy decisions. The OHLC fields and volume are
 * carried through for strategies that need them and may be null (volume defaults to 0).
 */
@Getter
@ToString(callSuper = true)
public class MarketEvent extends BacktestEvent {

    private final String ticker;
    private final BigDecimal price;
    private final BigDecimal open;
    private final BigDecimal high;
    private final BigDecimal low;
    private final long volume;

    public MarketEvent(LocalDateTime timestamp, String ticker, BigDecimal price) {
        this(timestamp, ticker, price, null, null, null, 0L);
    }

    public MarketEvent(
            LocalDateTime timestamp,
            String ticker,
            BigDecimal price,
            BigDecimal open,
            BigDecimal high,
            BigDecimal low,
            long volume) {
        super(EventType.MARKET, timestamp);
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("Market price must be a non-negative number: " + price);
        }
        this.ticker = requireTicker(ticker);
        this.price = price;
        this.open = open;
        this.high = high;
        this.low = low;
        this.volume = volume;
    }
}
