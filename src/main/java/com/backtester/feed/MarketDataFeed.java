package com.backtester.feed;

import com.backtester.event.BacktestEvent;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Source of historical market data for a backtest.
 *
 * <p>Implementations yield {@link com.backtester.event.MarketEvent}s and
 * {@link com.backtester.event.DividendEvent}s in non-decreasing timestamp order, one time step
 * per call to {@link #streamNext()}. They also answer point-in-time price queries used to fill
 * orders.
 */
public interface MarketDataFeed {

    /**
     * Returns the events of the next time step, or an empty list once the feed is exhausted.
     */
    List<BacktestEvent> streamNext();

    /**
     * Returns the most recent price for {@code ticker} at or before {@code asOf}, or empty if
     * no price is known yet.
     */
    Optional<BigDecimal> getLatestPrice(String ticker, LocalDateTime asOf);

    /**
     * Hints which tickers the run is interested in. Implementations may restrict their output
     * to these tickers or ignore the hint.
     */
    default void subscribe(Collection<String> tickers) {}
}
