package com.backtester.strategy;

import com.backtester.event.MarketEvent;
import com.backtester.event.SignalEvent;
import java.util.List;
import java.util.Set;

/**
 * Decides what to trade in response to market updates.
 *
 * <p>A strategy only reads the market events it is given and returns signals. It never places
 * orders or touches the portfolio; the backtest loop turns signals into orders.
 */
public interface SignalStrategy {

    String getId();

    /**
     * Returns zero or more signals for this market update. Signals must carry the timestamp of
     * {@code event} or later.
     */
    List<SignalEvent> calculateSignals(MarketEvent event);

    /** Tickers this strategy trades. Empty means it wants every ticker the feed has. */
    default Set<String> getSubscribedTickers() {
        return Set.of();
    }
}
