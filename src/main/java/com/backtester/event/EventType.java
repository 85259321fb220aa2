package com.backtester.event;

/**
 * Discriminator for the closed set of events that flow through a backtest.
 *
 * <p>The causal chain is MARKET -> SIGNAL -> ORDER -> FILL. DIVIDEND events come straight
 * from the feed and are applied to the portfolio without going through the strategy.
 */
public enum EventType {

    /** New price bar for a ticker. */
    MARKET,

    /** Strategy suggestion to trade, not yet an order. */
    SIGNAL,

    /** Order waiting to be executed against the latest price. */
    ORDER,

    /** Executed order, ready to be booked by the portfolio. */
    FILL,

    /** Cash distribution per share held. */
    DIVIDEND
}
