package com.backtester.domain.enums;

/**
 * Order execution type.
 * Only MARKET orders are executable by the simulated execution handler; LIMIT orders
 * are accepted into the queue but rejected at execution.
 */
public enum OrderType {
    MARKET,
    LIMIT
}
