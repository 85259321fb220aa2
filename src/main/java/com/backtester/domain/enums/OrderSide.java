package com.backtester.domain.enums;

/** Buy or sell side of a signal, order, fill or ledger transaction. */
public enum OrderSide {
    BUY,
    SELL
}
