package com.backtester.domain.enums;

/** Built-in strategies that can be selected when submitting a backtest. */
public enum StrategyType {
    BUY_AND_HOLD,
    MOVING_AVERAGE_CROSS
}
