package com.backtester.engine;

/** Lifecycle of a {@link Backtester} run. */
public enum BacktestState {
    /** Pulling the next batch from the feed. */
    RUNNING,
    /** Dispatching queued events until the queue is empty. */
    DRAINING_QUEUE,
    STOPPED
}
