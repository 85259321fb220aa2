package com.backtester.execution;

import com.backtester.event.OrderEvent;
import java.math.BigDecimal;

/**
 * Turns an order into a fill, or refuses it.
 *
 * <p>Implementations receive the order and a reference price looked up by the backtest loop
 * and must not touch the portfolio or the event queue. The loop enqueues the returned fill.
 */
public interface ExecutionHandler {

    /**
     * @param order          the order to execute
     * @param referencePrice latest known price for the order's ticker at the order time
     * @return a filled result, or a rejected one with the reason
     */
    ExecutionResult execute(OrderEvent order, BigDecimal referencePrice);
}
