package com.backtester.event;

import com.backtester.domain.enums.OrderSide;
import com.backtester.domain.enums.OrderType;
import java.time.LocalDateTime;
import lombok.Getter;
import lombok.ToString;

/**
 * An order waiting to be executed.
 *
 * <p>Quantity is not validated here: a non-positive quantity is a domain rejection raised by
 * the execution handler, so the order can still travel through the queue and be reported.
 */
@Getter
@ToString(callSuper = true)
public class OrderEvent extends BacktestEvent {

    private final String orderId;
    private final String ticker;
    private final OrderSide side;
    private final int quantity;
    private final OrderType orderType;

    public OrderEvent(
            LocalDateTime timestamp, String orderId, String ticker, OrderSide side, int quantity, OrderType orderType) {
        super(EventType.ORDER, timestamp);
        if (side == null) {
            throw new IllegalArgumentException("Order side is required");
        }
        this.orderId = orderId;
        this.ticker = requireTicker(ticker);
        this.side = side;
        this.quantity = quantity;
        this.orderType = orderType != null ? orderType : OrderType.MARKET;
    }

    /** Creates a MARKET order. */
    public static OrderEvent market(
            LocalDateTime timestamp, String orderId, String ticker, OrderSide side, int quantity) {
        return new OrderEvent(timestamp, orderId, ticker, side, quantity, OrderType.MARKET);
    }
}
