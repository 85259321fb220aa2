package com.backtester.event;

import com.backtester.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Getter;
import lombok.ToString;

/**
 * A strategy's suggestion to trade.
 *
 * <p>{@code suggestedQuantity} is optional here; the backtest loop drops signals without a
 * positive quantity instead of sizing them. {@code strength} is informational.
 */
@Getter
@ToString(callSuper = true)
public class SignalEvent extends BacktestEvent {

    private final String ticker;
    private final OrderSide side;
    private final Integer suggestedQuantity;
    private final BigDecimal strength;

    public SignalEvent(LocalDateTime timestamp, String ticker, OrderSide side, Integer suggestedQuantity) {
        this(timestamp, ticker, side, suggestedQuantity, null);
    }

    public SignalEvent(
            LocalDateTime timestamp, String ticker, OrderSide side, Integer suggestedQuantity, BigDecimal strength) {
        super(EventType.SIGNAL, timestamp);
        if (side == null) {
            throw new IllegalArgumentException("Signal side is required");
        }
        this.ticker = requireTicker(ticker);
        this.side = side;
        this.suggestedQuantity = suggestedQuantity;
        this.strength = strength;
    }

    /** Returns true when the signal carries a usable, positive quantity. */
    public boolean hasPositiveQuantity() {
        return suggestedQuantity != null && suggestedQuantity > 0;
    }
}
