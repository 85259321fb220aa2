package com.backtester.event;

import com.backtester.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Getter;
import lombok.ToString;

/**
 * Confirmation that an order executed: quantity, price and commission as reported by the
 * execution handler. {@code orderId} links back to the originating {@link OrderEvent} and
 * may be null for fills injected directly.
 */
@Getter
@ToString(callSuper = true)
public class FillEvent extends BacktestEvent {

    private final String ticker;
    private final OrderSide side;
    private final int quantityFilled;
    private final BigDecimal fillPrice;
    private final BigDecimal commission;
    private final String orderId;

    public FillEvent(
            LocalDateTime timestamp,
            String ticker,
            OrderSide side,
            int quantityFilled,
            BigDecimal fillPrice,
            BigDecimal commission,
            String orderId) {
        super(EventType.FILL, timestamp);
        if (quantityFilled <= 0) {
            throw new IllegalArgumentException("Filled quantity must be positive: " + quantityFilled);
        }
        if (fillPrice == null || fillPrice.signum() < 0) {
            throw new IllegalArgumentException("Fill price must be a non-negative number: " + fillPrice);
        }
        if (commission == null || commission.signum() < 0) {
            throw new IllegalArgumentException("Commission must be a non-negative number: " + commission);
        }
        this.ticker = requireTicker(ticker);
        this.side = side;
        this.quantityFilled = quantityFilled;
        this.fillPrice = fillPrice;
        this.commission = commission;
        this.orderId = orderId;
    }
}
