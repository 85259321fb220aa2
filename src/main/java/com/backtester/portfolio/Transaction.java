package com.backtester.portfolio;

import com.backtester.domain.enums.OrderSide;
import com.backtester.event.FillEvent;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * An executed trade as booked in the portfolio ledger. Immutable once created.
 *
 * <p>{@code side} is not checked here: a missing side is reported by
 * {@link Portfolio#applyTransaction(Transaction)} as an unknown transaction type.
 */
@Value
public class Transaction {

    LocalDateTime timestamp;
    String ticker;
    OrderSide side;
    int quantity;
    BigDecimal price;
    BigDecimal commission;

    /** Order this transaction came from. Null for trades booked directly. */
    String orderId;

    @Builder
    public Transaction(
            LocalDateTime timestamp,
            String ticker,
            OrderSide side,
            int quantity,
            BigDecimal price,
            BigDecimal commission,
            String orderId) {
        if (timestamp == null) {
            throw new IllegalArgumentException("Transaction timestamp is required");
        }
        if (ticker == null || ticker.isBlank()) {
            throw new IllegalArgumentException("Transaction ticker must be a non-empty string");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("Transaction quantity must be positive: " + quantity);
        }
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("Transaction price must be a non-negative number: " + price);
        }
        if (commission != null && commission.signum() < 0) {
            throw new IllegalArgumentException("Commission must be a non-negative number: " + commission);
        }
        this.timestamp = timestamp;
        this.ticker = ticker;
        this.side = side;
        this.quantity = quantity;
        this.price = price;
        this.commission = commission != null ? commission : BigDecimal.ZERO;
        this.orderId = orderId;
    }

    /** Builds the ledger entry for a fill, carrying over side, size, price, commission and order link. */
    public static Transaction fromFill(FillEvent fill) {
        return Transaction.builder()
                .timestamp(fill.getTimestamp())
                .ticker(fill.getTicker())
                .side(fill.getSide())
                .quantity(fill.getQuantityFilled())
                .price(fill.getFillPrice())
                .commission(fill.getCommission())
                .orderId(fill.getOrderId())
                .build();
    }

    /** quantity * price, excluding commission. */
    public BigDecimal getGrossValue() {
        return price.multiply(BigDecimal.valueOf(quantity));
    }
}
