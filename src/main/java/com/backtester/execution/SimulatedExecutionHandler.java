package com.backtester.execution;

import com.backtester.domain.enums.OrderSide;
import com.backtester.domain.enums.OrderType;
import com.backtester.event.FillEvent;
import com.backtester.event.OrderEvent;
import com.backtester.exception.ErrorCode;
import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.Builder;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fills MARKET orders immediately at the reference price, charging commission.
 *
 * <p>Commission: {@code max(perShare * qty + percentage * qty * price, minimum)}.
 *
 * <p>Slippage is applied as basis points of the reference price against the trader: a BUY
 * fills at {@code price * (1 + bps/10000)}, a SELL at {@code price * (1 - bps/10000)}.
 * With the default of 0 bps the fill price equals the reference price.
 *
 * <p>Rejects non-MARKET orders, non-positive quantities, and missing or non-positive prices.
 */
@Getter
public class SimulatedExecutionHandler implements ExecutionHandler {

    private static final Logger log = LoggerFactory.getLogger(SimulatedExecutionHandler.class);

    private static final BigDecimal BPS_DIVISOR = new BigDecimal("10000");
    private static final int PRICE_SCALE = 6;

    private final BigDecimal commissionPerShare;
    private final BigDecimal commissionPercentage;
    private final BigDecimal minimumCommission;
    private final int slippageBps;

    @Builder
    public SimulatedExecutionHandler(
            BigDecimal commissionPerShare,
            BigDecimal commissionPercentage,
            BigDecimal minimumCommission,
            int slippageBps) {
        this.commissionPerShare = nonNegativeOrZero(commissionPerShare, "Commission per share");
        this.commissionPercentage = nonNegativeOrZero(commissionPercentage, "Commission percentage");
        this.minimumCommission = nonNegativeOrZero(minimumCommission, "Minimum commission");
        if (slippageBps < 0) {
            throw new IllegalArgumentException("Slippage must be non-negative: " + slippageBps);
        }
        this.slippageBps = slippageBps;
    }

    @Override
    public ExecutionResult execute(OrderEvent order, BigDecimal referencePrice) {
        if (order.getOrderType() != OrderType.MARKET) {
            return reject(order, ErrorCode.UNSUPPORTED_ORDER_TYPE, "Only MARKET orders are supported, got " + order.getOrderType());
        }
        if (referencePrice == null) {
            return reject(order, ErrorCode.PRICE_UNAVAILABLE, "Reference price is required for MARKET orders");
        }
        if (referencePrice.signum() <= 0) {
            return reject(order, ErrorCode.ORDER_REJECTED, "Invalid market price " + referencePrice);
        }
        if (order.getQuantity() <= 0) {
            return reject(order, ErrorCode.ORDER_REJECTED, "Order quantity must be positive, got " + order.getQuantity());
        }

        BigDecimal fillPrice = applySlippage(referencePrice, order.getSide());
        BigDecimal commission = calculateCommission(order.getQuantity(), fillPrice);

        FillEvent fill = new FillEvent(
                order.getTimestamp(),
                order.getTicker(),
                order.getSide(),
                order.getQuantity(),
                fillPrice,
                commission,
                order.getOrderId());

        log.debug(
                "Order {} filled: {} {} x{} @ {} commission={}",
                order.getOrderId(),
                order.getSide(),
                order.getTicker(),
                order.getQuantity(),
                fillPrice,
                commission);
        return ExecutionResult.filled(fill);
    }

    /** {@code max(perShare * qty + percentage * qty * price, minimum)}. */
    public BigDecimal calculateCommission(int quantity, BigDecimal price) {
        BigDecimal qty = BigDecimal.valueOf(quantity);
        BigDecimal commission = commissionPerShare
                .multiply(qty)
                .add(commissionPercentage.multiply(qty).multiply(price));
        return commission.max(minimumCommission);
    }

    private BigDecimal applySlippage(BigDecimal price, OrderSide side) {
        if (slippageBps == 0) {
            return price;
        }
        BigDecimal slippage = price.multiply(BigDecimal.valueOf(slippageBps)).divide(BPS_DIVISOR, PRICE_SCALE, RoundingMode.HALF_UP);
        return side == OrderSide.BUY ? price.add(slippage) : price.subtract(slippage);
    }

    private ExecutionResult reject(OrderEvent order, ErrorCode code, String reason) {
        log.warn("Order {} for {} rejected: {}", order.getOrderId(), order.getTicker(), reason);
        return ExecutionResult.rejected(code, reason);
    }

    private static BigDecimal nonNegativeOrZero(BigDecimal value, String label) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException(label + " must be non-negative: " + value);
        }
        return value;
    }
}
