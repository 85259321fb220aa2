package com.backtester.portfolio;

import com.backtester.exception.BusinessException;
import com.backtester.exception.ErrorCode;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import lombok.Getter;

/**
 * Position state for one security held by a {@link Portfolio}.
 *
 * <p>Long-only: quantity never goes below zero. Average cost is the quantity-weighted mean of
 * all purchase prices since the position was last flat; it resets to zero when the last share
 * is removed, so a later re-entry starts a fresh cost basis.
 *
 * <p>Market value is not stored. It is recomputed from {@code quantity * lastPrice} on every
 * read, so it can never drift from the mark.
 */
@Getter
public class Holding {

    /** Scale used for the weighted average cost division. */
    static final int COST_SCALE = 8;

    private final String ticker;
    private int quantity;
    private BigDecimal averageCost = BigDecimal.ZERO;
    private BigDecimal lastPrice = BigDecimal.ZERO;

    public Holding(String ticker) {
        if (ticker == null || ticker.isBlank()) {
            throw new IllegalArgumentException("Security ticker must be a non-empty string");
        }
        this.ticker = ticker;
    }

    /** Current valuation at the last known price. */
    public BigDecimal getMarketValue() {
        return lastPrice.multiply(BigDecimal.valueOf(quantity));
    }

    /**
     * Marks the holding to a new price.
     *
     * @throws IllegalArgumentException if the price is null or negative
     */
    public void updatePrice(BigDecimal price) {
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("Current price must be a non-negative number: " + price);
        }
        this.lastPrice = price;
    }

    /**
     * Quantity held after buying {@code quantityToAdd} more shares. Does not change the holding.
     *
     * @throws BusinessException with {@link ErrorCode#POSITION_LIMIT_EXCEEDED} on int overflow
     */
    public int quantityAfterAdding(int quantityToAdd) {
        try {
            return Math.addExact(quantity, quantityToAdd);
        } catch (ArithmeticException e) {
            throw new BusinessException(
                    ErrorCode.POSITION_LIMIT_EXCEEDED,
                    String.format(
                            "Cannot buy %d shares of %s. Position of %d would exceed %d.",
                            quantityToAdd, ticker, quantity, Integer.MAX_VALUE),
                    Map.of("ticker", ticker, "requested", quantityToAdd, "held", quantity));
        }
    }

    /**
     * Adds shares bought at {@code price}, re-weighting the average cost. The purchase price
     * becomes the new mark.
     *
     * @throws IllegalArgumentException if quantity is not positive or price is negative
     * @throws BusinessException with {@link ErrorCode#POSITION_LIMIT_EXCEEDED} if the new quantity
     *         would not fit in an {@code int}
     */
    public void addShares(int quantityToAdd, BigDecimal price) {
        if (quantityToAdd <= 0) {
            throw new IllegalArgumentException("Quantity to add must be positive: " + quantityToAdd);
        }
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("Price must be a non-negative number: " + price);
        }

        int newQuantity = quantityAfterAdding(quantityToAdd);

        // (oldAvg * oldQty + price * qty) / (oldQty + qty)
        BigDecimal existingCost = averageCost.multiply(BigDecimal.valueOf(quantity));
        BigDecimal addedCost = price.multiply(BigDecimal.valueOf(quantityToAdd));

        this.averageCost =
                existingCost.add(addedCost).divide(BigDecimal.valueOf(newQuantity), COST_SCALE, RoundingMode.HALF_UP);
        this.quantity = newQuantity;
        updatePrice(price);
    }

    /**
     * Removes shares from the position. Average cost is left untouched unless the position
     * goes flat, in which case it resets to zero.
     *
     * @return the cost basis of the removed shares ({@code quantity * averageCost}), taken
     *         before any reset
     * @throws IllegalArgumentException if quantity is not positive
     * @throws BusinessException with {@link ErrorCode#INSUFFICIENT_POSITION} if more shares
     *         are requested than are held
     */
    public BigDecimal removeShares(int quantityToRemove) {
        if (quantityToRemove <= 0) {
            throw new IllegalArgumentException("Quantity to remove must be positive: " + quantityToRemove);
        }
        if (quantityToRemove > quantity) {
            throw new BusinessException(
                    ErrorCode.INSUFFICIENT_POSITION,
                    String.format(
                            "Cannot remove %d shares. Only %d shares of %s are held.",
                            quantityToRemove, quantity, ticker),
                    Map.of("ticker", ticker, "requested", quantityToRemove, "held", quantity));
        }

        BigDecimal costBasis = averageCost.multiply(BigDecimal.valueOf(quantityToRemove));
        this.quantity -= quantityToRemove;
        if (quantity == 0) {
            this.averageCost = BigDecimal.ZERO;
        }
        return costBasis;
    }

    @Override
    public String toString() {
        return String.format(
                "Holding(ticker='%s', quantity=%d, averageCost=%s, lastPrice=%s, marketValue=%s)",
                ticker, quantity, averageCost.toPlainString(), lastPrice.toPlainString(), getMarketValue());
    }
}
