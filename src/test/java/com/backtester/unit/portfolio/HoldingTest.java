package com.backtester.unit.portfolio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.backtester.exception.BusinessException;
import com.backtester.exception.ErrorCode;
import com.backtester.portfolio.Holding;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for Holding.
 *
 * <p>Verifies: weighted average cost, mark updates, share removal with cost basis, and the
 * reset of average cost when the position goes flat.
 */
class HoldingTest {

    private Holding holding;

    @BeforeEach
    void setUp() {
        holding = new Holding("AAPL");
    }

    @Test
    void addShares_weightsAverageCostByQuantity() {
        holding.addShares(100, new BigDecimal("10"));
        holding.addShares(200, new BigDecimal("11"));
        holding.addShares(100, new BigDecimal("14"));

        // (1000 + 2200 + 1400) / 400
        assertThat(holding.getQuantity()).isEqualTo(400);
        assertThat(holding.getAverageCost()).isEqualByComparingTo("11.5");
    }

    @Test
    void addShares_nonTerminatingAverageIsCloseToWeightedMean() {
        holding.addShares(100, new BigDecimal("10"));
        holding.addShares(200, new BigDecimal("11"));

        assertThat(holding.getAverageCost()).isCloseTo(new BigDecimal("10.66666667"), within(new BigDecimal("0.00000001")));
    }

    @Test
    void addShares_setsMarkToPurchasePrice() {
        holding.addShares(10, new BigDecimal("150"));
        holding.addShares(10, new BigDecimal("160"));

        assertThat(holding.getLastPrice()).isEqualByComparingTo("160");
        assertThat(holding.getMarketValue()).isEqualByComparingTo("3200");
    }

    @Test
    void addShares_rejectsQuantityOverflowWithoutChangingHolding() {
        holding.addShares(Integer.MAX_VALUE, new BigDecimal("1.00"));

        assertThatThrownBy(() -> holding.addShares(Integer.MAX_VALUE, new BigDecimal("1.00")))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.POSITION_LIMIT_EXCEEDED);

        assertThat(holding.getQuantity()).isEqualTo(Integer.MAX_VALUE);
        assertThat(holding.getAverageCost()).isEqualByComparingTo("1.00");
    }

    @Test
    void addShares_rejectsNonPositiveQuantityAndNegativePrice() {
        assertThatThrownBy(() -> holding.addShares(0, BigDecimal.TEN)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> holding.addShares(5, new BigDecimal("-1")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(holding.getQuantity()).isZero();
    }

    @Test
    void updatePrice_revaluesWithoutTouchingCost() {
        holding.addShares(10, new BigDecimal("150"));
        holding.updatePrice(new BigDecimal("152"));

        assertThat(holding.getMarketValue()).isEqualByComparingTo("1520");
        assertThat(holding.getAverageCost()).isEqualByComparingTo("150");
    }

    @Test
    void updatePrice_rejectsNegative() {
        assertThatThrownBy(() -> holding.updatePrice(new BigDecimal("-0.01")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void removeShares_returnsCostBasisAndKeepsAverage() {
        holding.addShares(10, new BigDecimal("150"));

        BigDecimal costBasis = holding.removeShares(4);

        assertThat(costBasis).isEqualByComparingTo("600");
        assertThat(holding.getQuantity()).isEqualTo(6);
        assertThat(holding.getAverageCost()).isEqualByComparingTo("150");
    }

    @Test
    void removeShares_resetsAverageCostWhenFlat() {
        holding.addShares(10, new BigDecimal("150"));

        BigDecimal costBasis = holding.removeShares(10);

        assertThat(costBasis).isEqualByComparingTo("1500");
        assertThat(holding.getQuantity()).isZero();
        assertThat(holding.getAverageCost()).isEqualByComparingTo("0");
    }

    @Test
    void removeShares_moreThanHeldFailsAndLeavesHoldingUnchanged() {
        holding.addShares(10, new BigDecimal("150"));

        assertThatThrownBy(() -> holding.removeShares(11))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INSUFFICIENT_POSITION);
        assertThat(holding.getQuantity()).isEqualTo(10);
        assertThat(holding.getAverageCost()).isEqualByComparingTo("150");
    }

    @Test
    void removeShares_rejectsNonPositiveQuantity() {
        assertThatThrownBy(() -> holding.removeShares(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
