package com.backtester.unit.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.backtester.domain.enums.OrderSide;
import com.backtester.domain.enums.StrategyType;
import com.backtester.event.MarketEvent;
import com.backtester.event.SignalEvent;
import com.backtester.strategy.SignalStrategy;
import com.backtester.strategy.StrategyFactory;
import com.backtester.strategy.impl.BuyAndHoldStrategy;
import com.backtester.strategy.impl.MovingAverageCrossStrategy;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StrategyFactoryTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 1, 2, 16, 0);

    private StrategyFactory strategyFactory;

    @BeforeEach
    void setUp() {
        strategyFactory = new StrategyFactory();
    }

    @Test
    void create_buyAndHoldWithParams() {
        SignalStrategy strategy =
                strategyFactory.create(StrategyType.BUY_AND_HOLD, Map.of("tickers", List.of("AAPL"), "quantity", 25));

        assertThat(strategy).isInstanceOf(BuyAndHoldStrategy.class);
        assertThat(strategy.getId()).startsWith("STR-");
        assertThat(strategy.getSubscribedTickers()).containsExactly("AAPL");

        List<SignalEvent> signals = strategy.calculateSignals(new MarketEvent(T0, "AAPL", new BigDecimal("100")));
        assertThat(signals).singleElement().satisfies(s -> {
            assertThat(s.getSide()).isEqualTo(OrderSide.BUY);
            assertThat(s.getSuggestedQuantity()).isEqualTo(25);
        });
        assertThat(strategy.calculateSignals(new MarketEvent(T0.plusDays(1), "AAPL", new BigDecimal("101"))))
                .isEmpty();
    }

    @Test
    void create_movingAverageWithStringParams() {
        SignalStrategy strategy = strategyFactory.create(
                StrategyType.MOVING_AVERAGE_CROSS,
                Map.of("tickers", "AAPL, MSFT", "fastPeriod", "5", "slowPeriod", 20, "quantity", 3));

        assertThat(strategy).isInstanceOf(MovingAverageCrossStrategy.class);
        MovingAverageCrossStrategy ma = (MovingAverageCrossStrategy) strategy;
        assertThat(ma.getFastPeriod()).isEqualTo(5);
        assertThat(ma.getSlowPeriod()).isEqualTo(20);
        assertThat(ma.getQuantity()).isEqualTo(3);
        assertThat(ma.getSubscribedTickers()).containsExactlyInAnyOrder("AAPL", "MSFT");
    }

    @Test
    void create_appliesDefaultsWithoutParams() {
        MovingAverageCrossStrategy ma =
                (MovingAverageCrossStrategy) strategyFactory.create(StrategyType.MOVING_AVERAGE_CROSS, null);

        assertThat(ma.getFastPeriod()).isEqualTo(10);
        assertThat(ma.getSlowPeriod()).isEqualTo(30);
        assertThat(ma.getQuantity()).isEqualTo(100);
        assertThat(ma.getSubscribedTickers()).isEmpty();
    }

    @Test
    void create_rejectsNonNumericParams() {
        assertThatThrownBy(() -> strategyFactory.create(StrategyType.BUY_AND_HOLD, Map.of("quantity", "lots")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("quantity");
    }

    @Test
    void create_rejectsMissingType() {
        assertThatThrownBy(() -> strategyFactory.create(null, Map.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
