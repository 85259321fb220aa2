package com.backtester.unit.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.backtester.domain.enums.OrderSide;
import com.backtester.event.MarketEvent;
import com.backtester.event.SignalEvent;
import com.backtester.strategy.impl.MovingAverageCrossStrategy;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for MovingAverageCrossStrategy.
 *
 * <p>Uses a 2/3 bar crossover so each cross can be traced by hand.
 */
class MovingAverageCrossStrategyTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 1, 2, 16, 0);

    private MovingAverageCrossStrategy strategy;

    @BeforeEach
    void setUp() {
        strategy = new MovingAverageCrossStrategy("MA-1", Set.of("AAPL"), 2, 3, 10);
    }

    @Test
    void noSignalsUntilSlowWindowIsFull() {
        List<SignalEvent> signals = feed("AAPL", 10, 11, 12);

        assertThat(signals).isEmpty();
    }

    @Test
    void goldenCrossBuysAndDeathCrossSellsHeldQuantity() {
        List<SignalEvent> signals = feed("AAPL", 10, 10, 10, 10, 13, 7, 4);

        assertThat(signals).hasSize(2);
        assertThat(signals.get(0).getSide()).isEqualTo(OrderSide.BUY);
        assertThat(signals.get(0).getSuggestedQuantity()).isEqualTo(10);
        assertThat(signals.get(0).getTimestamp()).isEqualTo(T0.plusDays(4));
        assertThat(signals.get(1).getSide()).isEqualTo(OrderSide.SELL);
        assertThat(signals.get(1).getSuggestedQuantity()).isEqualTo(10);
        assertThat(signals.get(1).getTimestamp()).isEqualTo(T0.plusDays(6));
    }

    @Test
    void deathCrossWhileFlatDoesNothing() {
        List<SignalEvent> signals = feed("AAPL", 10, 10, 10, 10, 4);

        assertThat(signals).isEmpty();
    }

    @Test
    void ignoresTickersOutsideConfiguration() {
        assertThat(feed("MSFT", 10, 10, 10, 10, 13)).isEmpty();
    }

    @Test
    void ignoresBarsThatDoNotAdvanceTime() {
        strategy.calculateSignals(event("AAPL", T0, 10));

        assertThat(strategy.calculateSignals(event("AAPL", T0, 50))).isEmpty();
    }

    @Test
    void rejectsInvalidPeriods() {
        assertThatThrownBy(() -> new MovingAverageCrossStrategy("MA", Set.of(), 5, 5, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MovingAverageCrossStrategy("MA", Set.of(), 0, 5, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MovingAverageCrossStrategy("MA", Set.of(), 2, 5, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private List<SignalEvent> feed(String ticker, double... closes) {
        List<SignalEvent> signals = new ArrayList<>();
        for (int i = 0; i < closes.length; i++) {
            signals.addAll(strategy.calculateSignals(event(ticker, T0.plusDays(i), closes[i])));
        }
        return signals;
    }

    private static MarketEvent event(String ticker, LocalDateTime timestamp, double close) {
        return new MarketEvent(timestamp, ticker, BigDecimal.valueOf(close));
    }
}
