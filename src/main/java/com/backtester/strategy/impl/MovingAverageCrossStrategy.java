package com.backtester.strategy.impl;

import com.backtester.domain.enums.OrderSide;
import com.backtester.event.MarketEvent;
import com.backtester.event.SignalEvent;
import com.backtester.strategy.SignalStrategy;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.num.Num;

/**
 * Fast/slow simple moving average crossover, evaluated per ticker on close prices.
 *
 * <p>Each market event is appended as a bar to a ta4j {@link BarSeries} for its ticker. Once
 * the slow window is full, a fast SMA crossing above the slow SMA buys {@code quantity} shares
 * when flat, and a cross below sells the whole position.
 *
 * <p>The strategy cannot see the portfolio, so it tracks the position implied by its own
 * signals. A rejected order therefore leaves it out of sync until the next opposite cross.
 */
public class MovingAverageCrossStrategy implements SignalStrategy {

    private static final Logger log = LoggerFactory.getLogger(MovingAverageCrossStrategy.class);

    @Getter
    private final String id;

    @Getter
    private final int fastPeriod;

    @Getter
    private final int slowPeriod;

    @Getter
    private final int quantity;

    private final Set<String> tickers;
    private final Map<String, TickerState> states = new HashMap<>();

    public MovingAverageCrossStrategy(String id, Set<String> tickers, int fastPeriod, int slowPeriod, int quantity) {
        if (fastPeriod <= 0 || slowPeriod <= 0) {
            throw new IllegalArgumentException("Moving average periods must be positive");
        }
        if (fastPeriod >= slowPeriod) {
            throw new IllegalArgumentException(
                    "Fast period (" + fastPeriod + ") must be shorter than slow period (" + slowPeriod + ")");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("Trade quantity must be positive: " + quantity);
        }
        this.id = id;
        this.tickers = tickers != null ? new LinkedHashSet<>(tickers) : new LinkedHashSet<>();
        this.fastPeriod = fastPeriod;
        this.slowPeriod = slowPeriod;
        this.quantity = quantity;
    }

    @Override
    public List<SignalEvent> calculateSignals(MarketEvent event) {
        String ticker = event.getTicker();
        if (!tickers.isEmpty() && !tickers.contains(ticker)) {
            return List.of();
        }

        TickerState state = states.computeIfAbsent(ticker, this::newState);
        ZonedDateTime endTime = event.getTimestamp().atZone(ZoneOffset.UTC);
        BarSeries series = state.series;
        if (!series.isEmpty() && !endTime.isAfter(series.getLastBar().getEndTime())) {
            log.debug("[{}] Ignoring out-of-order bar for {} at {}", id, ticker, event.getTimestamp());
            return List.of();
        }

        series.addBar(
                endTime,
                orPrice(event.getOpen(), event),
                orPrice(event.getHigh(), event),
                orPrice(event.getLow(), event),
                event.getPrice(),
                event.getVolume());

        int index = series.getEndIndex();
        if (index < slowPeriod) {
            return List.of();
        }

        Num fastNow = state.fast.getValue(index);
        Num slowNow = state.slow.getValue(index);
        Num fastPrev = state.fast.getValue(index - 1);
        Num slowPrev = state.slow.getValue(index - 1);

        boolean crossedUp = !fastPrev.isGreaterThan(slowPrev) && fastNow.isGreaterThan(slowNow);
        boolean crossedDown = !fastPrev.isLessThan(slowPrev) && fastNow.isLessThan(slowNow);

        if (crossedUp && state.position == 0) {
            state.position = quantity;
            log.debug("[{}] Golden cross on {}: fast={} slow={}", id, ticker, fastNow, slowNow);
            return List.of(new SignalEvent(event.getTimestamp(), ticker, OrderSide.BUY, quantity));
        }
        if (crossedDown && state.position > 0) {
            int held = state.position;
            state.position = 0;
            log.debug("[{}] Death cross on {}: fast={} slow={}", id, ticker, fastNow, slowNow);
            return List.of(new SignalEvent(event.getTimestamp(), ticker, OrderSide.SELL, held));
        }
        return List.of();
    }

    @Override
    public Set<String> getSubscribedTickers() {
        return Set.copyOf(tickers);
    }

    private TickerState newState(String ticker) {
        BarSeries series = new BaseBarSeriesBuilder().withName(id + "-" + ticker).build();
        ClosePriceIndicator close = new ClosePriceIndicator(series);
        return new TickerState(series, new SMAIndicator(close, fastPeriod), new SMAIndicator(close, slowPeriod));
    }

    private static Number orPrice(Number value, MarketEvent event) {
        return value != null ? value : event.getPrice();
    }

    private static final class TickerState {
        private final BarSeries series;
        private final SMAIndicator fast;
        private final SMAIndicator slow;
        private int position;

        private TickerState(BarSeries series, SMAIndicator fast, SMAIndicator slow) {
            this.series = series;
            this.fast = fast;
            this.slow = slow;
        }
    }
}
