package com.backtester.feed;

import com.backtester.domain.model.PriceBar;
import com.backtester.event.BacktestEvent;
import com.backtester.event.DividendEvent;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory {@link MarketDataFeed} over a fixed set of price bars and dividends.
 *
 * <p>Events are grouped by timestamp. Each {@link #streamNext()} call returns every event that
 * shares the next timestamp: market events first (in ticker order), then dividends. Time steps
 * whose events are all filtered out by the subscription are skipped, so an empty batch always
 * means the feed is exhausted.
 *
 * <p>{@link #getLatestPrice(String, LocalDateTime)} answers from the full bar history using the
 * close of the latest bar at or before the requested time.
 */
public class HistoricalBarFeed implements MarketDataFeed {

    private static final Logger log = LoggerFactory.getLogger(HistoricalBarFeed.class);

    private final NavigableMap<LocalDateTime, List<BacktestEvent>> timeline = new TreeMap<>();

    /** Close prices per ticker, keyed by bar time. */
    private final Map<String, NavigableMap<LocalDateTime, BigDecimal>> closes = new HashMap<>();

    private final Set<String> subscribedTickers = new LinkedHashSet<>();

    private Iterator<List<BacktestEvent>> cursor;

    public HistoricalBarFeed(List<PriceBar> bars, List<DividendEvent> dividends) {
        List<PriceBar> sortedBars = new ArrayList<>(bars != null ? bars : List.of());
        sortedBars.sort(Comparator.comparing(PriceBar::getTimestamp).thenComparing(PriceBar::getTicker));

        for (PriceBar bar : sortedBars) {
            timeline.computeIfAbsent(bar.getTimestamp(), t -> new ArrayList<>()).add(bar.toMarketEvent());
            closes.computeIfAbsent(bar.getTicker(), t -> new TreeMap<>()).put(bar.getTimestamp(), bar.getClose());
        }

        List<DividendEvent> sortedDividends = new ArrayList<>(dividends != null ? dividends : List.of());
        sortedDividends.sort(Comparator.comparing(DividendEvent::getTimestamp));
        for (DividendEvent dividend : sortedDividends) {
            timeline.computeIfAbsent(dividend.getTimestamp(), t -> new ArrayList<>()).add(dividend);
        }

        log.info(
                "Historical feed loaded: {} bars, {} dividends, {} time steps, tickers={}",
                sortedBars.size(),
                sortedDividends.size(),
                timeline.size(),
                closes.keySet());
    }

    @Override
    public List<BacktestEvent> streamNext() {
        if (cursor == null) {
            cursor = timeline.values().iterator();
        }
        while (cursor.hasNext()) {
            List<BacktestEvent> batch = cursor.next().stream()
                    .filter(event -> isSubscribed(event.getTicker()))
                    .toList();
            if (!batch.isEmpty()) {
                return batch;
            }
        }
        return List.of();
    }

    @Override
    public Optional<BigDecimal> getLatestPrice(String ticker, LocalDateTime asOf) {
        NavigableMap<LocalDateTime, BigDecimal> series = closes.get(ticker);
        if (series == null || asOf == null) {
            return Optional.empty();
        }
        Map.Entry<LocalDateTime, BigDecimal> entry = series.floorEntry(asOf);
        return entry != null ? Optional.of(entry.getValue()) : Optional.empty();
    }

    /**
     * Restricts output to the given tickers. Repeated calls add to the subscription. With no
     * subscription at all, every ticker is emitted.
     */
    @Override
    public void subscribe(Collection<String> tickers) {
        if (tickers == null) {
            return;
        }
        tickers.stream().filter(t -> t != null && !t.isBlank()).forEach(subscribedTickers::add);
        log.debug("Feed subscription: {}", subscribedTickers);
    }

    /** Tickers with at least one bar. */
    public Set<String> getTickers() {
        return closes.keySet();
    }

    private boolean isSubscribed(String ticker) {
        return subscribedTickers.isEmpty() || subscribedTickers.contains(ticker);
    }
}
