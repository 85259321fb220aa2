package com.backtester.unit.feed;

import static org.assertj.core.api.Assertions.assertThat;

import com.backtester.domain.model.PriceBar;
import com.backtester.event.BacktestEvent;
import com.backtester.event.DividendEvent;
import com.backtester.event.EventType;
import com.backtester.feed.HistoricalBarFeed;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for HistoricalBarFeed.
 *
 * <p>Verifies: grouping by timestamp, chronological ordering of unsorted input, dividends after
 * market events, point-in-time price lookup, and ticker subscription.
 */
class HistoricalBarFeedTest {

    private static final LocalDateTime T1 = LocalDateTime.of(2024, 1, 2, 16, 0);
    private static final LocalDateTime T2 = T1.plusDays(1);

    @Test
    void streamNext_groupsEventsByTimestampInOrder() {
        HistoricalBarFeed feed = new HistoricalBarFeed(
                List.of(bar(T2, "AAPL", "110"), bar(T1, "MSFT", "300"), bar(T1, "AAPL", "100")),
                List.of(new DividendEvent(T1, "AAPL", new BigDecimal("0.24"))));

        List<BacktestEvent> first = feed.streamNext();
        assertThat(first).extracting(BacktestEvent::getTimestamp).containsOnly(T1);
        assertThat(first).extracting(BacktestEvent::getType)
                .containsExactly(EventType.MARKET, EventType.MARKET, EventType.DIVIDEND);
        assertThat(first).extracting(BacktestEvent::getTicker).containsExactly("AAPL", "MSFT", "AAPL");

        assertThat(feed.streamNext()).extracting(BacktestEvent::getTimestamp).containsExactly(T2);
        assertThat(feed.streamNext()).isEmpty();
        assertThat(feed.streamNext()).isEmpty();
    }

    @Test
    void getLatestPrice_usesLastCloseAtOrBeforeTime() {
        HistoricalBarFeed feed =
                new HistoricalBarFeed(List.of(bar(T1, "AAPL", "100"), bar(T2, "AAPL", "110")), List.of());

        assertThat(feed.getLatestPrice("AAPL", T1.minusMinutes(1))).isEmpty();
        assertThat(feed.getLatestPrice("AAPL", T1)).hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("100"));
        assertThat(feed.getLatestPrice("AAPL", T2.minusHours(1)))
                .hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("100"));
        assertThat(feed.getLatestPrice("AAPL", T2.plusDays(5)))
                .hasValueSatisfying(p -> assertThat(p).isEqualByComparingTo("110"));
        assertThat(feed.getLatestPrice("MSFT", T2)).isEmpty();
    }

    @Test
    void subscribe_filtersTickersAndSkipsEmptySteps() {
        HistoricalBarFeed feed = new HistoricalBarFeed(
                List.of(bar(T1, "MSFT", "300"), bar(T2, "AAPL", "110"), bar(T2, "MSFT", "305")), List.of());

        feed.subscribe(Set.of("AAPL"));

        List<BacktestEvent> first = feed.streamNext();
        assertThat(first).hasSize(1);
        assertThat(first.get(0).getTicker()).isEqualTo("AAPL");
        assertThat(first.get(0).getTimestamp()).isEqualTo(T2);
        assertThat(feed.streamNext()).isEmpty();
        // Prices stay available for every ticker
        assertThat(feed.getLatestPrice("MSFT", T2)).isPresent();
    }

    @Test
    void getTickers_listsTickersWithBars() {
        HistoricalBarFeed feed =
                new HistoricalBarFeed(List.of(bar(T1, "AAPL", "100"), bar(T1, "MSFT", "300")), null);

        assertThat(feed.getTickers()).containsExactlyInAnyOrder("AAPL", "MSFT");
    }

    private static PriceBar bar(LocalDateTime timestamp, String ticker, String close) {
        return PriceBar.builder()
                .timestamp(timestamp)
                .ticker(ticker)
                .close(new BigDecimal(close))
                .build();
    }
}
