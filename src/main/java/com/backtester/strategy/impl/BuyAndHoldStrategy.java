package com.backtester.strategy.impl;

import com.backtester.domain.enums.OrderSide;
import com.backtester.event.MarketEvent;
import com.backtester.event.SignalEvent;
import com.backtester.strategy.SignalStrategy;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Buys a fixed quantity of each ticker on its first market event and never sells.
 *
 * <p>With no configured tickers every ticker the feed emits is bought once.
 */
public class BuyAndHoldStrategy implements SignalStrategy {

    private static final Logger log = LoggerFactory.getLogger(BuyAndHoldStrategy.class);

    @Getter
    private final String id;

    @Getter
    private final int quantity;

    private final Set<String> tickers;
    private final Set<String> bought = new HashSet<>();

    public BuyAndHoldStrategy(String id, Set<String> tickers, int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Buy-and-hold quantity must be positive: " + quantity);
        }
        this.id = id;
        this.tickers = tickers != null ? new LinkedHashSet<>(tickers) : new LinkedHashSet<>();
        this.quantity = quantity;
    }

    @Override
    public List<SignalEvent> calculateSignals(MarketEvent event) {
        String ticker = event.getTicker();
        if (!tickers.isEmpty() && !tickers.contains(ticker)) {
            return List.of();
        }
        if (!bought.add(ticker)) {
            return List.of();
        }
        log.debug("[{}] Initial buy: {} x{} at {}", id, ticker, quantity, event.getTimestamp());
        return List.of(new SignalEvent(event.getTimestamp(), ticker, OrderSide.BUY, quantity));
    }

    @Override
    public Set<String> getSubscribedTickers() {
        return Set.copyOf(tickers);
    }
}
