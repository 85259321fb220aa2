package com.backtester.strategy;

import com.backtester.domain.enums.StrategyType;
import com.backtester.strategy.impl.BuyAndHoldStrategy;
import com.backtester.strategy.impl.MovingAverageCrossStrategy;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Creates strategy instances from a type and a loose parameter map.
 *
 * <p>Recognised parameters:
 * <ul>
 *   <li>{@code tickers}: list of tickers to trade (all tickers when absent)</li>
 *   <li>{@code quantity}: shares per trade (default 100)</li>
 *   <li>{@code fastPeriod}, {@code slowPeriod}: SMA windows for {@link StrategyType#MOVING_AVERAGE_CROSS}
 *       (defaults 10 and 30)</li>
 * </ul>
 *
 * <p>Strategy instances are plain Java objects, not Spring beans. Each run gets a fresh one.
 */
@Component
public class StrategyFactory {

    private static final Logger log = LoggerFactory.getLogger(StrategyFactory.class);

    static final int DEFAULT_QUANTITY = 100;
    static final int DEFAULT_FAST_PERIOD = 10;
    static final int DEFAULT_SLOW_PERIOD = 30;

    public SignalStrategy create(StrategyType type, Map<String, Object> params) {
        if (type == null) {
            throw new IllegalArgumentException("Strategy type is required");
        }
        Map<String, Object> safeParams = params != null ? params : Map.of();
        String id = generateId();
        Set<String> tickers = tickers(safeParams.get("tickers"));
        int quantity = intParam(safeParams, "quantity", DEFAULT_QUANTITY);

        SignalStrategy strategy = switch (type) {
            case BUY_AND_HOLD -> new BuyAndHoldStrategy(id, tickers, quantity);
            case MOVING_AVERAGE_CROSS -> new MovingAverageCrossStrategy(
                    id,
                    tickers,
                    intParam(safeParams, "fastPeriod", DEFAULT_FAST_PERIOD),
                    intParam(safeParams, "slowPeriod", DEFAULT_SLOW_PERIOD),
                    quantity);
        };
        log.info("Created strategy: id={}, type={}, tickers={}", id, type, tickers);
        return strategy;
    }

    private static int intParam(Map<String, Object> params, String key, int defaultValue) {
        Object value = params.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Strategy parameter '" + key + "' must be an integer, got: " + value, e);
        }
    }

    private static Set<String> tickers(Object value) {
        Set<String> tickers = new LinkedHashSet<>();
        if (value instanceof Collection<?> collection) {
            collection.stream().filter(t -> t != null).map(Object::toString).map(String::trim)
                    .filter(t -> !t.isEmpty()).forEach(tickers::add);
        } else if (value != null) {
            for (String t : value.toString().split(",")) {
                if (!t.isBlank()) {
                    tickers.add(t.trim());
                }
            }
        }
        return tickers;
    }

    /** Format: STR-A1B2C3D4 */
    String generateId() {
        return "STR-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }
}
