package com.backtester.event;

import java.time.LocalDateTime;
import lombok.Getter;
import lombok.ToString;

/**
 * Base type for every event placed on the {@link EventQueue}.
 *
 * <p>The hierarchy is closed: {@link MarketEvent}, {@link SignalEvent}, {@link OrderEvent},
 * {@link FillEvent} and {@link DividendEvent}. Consumers dispatch with a {@code switch} over
 * {@link #getType()}, which the compiler checks for exhaustiveness.
 *
 * <p>Events are immutable. The timestamp is fixed at construction and is the simulation
 * time the event belongs to, not the wall-clock time it was created.
 */
@Getter
@ToString
public abstract class BacktestEvent {

    private final EventType type;
    private final LocalDateTime timestamp;

    protected BacktestEvent(EventType type, LocalDateTime timestamp) {
        if (timestamp == null) {
            throw new IllegalArgumentException("Event timestamp is required");
        }
        this.type = type;
        this.timestamp = timestamp;
    }

    /** The ticker this event refers to. */
    public abstract String getTicker();

    /** Returns true if this event happens strictly after the given boundary. */
    public boolean isAfter(LocalDateTime boundary) {
        return timestamp.isAfter(boundary);
    }

    /** Returns true if this event happens strictly before the given time. */
    public boolean isBefore(LocalDateTime time) {
        return timestamp.isBefore(time);
    }

    static String requireTicker(String ticker) {
        if (ticker == null || ticker.isBlank()) {
            throw new IllegalArgumentException("Ticker must be a non-empty string");
        }
        return ticker;
    }
}
