package com.backtester.event;

import java.util.ArrayDeque;
import java.util.Deque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * FIFO buffer of pending events for a single backtest run.
 *
 * <p>Order is insertion order only. There is no priority, no timestamp sorting and no
 * deduplication; callers insert events in the order they must be processed.
 *
 * <p>Not thread-safe. One queue belongs to one {@link com.backtester.engine.Backtester}
 * and is only touched from the thread running it, so {@link #dequeue()} never blocks.
 */
public class EventQueue {

    private static final Logger log = LoggerFactory.getLogger(EventQueue.class);

    private final Deque<BacktestEvent> queue = new ArrayDeque<>();

    /**
     * Appends an event to the tail of the queue.
     *
     * @throws IllegalArgumentException if {@code event} is null
     */
    public void enqueue(BacktestEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Only events can be added to the event queue");
        }
        queue.addLast(event);
        log.trace("Event enqueued: {} {} queueSize={}", event.getType(), event.getTicker(), queue.size());
    }

    /**
     * Removes and returns the head of the queue, or null if the queue is empty.
     */
    public BacktestEvent dequeue() {
        return queue.pollFirst();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }

    @Override
    public String toString() {
        return "EventQueue(size=" + queue.size() + ")";
    }
}
