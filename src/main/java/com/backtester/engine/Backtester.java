package com.backtester.engine;

import com.backtester.event.BacktestEvent;
import com.backtester.event.DividendEvent;
import com.backtester.event.EventQueue;
import com.backtester.event.EventType;
import com.backtester.event.FillEvent;
import com.backtester.event.MarketEvent;
import com.backtester.event.OrderEvent;
import com.backtester.event.SignalEvent;
import com.backtester.exception.BusinessException;
import com.backtester.exception.ErrorCode;
import com.backtester.execution.ExecutionHandler;
import com.backtester.execution.ExecutionResult;
import com.backtester.feed.MarketDataFeed;
import com.backtester.portfolio.Portfolio;
import com.backtester.portfolio.Transaction;
import com.backtester.strategy.SignalStrategy;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one event-driven simulation of a strategy over a market data feed.
 *
 * <p>The run owns its {@link EventQueue} and {@link Portfolio}. Each iteration pulls one time
 * step from the feed, enqueues it, then drains the queue FIFO. Handlers enqueue downstream
 * events synchronously, so a market update can turn into a signal, an order and a booked fill
 * within the same drain pass.
 *
 * <p>Termination happens when the feed is exhausted with an empty queue, when the feed yields
 * an event past {@link BacktestConfig#getEndTime()}, or once the simulation clock has reached
 * the end time and the queue is empty. At most one snapshot is recorded per calendar date and
 * never for a date after the end date.
 *
 * <p>Domain rejections ({@link BusinessException}) drop the offending event, are logged, and
 * are reported in {@link BacktestResult#getRejectedEvents()}. Contract violations
 * ({@link IllegalArgumentException}) abort the run.
 *
 * <p>A backtester instance can be run once.
 */
public class Backtester {

    private static final Logger log = LoggerFactory.getLogger(Backtester.class);

    private static final int RETURN_SCALE = 6;

    @Getter
    private final String runId;

    @Getter
    private final BacktestConfig config;

    private final MarketDataFeed feed;
    private final SignalStrategy strategy;
    private final ExecutionHandler executionHandler;

    private final EventQueue queue = new EventQueue();
    private final Portfolio portfolio;

    private final List<RejectedEvent> rejectedEvents = new ArrayList<>();
    private final Map<EventType, Integer> processedEvents = new EnumMap<>(EventType.class);

    @Getter
    private BacktestState state = BacktestState.RUNNING;

    private LocalDate lastSnapshotDate;
    private long orderSequence;
    private boolean started;

    public Backtester(
            BacktestConfig config, MarketDataFeed feed, SignalStrategy strategy, ExecutionHandler executionHandler) {
        this(generateRunId(), config, feed, strategy, executionHandler);
    }

    public Backtester(
            String runId,
            BacktestConfig config,
            MarketDataFeed feed,
            SignalStrategy strategy,
            ExecutionHandler executionHandler) {
        if (config == null || feed == null || strategy == null || executionHandler == null) {
            throw new IllegalArgumentException("Config, feed, strategy and execution handler are all required");
        }
        this.runId = runId != null ? runId : generateRunId();
        this.config = config;
        this.feed = feed;
        this.strategy = strategy;
        this.executionHandler = executionHandler;
        this.portfolio = new Portfolio(config.getInitialCash(), config.getStartTime());
    }

    /**
     * Runs the simulation to completion and returns its result.
     *
     * @throws IllegalStateException if this backtester has already been run
     */
    public BacktestResult run() {
        if (started) {
            throw new IllegalStateException("Backtest " + runId + " has already been run");
        }
        started = true;

        subscribeFeed();
        log.info(
                "Backtest {} started: strategy={}, window=[{} .. {}], initialCash={}",
                runId,
                strategy.getId(),
                config.getStartTime(),
                config.getEndTime(),
                config.getInitialCash());

        while (state != BacktestState.STOPPED) {
            List<BacktestEvent> batch = feed.streamNext();
            if (batch.isEmpty() && queue.isEmpty()) {
                log.debug("Feed exhausted at {}", portfolio.getCurrentTime());
                state = BacktestState.STOPPED;
                break;
            }

            int queuedBefore = queue.size();
            boolean boundaryReached = enqueueBatch(batch);
            boolean advanced = queue.size() > queuedBefore;

            state = BacktestState.DRAINING_QUEUE;
            drainQueue();

            if (advanced) {
                maybeRecordSnapshot();
            }

            if (boundaryReached || (!portfolio.getCurrentTime().isBefore(config.getEndTime()) && queue.isEmpty())) {
                state = BacktestState.STOPPED;
            } else {
                state = BacktestState.RUNNING;
            }
        }

        finalizeSnapshots();
        BacktestResult result = buildResult();
        log.info(
                "Backtest {} finished: finalNetValue={}, return={}, transactions={}, rejected={}, snapshots={}",
                runId,
                result.getFinalNetValue(),
                result.getTotalReturn(),
                result.getTransactions().size(),
                result.getRejectedEvents().size(),
                result.getSnapshots().size());
        return result;
    }

    /**
     * Enqueues the batch in order, stopping at the first event past the end time.
     *
     * @return true if an event past the end time was seen
     */
    private boolean enqueueBatch(List<BacktestEvent> batch) {
        for (int i = 0; i < batch.size(); i++) {
            BacktestEvent event = batch.get(i);
            if (event.isAfter(config.getEndTime())) {
                log.debug(
                        "Event at {} is past end time {}; discarding it and {} remaining batch events",
                        event.getTimestamp(),
                        config.getEndTime(),
                        batch.size() - i - 1);
                return true;
            }
            if (event.isBefore(config.getStartTime())) {
                log.debug("Skipping {} event at {} before start time", event.getType(), event.getTimestamp());
                continue;
            }
            if (event.isBefore(portfolio.getCurrentTime())) {
                log.warn(
                        "Feed timestamp regression: {} event for {} at {} is before simulation time {}; skipped",
                        event.getType(),
                        event.getTicker(),
                        event.getTimestamp(),
                        portfolio.getCurrentTime());
                continue;
            }
            queue.enqueue(event);
            portfolio.advanceTime(event.getTimestamp());
        }
        return false;
    }

    private void drainQueue() {
        BacktestEvent event;
        while ((event = queue.dequeue()) != null) {
            if (event.isAfter(config.getEndTime())) {
                log.debug("Skipping queued {} event past end time: {}", event.getType(), event.getTimestamp());
                continue;
            }
            try {
                List<BacktestEvent> downstream = dispatch(event);
                processedEvents.merge(event.getType(), 1, Integer::sum);
                downstream.forEach(queue::enqueue);
            } catch (BusinessException e) {
                reject(event, e.getErrorCode(), e.getMessage());
            }
        }
    }

    /**
     * Applies one event and returns the events it produces, in the order they must be queued.
     */
    private List<BacktestEvent> dispatch(BacktestEvent event) {
        return switch (event.getType()) {
            case MARKET -> onMarket((MarketEvent) event);
            case SIGNAL -> onSignal((SignalEvent) event);
            case ORDER -> onOrder((OrderEvent) event);
            case FILL -> onFill((FillEvent) event);
            case DIVIDEND -> onDividend((DividendEvent) event);
        };
    }

    private List<BacktestEvent> onMarket(MarketEvent event) {
        portfolio.updateHoldingPrice(event.getTicker(), event.getPrice());
        List<SignalEvent> signals = strategy.calculateSignals(event);
        return signals != null ? List.copyOf(signals) : List.of();
    }

    private List<BacktestEvent> onSignal(SignalEvent signal) {
        if (!signal.hasPositiveQuantity()) {
            throw new BusinessException(
                    ErrorCode.INVALID_SIGNAL,
                    "Signal for " + signal.getTicker() + " has no positive quantity: " + signal.getSuggestedQuantity());
        }
        OrderEvent order = OrderEvent.market(
                signal.getTimestamp(),
                nextOrderId(),
                signal.getTicker(),
                signal.getSide(),
                signal.getSuggestedQuantity());
        log.debug("Signal -> order {}: {} {} x{}", order.getOrderId(), order.getSide(), order.getTicker(), order.getQuantity());
        return List.of(order);
    }

    private List<BacktestEvent> onOrder(OrderEvent order) {
        Optional<BigDecimal> price = feed.getLatestPrice(order.getTicker(), order.getTimestamp());
        if (price.isEmpty()) {
            throw new BusinessException(
                    ErrorCode.PRICE_UNAVAILABLE,
                    "No price available for " + order.getTicker() + " at " + order.getTimestamp());
        }
        ExecutionResult result = executionHandler.execute(order, price.get());
        if (!result.isFilled()) {
            throw new BusinessException(
                    result.getRejectionCode() != null ? result.getRejectionCode() : ErrorCode.ORDER_REJECTED,
                    result.getRejectionReason());
        }
        return List.of(result.getFill());
    }

    private List<BacktestEvent> onFill(FillEvent fill) {
        portfolio.applyTransaction(Transaction.fromFill(fill));
        return List.of();
    }

    private List<BacktestEvent> onDividend(DividendEvent dividend) {
        portfolio.applyDividend(dividend);
        return List.of();
    }

    private void reject(BacktestEvent event, ErrorCode code, String reason) {
        log.warn("{} event for {} at {} rejected [{}]: {}", event.getType(), event.getTicker(), event.getTimestamp(), code, reason);
        rejectedEvents.add(RejectedEvent.builder()
                .timestamp(event.getTimestamp())
                .eventType(event.getType())
                .ticker(event.getTicker())
                .errorCode(code)
                .reason(reason)
                .build());
    }

    // ---- Snapshots ----

    private void maybeRecordSnapshot() {
        LocalDateTime now = portfolio.getCurrentTime();
        LocalDate date = now.toLocalDate();
        if (date.isAfter(config.getEndTime().toLocalDate())) {
            return;
        }
        if (lastSnapshotDate == null || date.isAfter(lastSnapshotDate)) {
            portfolio.recordSnapshot(now);
            lastSnapshotDate = date;
        }
    }

    /**
     * Records a closing snapshot when the last one is before the end date. Skipped when the
     * portfolio clock is past the end time or its date already has a snapshot.
     */
    private void finalizeSnapshots() {
        LocalDate endDate = config.getEndTime().toLocalDate();
        LocalDateTime now = portfolio.getCurrentTime();
        if (lastSnapshotDate != null && !lastSnapshotDate.isBefore(endDate)) {
            return;
        }
        if (now.isAfter(config.getEndTime())) {
            return;
        }
        if (lastSnapshotDate != null && !now.toLocalDate().isAfter(lastSnapshotDate)) {
            return;
        }
        portfolio.recordSnapshot(now);
        lastSnapshotDate = now.toLocalDate();
    }

    // ---- Result ----

    private BacktestResult buildResult() {
        BigDecimal initial = portfolio.getInitialCash();
        BigDecimal finalValue = portfolio.getNetValue();

        return BacktestResult.builder()
                .runId(runId)
                .strategyId(strategy.getId())
                .config(config)
                .finalState(state)
                .completedAt(portfolio.getCurrentTime())
                .initialNetValue(initial)
                .finalNetValue(finalValue)
                .totalReturn(totalReturn(initial, finalValue))
                .finalCash(portfolio.getCash())
                .realizedPnl(portfolio.getRealizedPnl())
                .totalCommission(portfolio.getTotalCommission())
                .dividendIncome(portfolio.getDividendIncome())
                .finalHoldings(portfolio.getHoldings())
                .snapshots(List.copyOf(portfolio.getSnapshots()))
                .transactions(List.copyOf(portfolio.getTransactions()))
                .dividends(List.copyOf(portfolio.getDividends()))
                .rejectedEvents(List.copyOf(rejectedEvents))
                .processedEvents(Collections.unmodifiableMap(new EnumMap<>(processedEvents)))
                .build();
    }

    static BigDecimal totalReturn(BigDecimal initial, BigDecimal finalValue) {
        if (initial.signum() == 0) {
            return BigDecimal.ZERO.setScale(RETURN_SCALE);
        }
        return finalValue.divide(initial, RETURN_SCALE + 4, RoundingMode.HALF_UP)
                .subtract(BigDecimal.ONE)
                .setScale(RETURN_SCALE, RoundingMode.HALF_UP);
    }

    // ---- Helpers ----

    private void subscribeFeed() {
        Set<String> tickers = new LinkedHashSet<>(strategy.getSubscribedTickers());
        if (tickers.isEmpty()) {
            return;
        }
        if (config.getBenchmarkTicker() != null) {
            tickers.add(config.getBenchmarkTicker());
        }
        feed.subscribe(tickers);
    }

    private String nextOrderId() {
        return "ORD-" + (++orderSequence);
    }

    /** Format: BT-A1B2C3D4 */
    static String generateRunId() {
        return "BT-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }
}
