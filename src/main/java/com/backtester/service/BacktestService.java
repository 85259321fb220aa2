package com.backtester.service;

import com.backtester.api.dto.request.BacktestRequest;
import com.backtester.api.dto.request.DividendRequest;
import com.backtester.config.BacktestProperties;
import com.backtester.domain.model.PriceBar;
import com.backtester.engine.BacktestConfig;
import com.backtester.engine.BacktestResult;
import com.backtester.engine.Backtester;
import com.backtester.event.DividendEvent;
import com.backtester.exception.ResourceNotFoundException;
import com.backtester.execution.ExecutionHandler;
import com.backtester.feed.CsvBarLoader;
import com.backtester.feed.HistoricalBarFeed;
import com.backtester.mapper.BacktestResultMapper;
import com.backtester.strategy.SignalStrategy;
import com.backtester.strategy.StrategyFactory;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs backtests on request and keeps their results for later lookup.
 *
 * <p>Each run gets a fresh feed, strategy and {@link Backtester}; only the execution handler
 * bean is shared, and it is stateless. Results live in a Caffeine cache bounded by
 * {@code backtester.max-retained-runs}; Caffeine picks which run to evict once the bound is hit.
 */
@Service
public class BacktestService {

    private static final Logger log = LoggerFactory.getLogger(BacktestService.class);

    private final BacktestProperties backtestProperties;
    private final StrategyFactory strategyFactory;
    private final ExecutionHandler executionHandler;
    private final CsvBarLoader csvBarLoader;
    private final BacktestResultMapper backtestResultMapper;

    /** Caffeine cache: key = runId, value = result tagged with its retention order. */
    private final Cache<String, RetainedRun> results;

    private final AtomicLong retentionSequence = new AtomicLong(0);

    public BacktestService(
            BacktestProperties backtestProperties,
            StrategyFactory strategyFactory,
            ExecutionHandler executionHandler,
            CsvBarLoader csvBarLoader,
            BacktestResultMapper backtestResultMapper) {
        this.backtestProperties = backtestProperties;
        this.strategyFactory = strategyFactory;
        this.executionHandler = executionHandler;
        this.csvBarLoader = csvBarLoader;
        this.backtestResultMapper = backtestResultMapper;
        this.results = Caffeine.newBuilder()
                .maximumSize(Math.max(1, backtestProperties.getMaxRetainedRuns()))
                .executor(Runnable::run)
                .removalListener((String runId, RetainedRun run, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        log.debug("Evicting backtest result {}", runId);
                    }
                })
                .build();
    }

    /**
     * Runs a backtest synchronously and retains its result.
     *
     * @throws IllegalArgumentException if the run configuration or strategy parameters are invalid
     */
    public BacktestResult runBacktest(BacktestRequest request) {
        BacktestConfig config = BacktestConfig.builder()
                .startTime(request.getStartTime())
                .endTime(request.getEndTime())
                .initialCash(request.getInitialCash() != null
                        ? request.getInitialCash()
                        : backtestProperties.getDefaultInitialCash())
                .benchmarkTicker(request.getBenchmarkTicker())
                .build();

        List<PriceBar> bars = loadBars(request);
        if (bars.isEmpty()) {
            throw new IllegalArgumentException("No market data supplied for the backtest");
        }

        SignalStrategy strategy = strategyFactory.create(
                request.getStrategy().getType(), request.getStrategy().getParams());
        HistoricalBarFeed feed = new HistoricalBarFeed(bars, toDividendEvents(request.getDividends()));

        BacktestResult result = new Backtester(config, feed, strategy, executionHandler).run();
        results.put(result.getRunId(), new RetainedRun(retentionSequence.incrementAndGet(), result));
        log.info(
                "Backtest {} retained: strategy={} ({}), bars={}, finalNetValue={}",
                result.getRunId(),
                strategy.getId(),
                request.getStrategy().getType(),
                bars.size(),
                result.getFinalNetValue());
        return result;
    }

    /**
     * @throws ResourceNotFoundException if no retained run has this id
     */
    public BacktestResult getResult(String runId) {
        RetainedRun run = results.getIfPresent(runId);
        if (run == null) {
            throw new ResourceNotFoundException("Backtest", runId);
        }
        return run.result();
    }

    /** Retained runs in the order they were run. */
    public List<BacktestResult> getResults() {
        return results.asMap().values().stream()
                .sorted(Comparator.comparingLong(RetainedRun::sequence))
                .map(RetainedRun::result)
                .toList();
    }

    private List<PriceBar> loadBars(BacktestRequest request) {
        List<PriceBar> bars = new ArrayList<>();
        if (request.getBars() != null) {
            bars.addAll(backtestResultMapper.toPriceBars(request.getBars()));
        }
        if (request.getDataFile() != null && !request.getDataFile().isBlank()) {
            bars.addAll(csvBarLoader.load(request.getDataFile()));
        }
        return bars;
    }

    private static List<DividendEvent> toDividendEvents(List<DividendRequest> dividends) {
        if (dividends == null) {
            return List.of();
        }
        return dividends.stream()
                .map(d -> new DividendEvent(
                        d.getTimestamp(), d.getTicker(), d.getDividendPerShare(), d.getExDate(), d.getPaymentDate()))
                .toList();
    }

    private record RetainedRun(long sequence, BacktestResult result) {}
}
