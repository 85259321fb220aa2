package com.backtester.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.backtester.api.dto.request.BacktestRequest;
import com.backtester.api.dto.request.DividendRequest;
import com.backtester.api.dto.request.PriceBarRequest;
import com.backtester.api.dto.request.StrategyRequest;
import com.backtester.config.BacktestProperties;
import com.backtester.domain.enums.StrategyType;
import com.backtester.engine.BacktestResult;
import com.backtester.exception.ResourceNotFoundException;
import com.backtester.execution.SimulatedExecutionHandler;
import com.backtester.feed.CsvBarLoader;
import com.backtester.mapper.BacktestResultMapper;
import com.backtester.service.BacktestService;
import com.backtester.strategy.StrategyFactory;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mapstruct.factory.Mappers;

/**
 * Unit tests for BacktestService.
 *
 * <p>Wires real collaborators so a request runs end to end: inline and CSV data, default cash,
 * bounded result retention, and lookup of unknown runs.
 */
class BacktestServiceTest {

    private static final LocalDateTime T1 = LocalDateTime.of(2024, 1, 2, 16, 0);

    @TempDir
    Path dataDir;

    private BacktestProperties properties;
    private BacktestService backtestService;

    @BeforeEach
    void setUp() {
        properties = new BacktestProperties();
        properties.setDataDirectory(dataDir.toString());
        properties.setDefaultInitialCash(new BigDecimal("50000"));
        properties.setMaxRetainedRuns(2);
        backtestService = newService();
    }

    @Test
    void runBacktest_inlineBarsWithDefaultCash() {
        BacktestResult result = backtestService.runBacktest(request(List.of(
                bar(T1, "100"), bar(T1.plusDays(1), "105"), bar(T1.plusDays(2), "103"))));

        assertThat(result.getRunId()).startsWith("BT-");
        assertThat(result.getInitialNetValue()).isEqualByComparingTo("50000");
        assertThat(result.getTransactions()).hasSize(1);
        // 10 shares at 100 with a 1.00 minimum commission, marked at 103
        assertThat(result.getFinalCash()).isEqualByComparingTo("48999.00");
        assertThat(result.getFinalNetValue()).isEqualByComparingTo("50029.00");
        assertThat(result.getSnapshots()).hasSize(3);
        assertThat(backtestService.getResult(result.getRunId())).isSameAs(result);
    }

    @Test
    void runBacktest_readsCsvAndAppliesDividends() throws IOException {
        Files.writeString(dataDir.resolve("aapl.csv"), """
                timestamp,ticker,open,high,low,close,volume
                2024-01-02T16:00:00,AAPL,100,100,100,100,1000
                2024-01-03T16:00:00,AAPL,101,101,101,101,1000
                """);
        BacktestRequest request = request(new ArrayList<>());
        request.setDataFile("aapl.csv");
        request.setInitialCash(new BigDecimal("10000"));
        request.setDividends(List.of(DividendRequest.builder()
                .timestamp(T1.plusDays(1))
                .ticker("AAPL")
                .dividendPerShare(new BigDecimal("1.00"))
                .build()));

        BacktestResult result = backtestService.runBacktest(request);

        assertThat(result.getTransactions()).hasSize(1);
        assertThat(result.getDividendIncome()).isEqualByComparingTo("10.00");
    }

    @Test
    void runBacktest_withoutDataIsRejected() {
        assertThatThrownBy(() -> backtestService.runBacktest(request(new ArrayList<>())))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void runBacktest_endBeforeStartIsRejected() {
        BacktestRequest request = request(List.of(bar(T1, "100")));
        request.setEndTime(T1.minusDays(3));

        assertThatThrownBy(() -> backtestService.runBacktest(request)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void results_boundedByRetentionLimit() {
        List<BacktestResult> runs = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            runs.add(backtestService.runBacktest(request(List.of(bar(T1, "100")))));
        }

        List<String> retained = backtestService.getResults().stream()
                .map(BacktestResult::getRunId)
                .toList();
        assertThat(retained).hasSize(2);
        // retained runs are listed in the order they ran
        List<String> runOrder = runs.stream().map(BacktestResult::getRunId).toList();
        assertThat(runOrder.indexOf(retained.get(0))).isLessThan(runOrder.indexOf(retained.get(1)));

        long missing = runs.stream()
                .filter(run -> {
                    try {
                        backtestService.getResult(run.getRunId());
                        return false;
                    } catch (ResourceNotFoundException e) {
                        return true;
                    }
                })
                .count();
        assertThat(missing).isEqualTo(3);
    }

    @Test
    void results_listedInRunOrder() {
        properties.setMaxRetainedRuns(10);
        backtestService = newService();
        BacktestResult first = backtestService.runBacktest(request(List.of(bar(T1, "100"))));
        BacktestResult second = backtestService.runBacktest(request(List.of(bar(T1, "100"))));
        BacktestResult third = backtestService.runBacktest(request(List.of(bar(T1, "100"))));

        assertThat(backtestService.getResults())
                .extracting(BacktestResult::getRunId)
                .containsExactly(first.getRunId(), second.getRunId(), third.getRunId());
        assertThat(backtestService.getResult(second.getRunId())).isSameAs(second);
    }

    @Test
    void getResult_unknownIdIsNotFound() {
        assertThatThrownBy(() -> backtestService.getResult("BT-NOPE")).isInstanceOf(ResourceNotFoundException.class);
    }

    private BacktestService newService() {
        SimulatedExecutionHandler executionHandler = SimulatedExecutionHandler.builder()
                .commissionPerShare(properties.getCommission().getPerShare())
                .commissionPercentage(properties.getCommission().getPercentage())
                .minimumCommission(properties.getCommission().getMinimum())
                .build();
        return new BacktestService(
                properties,
                new StrategyFactory(),
                executionHandler,
                new CsvBarLoader(properties),
                Mappers.getMapper(BacktestResultMapper.class));
    }

    private static BacktestRequest request(List<PriceBarRequest> bars) {
        return BacktestRequest.builder()
                .startTime(T1.withHour(9))
                .endTime(T1.plusDays(10))
                .strategy(StrategyRequest.builder()
                        .type(StrategyType.BUY_AND_HOLD)
                        .params(Map.of("tickers", List.of("AAPL"), "quantity", 10))
                        .build())
                .bars(bars)
                .build();
    }

    private static PriceBarRequest bar(LocalDateTime timestamp, String close) {
        return PriceBarRequest.builder()
                .timestamp(timestamp)
                .ticker("AAPL")
                .close(new BigDecimal(close))
                .build();
    }
}
