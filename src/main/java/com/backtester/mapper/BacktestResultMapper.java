package com.backtester.mapper;

import com.backtester.api.dto.request.PriceBarRequest;
import com.backtester.api.dto.response.BacktestResultResponse;
import com.backtester.api.dto.response.BacktestSummaryResponse;
import com.backtester.api.dto.response.DividendResponse;
import com.backtester.api.dto.response.HoldingResponse;
import com.backtester.api.dto.response.RejectedEventResponse;
import com.backtester.api.dto.response.SnapshotResponse;
import com.backtester.api.dto.response.TransactionResponse;
import com.backtester.domain.model.PriceBar;
import com.backtester.engine.BacktestResult;
import com.backtester.engine.RejectedEvent;
import com.backtester.event.EventType;
import com.backtester.portfolio.DividendRecord;
import com.backtester.portfolio.HoldingSnapshot;
import com.backtester.portfolio.PortfolioSnapshot;
import com.backtester.portfolio.Transaction;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between backtest domain objects and REST DTOs.
 *
 * <p>Run configuration fields are flattened onto the result response. Inline request bars map
 * straight onto {@link PriceBar}.
 */
@Mapper
public interface BacktestResultMapper {

    @Mapping(target = "startTime", source = "config.startTime")
    @Mapping(target = "endTime", source = "config.endTime")
    @Mapping(target = "initialCash", source = "config.initialCash")
    @Mapping(target = "benchmarkTicker", source = "config.benchmarkTicker")
    @Mapping(target = "finalState", expression = "java(result.getFinalState().name())")
    @Mapping(target = "processedEvents", expression = "java(toEventCounts(result.getProcessedEvents()))")
    BacktestResultResponse toResponse(BacktestResult result);

    @Mapping(target = "startTime", source = "config.startTime")
    @Mapping(target = "endTime", source = "config.endTime")
    @Mapping(target = "finalState", expression = "java(result.getFinalState().name())")
    @Mapping(target = "transactionCount", expression = "java(result.getTransactions().size())")
    @Mapping(target = "snapshotCount", expression = "java(result.getSnapshots().size())")
    @Mapping(target = "rejectedCount", expression = "java(result.getRejectedEvents().size())")
    BacktestSummaryResponse toSummary(BacktestResult result);

    List<BacktestSummaryResponse> toSummaries(List<BacktestResult> results);

    SnapshotResponse toSnapshotResponse(PortfolioSnapshot snapshot);

    List<SnapshotResponse> toSnapshotResponses(List<PortfolioSnapshot> snapshots);

    HoldingResponse toHoldingResponse(HoldingSnapshot holding);

    Map<String, HoldingResponse> toHoldingResponses(Map<String, HoldingSnapshot> holdings);

    TransactionResponse toTransactionResponse(Transaction transaction);

    List<TransactionResponse> toTransactionResponses(List<Transaction> transactions);

    DividendResponse toDividendResponse(DividendRecord dividend);

    @Mapping(target = "errorCode", expression = "java(rejected.getErrorCode() != null ? rejected.getErrorCode().getCode() : null)")
    RejectedEventResponse toRejectedEventResponse(RejectedEvent rejected);

    PriceBar toPriceBar(PriceBarRequest request);

    List<PriceBar> toPriceBars(List<PriceBarRequest> requests);

    default Map<String, Integer> toEventCounts(Map<EventType, Integer> counts) {
        Map<String, Integer> result = new LinkedHashMap<>();
        if (counts != null) {
            counts.forEach((type, count) -> result.put(type.name(), count));
        }
        return result;
    }
}
