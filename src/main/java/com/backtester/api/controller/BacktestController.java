package com.backtester.api.controller;

import com.backtester.api.dto.request.BacktestRequest;
import com.backtester.api.dto.response.BacktestResultResponse;
import com.backtester.api.dto.response.BacktestSummaryResponse;
import com.backtester.api.dto.response.SnapshotResponse;
import com.backtester.api.dto.response.TransactionResponse;
import com.backtester.mapper.BacktestResultMapper;
import com.backtester.service.BacktestService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for running backtests and reading their results.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/backtests                         - Run a backtest and return its result</li>
 *   <li>GET  /api/backtests                         - Summaries of retained runs</li>
 *   <li>GET  /api/backtests/{runId}                 - Full result of one run</li>
 *   <li>GET  /api/backtests/{runId}/snapshots       - Daily snapshot series</li>
 *   <li>GET  /api/backtests/{runId}/transactions    - Transaction ledger</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/backtests")
@RequiredArgsConstructor
public class BacktestController {

    private final BacktestService backtestService;
    private final BacktestResultMapper backtestResultMapper;

    /** Runs synchronously. Returns 201 with the full result. */
    @PostMapping
    public ResponseEntity<BacktestResultResponse> runBacktest(@Valid @RequestBody BacktestRequest request) {
        BacktestResultResponse response = backtestResultMapper.toResponse(backtestService.runBacktest(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<List<BacktestSummaryResponse>> listBacktests() {
        return ResponseEntity.ok(backtestResultMapper.toSummaries(backtestService.getResults()));
    }

    @GetMapping("/{runId}")
    public ResponseEntity<BacktestResultResponse> getBacktest(@PathVariable String runId) {
        return ResponseEntity.ok(backtestResultMapper.toResponse(backtestService.getResult(runId)));
    }

    @GetMapping("/{runId}/snapshots")
    public ResponseEntity<List<SnapshotResponse>> getSnapshots(@PathVariable String runId) {
        return ResponseEntity.ok(
                backtestResultMapper.toSnapshotResponses(backtestService.getResult(runId).getSnapshots()));
    }

    @GetMapping("/{runId}/transactions")
    public ResponseEntity<List<TransactionResponse>> getTransactions(@PathVariable String runId) {
        return ResponseEntity.ok(
                backtestResultMapper.toTransactionResponses(backtestService.getResult(runId).getTransactions()));
    }
}
