package com.backtester.execution;

import com.backtester.event.FillEvent;
import com.backtester.exception.ErrorCode;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of asking an {@link ExecutionHandler} to execute an order.
 *
 * <p>Either carries the {@link FillEvent} or, when rejected, the reason. Rejections are normal
 * outcomes in a backtest, not errors.
 */
@Data
@Builder
public class ExecutionResult {

    private FillEvent fill;

    /** Rejection classification. Null if filled. */
    private ErrorCode rejectionCode;

    /** Human-readable reason for rejection. Null if filled. */
    private String rejectionReason;

    public boolean isFilled() {
        return fill != null;
    }

    public static ExecutionResult filled(FillEvent fill) {
        return ExecutionResult.builder().fill(fill).build();
    }

    public static ExecutionResult rejected(ErrorCode code, String reason) {
        return ExecutionResult.builder()
                .rejectionCode(code)
                .rejectionReason(reason)
                .build();
    }
}
