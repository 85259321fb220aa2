package com.backtester.exception;

import java.util.Map;

/**
 * A domain rejection: the operation is valid in form but cannot be carried out against the
 * current simulation state (insufficient funds, selling an unheld position, unsupported order
 * type, and so on).
 *
 * <p>The backtest loop catches these per event, records them, and keeps running.
 */
public class BusinessException extends BaseException {

    public BusinessException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
