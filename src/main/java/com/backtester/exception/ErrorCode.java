package com.backtester.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    INSUFFICIENT_FUNDS("INSUFFICIENT_FUNDS", 422),
    INSUFFICIENT_POSITION("INSUFFICIENT_POSITION", 422),
    POSITION_LIMIT_EXCEEDED("POSITION_LIMIT_EXCEEDED", 422),
    POSITION_NOT_HELD("POSITION_NOT_HELD", 422),
    UNKNOWN_TRANSACTION_TYPE("UNKNOWN_TRANSACTION_TYPE", 422),
    UNSUPPORTED_ORDER_TYPE("UNSUPPORTED_ORDER_TYPE", 422),
    PRICE_UNAVAILABLE("PRICE_UNAVAILABLE", 422),
    INVALID_SIGNAL("INVALID_SIGNAL", 422),
    ORDER_REJECTED("ORDER_REJECTED", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;
}
