package com.backtester.api.dto.response;

import java.time.Instant;
import java.util.Collection;
import lombok.Getter;

/**
 * Success envelope for every REST response. Collection payloads also report their size in
 * {@code count}.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success;
    private final T data;
    private final Integer count;
    private final Instant timestamp;

    private ApiResponse(T data) {
        this.success = true;
        this.data = data;
        this.count = data instanceof Collection<?> collection ? collection.size() : null;
        this.timestamp = Instant.now();
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(data);
    }
}
