package com.backtester.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One inline OHLCV bar. Open, high and low are optional. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceBarRequest {

    @NotNull
    private LocalDateTime timestamp;

    @NotBlank
    private String ticker;

    @PositiveOrZero
    private BigDecimal open;

    @PositiveOrZero
    private BigDecimal high;

    @PositiveOrZero
    private BigDecimal low;

    @NotNull
    @PositiveOrZero
    private BigDecimal close;

    @PositiveOrZero
    private long volume;
}
