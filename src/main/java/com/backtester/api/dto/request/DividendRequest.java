package com.backtester.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A cash dividend to inject into the run. Ex and payment dates default to the timestamp's date. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DividendRequest {

    @NotNull
    private LocalDateTime timestamp;

    @NotBlank
    private String ticker;

    @NotNull
    @PositiveOrZero
    private BigDecimal dividendPerShare;

    private LocalDate exDate;

    private LocalDate paymentDate;
}
