package com.backtester.api.dto.response;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Portfolio valuation as of one simulation date. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotResponse {

    private LocalDateTime timestamp;
    private LocalDate date;
    private BigDecimal netValue;
    private BigDecimal cash;
    private BigDecimal holdingsValue;
    private Map<String, HoldingResponse> holdings;
}
