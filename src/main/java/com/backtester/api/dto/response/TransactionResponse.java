package com.backtester.api.dto.response;

import com.backtester.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionResponse {

    private LocalDateTime timestamp;
    private String ticker;
    private OrderSide side;
    private int quantity;
    private BigDecimal price;
    private BigDecimal commission;
    private BigDecimal grossValue;
    private String orderId;
}
