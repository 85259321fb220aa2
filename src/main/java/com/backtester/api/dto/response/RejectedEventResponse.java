package com.backtester.api.dto.response;

import com.backtester.event.EventType;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RejectedEventResponse {

    private LocalDateTime timestamp;
    private EventType eventType;
    private String ticker;
    private String errorCode;
    private String reason;
}
