package com.backtester.engine;

import com.backtester.event.EventType;
import com.backtester.exception.ErrorCode;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/** An event the run dropped instead of applying, with the reason. */
@Value
@Builder
public class RejectedEvent {

    LocalDateTime timestamp;
    EventType eventType;
    String ticker;
    ErrorCode errorCode;
    String reason;
}
