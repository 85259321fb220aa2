package com.backtester.event;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.Getter;
import lombok.ToString;

/**
 * A cash dividend for one ticker. The event timestamp is the ex-date as seen by the
 * simulation; ex-date and payment date default to the timestamp's date when not given.
 */
@Getter
@ToString(callSuper = true)
public class DividendEvent extends BacktestEvent {

    private final String ticker;
    private final BigDecimal dividendPerShare;
    private final LocalDate exDate;
    private final LocalDate paymentDate;

    public DividendEvent(LocalDateTime timestamp, String ticker, BigDecimal dividendPerShare) {
        this(timestamp, ticker, dividendPerShare, null, null);
    }

    public DividendEvent(
            LocalDateTime timestamp,
            String ticker,
            BigDecimal dividendPerShare,
            LocalDate exDate,
            LocalDate paymentDate) {
        super(EventType.DIVIDEND, timestamp);
        if (dividendPerShare == null || dividendPerShare.signum() < 0) {
            throw new IllegalArgumentException("Dividend per share must be a non-negative number: " + dividendPerShare);
        }
        this.ticker = requireTicker(ticker);
        this.dividendPerShare = dividendPerShare;
        this.exDate = exDate != null ? exDate : timestamp.toLocalDate();
        this.paymentDate = paymentDate != null ? paymentDate : timestamp.toLocalDate();
    }
}
