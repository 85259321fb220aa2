package com.backtester.portfolio;

import com.backtester.domain.enums.OrderSide;
import com.backtester.event.DividendEvent;
import com.backtester.exception.BusinessException;
import com.backtester.exception.ErrorCode;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cash, holdings and history of a simulated trading account.
 *
 * <p>State only changes through {@link #applyTransaction(Transaction)},
 * {@link #applyDividend(DividendEvent)}, the two cash primitives {@link #addCash(BigDecimal)} /
 * {@link #removeCash(BigDecimal)}, and price marks. Cash never goes negative: every transaction
 * is validated in full before the first mutation, so a rejected transaction leaves cash,
 * holdings and the ledger exactly as they were.
 *
 * <p>Holdings are long-only and keyed by ticker. A holding is removed as soon as its quantity
 * returns to zero.
 *
 * <p>Not thread-safe. A portfolio is owned by a single backtest run.
 */
public class Portfolio {

    private static final Logger log = LoggerFactory.getLogger(Portfolio.class);

    private final LocalDateTime startTime;
    private final BigDecimal initialCash;
    private BigDecimal cash;
    private LocalDateTime currentTime;

    private final Map<String, Holding> holdings = new LinkedHashMap<>();
    private final List<Transaction> transactions = new ArrayList<>();
    private final List<PortfolioSnapshot> snapshots = new ArrayList<>();
    private final List<DividendRecord> dividends = new ArrayList<>();

    /** Sell proceeds minus the cost basis of the shares sold, before commissions. */
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    private BigDecimal totalCommission = BigDecimal.ZERO;
    private BigDecimal dividendIncome = BigDecimal.ZERO;

    public Portfolio(BigDecimal initialCash, LocalDateTime startTime) {
        if (initialCash == null || initialCash.signum() < 0) {
            throw new IllegalArgumentException("Initial cash must be a non-negative number: " + initialCash);
        }
        if (startTime == null) {
            throw new IllegalArgumentException("Portfolio start time is required");
        }
        this.initialCash = initialCash;
        this.cash = initialCash;
        this.startTime = startTime;
        this.currentTime = startTime;
    }

    // ---- Time ----

    /**
     * Moves the portfolio clock forward. Times at or before the current time are ignored, so
     * the clock never goes backwards.
     *
     * @throws IllegalArgumentException if {@code time} is null
     */
    public void advanceTime(LocalDateTime time) {
        if (time == null) {
            throw new IllegalArgumentException("New time must be a valid timestamp");
        }
        if (time.isAfter(currentTime)) {
            currentTime = time;
        } else if (time.isBefore(currentTime)) {
            log.debug("Ignoring backward time advance: current={}, requested={}", currentTime, time);
        }
    }

    // ---- Cash primitives ----

    public void addCash(BigDecimal amount) {
        requireNonNegative(amount, "Amount to add");
        cash = cash.add(amount);
    }

    /**
     * @throws BusinessException with {@link ErrorCode#INSUFFICIENT_FUNDS} if {@code amount}
     *         exceeds available cash
     */
    public void removeCash(BigDecimal amount) {
        requireNonNegative(amount, "Amount to remove");
        if (amount.compareTo(cash) > 0) {
            throw insufficientFunds(amount);
        }
        cash = cash.subtract(amount);
    }

    // ---- Valuation ----

    /** Marks an owned holding to {@code price}. Prices for tickers not held are ignored. */
    public void updateHoldingPrice(String ticker, BigDecimal price) {
        Holding holding = holdings.get(ticker);
        if (holding != null) {
            holding.updatePrice(price);
        }
    }

    public BigDecimal getTotalHoldingsValue() {
        return holdings.values().stream().map(Holding::getMarketValue).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /** Cash plus the market value of all holdings. */
    public BigDecimal getNetValue() {
        return getTotalHoldingsValue().add(cash);
    }

    // ---- Transactions ----

    /**
     * Books an executed trade.
     *
     * <p>Commission is always charged first. A BUY then debits {@code quantity * price} and adds
     * the shares (creating the holding if needed). A SELL credits {@code quantity * price},
     * removes the shares, and drops the holding once it is flat.
     *
     * @throws BusinessException if the trade cannot be booked: {@link ErrorCode#INSUFFICIENT_FUNDS},
     *         {@link ErrorCode#POSITION_NOT_HELD}, {@link ErrorCode#INSUFFICIENT_POSITION} or
     *         {@link ErrorCode#UNKNOWN_TRANSACTION_TYPE}; on a BUY also
     *         {@link ErrorCode#POSITION_LIMIT_EXCEEDED}. The portfolio is unchanged in that case.
     */
    public void applyTransaction(Transaction transaction) {
        if (transaction == null) {
            throw new IllegalArgumentException("Invalid transaction object provided");
        }

        OrderSide side = transaction.getSide();
        if (side == null) {
            throw new BusinessException(
                    ErrorCode.UNKNOWN_TRANSACTION_TYPE, "Unknown transaction type: null for " + transaction.getTicker());
        }

        switch (side) {
            case BUY -> applyBuy(transaction);
            case SELL -> applySell(transaction);
        }

        transactions.add(transaction);
        log.debug(
                "Executed {} {} x{} @ {} commission={} cash={}",
                side,
                transaction.getTicker(),
                transaction.getQuantity(),
                transaction.getPrice(),
                transaction.getCommission(),
                cash);
    }

    private void applyBuy(Transaction transaction) {
        BigDecimal commission = transaction.getCommission();
        BigDecimal cost = transaction.getGrossValue();
        BigDecimal required = commission.add(cost);
        if (required.compareTo(cash) > 0) {
            throw insufficientFunds(required);
        }
        Holding existing = holdings.get(transaction.getTicker());
        if (existing != null) {
            existing.quantityAfterAdding(transaction.getQuantity());
        }

        removeCash(commission);
        removeCash(cost);
        totalCommission = totalCommission.add(commission);

        holdings.computeIfAbsent(transaction.getTicker(), Holding::new)
                .addShares(transaction.getQuantity(), transaction.getPrice());
    }

    private void applySell(Transaction transaction) {
        String ticker = transaction.getTicker();
        Holding holding = holdings.get(ticker);
        if (holding == null) {
            throw new BusinessException(
                    ErrorCode.POSITION_NOT_HELD,
                    "Attempted to sell " + ticker + " but not in holdings",
                    Map.of("ticker", ticker));
        }
        if (transaction.getQuantity() > holding.getQuantity()) {
            throw new BusinessException(
                    ErrorCode.INSUFFICIENT_POSITION,
                    String.format(
                            "Cannot sell %d shares of %s. Only %d held.",
                            transaction.getQuantity(), ticker, holding.getQuantity()),
                    Map.of("ticker", ticker, "requested", transaction.getQuantity(), "held", holding.getQuantity()));
        }
        BigDecimal commission = transaction.getCommission();
        if (commission.compareTo(cash) > 0) {
            throw insufficientFunds(commission);
        }

        BigDecimal proceeds = transaction.getGrossValue();
        removeCash(commission);
        addCash(proceeds);
        totalCommission = totalCommission.add(commission);

        BigDecimal costBasis = holding.removeShares(transaction.getQuantity());
        realizedPnl = realizedPnl.add(proceeds.subtract(costBasis));

        if (holding.getQuantity() == 0) {
            holdings.remove(ticker);
        }
    }

    // ---- Dividends ----

    /**
     * Credits {@code quantity held * dividend per share} for the event's ticker. Nothing
     * happens if the ticker is not held. Dividends are recorded separately from the trade
     * ledger.
     */
    public void applyDividend(DividendEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Dividend event is required");
        }
        Holding holding = holdings.get(event.getTicker());
        if (holding == null) {
            log.debug("Dividend for {} ignored: not held", event.getTicker());
            return;
        }

        BigDecimal amount = event.getDividendPerShare().multiply(BigDecimal.valueOf(holding.getQuantity()));
        addCash(amount);
        dividendIncome = dividendIncome.add(amount);
        dividends.add(DividendRecord.builder()
                .timestamp(event.getTimestamp())
                .ticker(event.getTicker())
                .quantity(holding.getQuantity())
                .dividendPerShare(event.getDividendPerShare())
                .amount(amount)
                .build());

        log.debug("Dividend credited: {} x{} @ {} = {}", event.getTicker(), holding.getQuantity(),
                event.getDividendPerShare(), amount);
    }

    // ---- Snapshots ----

    /**
     * Appends a snapshot of the current state stamped with {@code timestamp}. Does not
     * deduplicate; the caller decides when a snapshot is due.
     */
    public PortfolioSnapshot recordSnapshot(LocalDateTime timestamp) {
        if (timestamp == null) {
            throw new IllegalArgumentException("Snapshot timestamp is required");
        }

        BigDecimal holdingsValue = getTotalHoldingsValue();
        PortfolioSnapshot snapshot = PortfolioSnapshot.builder()
                .timestamp(timestamp)
                .netValue(holdingsValue.add(cash))
                .cash(cash)
                .holdingsValue(holdingsValue)
                .holdings(getHoldings())
                .build();
        snapshots.add(snapshot);
        return snapshot;
    }

    // ---- Accessors ----

    public BigDecimal getCash() {
        return cash;
    }

    public BigDecimal getInitialCash() {
        return initialCash;
    }

    public LocalDateTime getStartTime() {
        return startTime;
    }

    public LocalDateTime getCurrentTime() {
        return currentTime;
    }

    /** Returns a point-in-time view of the holding for {@code ticker}, or null if it is not held. */
    public HoldingSnapshot getHolding(String ticker) {
        Holding holding = holdings.get(ticker);
        return holding != null ? HoldingSnapshot.of(holding) : null;
    }

    /** Point-in-time views of every holding, keyed by ticker. */
    public Map<String, HoldingSnapshot> getHoldings() {
        Map<String, HoldingSnapshot> detail = new LinkedHashMap<>();
        holdings.forEach((ticker, holding) -> detail.put(ticker, HoldingSnapshot.of(holding)));
        return Collections.unmodifiableMap(detail);
    }

    public List<Transaction> getTransactions() {
        return Collections.unmodifiableList(transactions);
    }

    public List<PortfolioSnapshot> getSnapshots() {
        return Collections.unmodifiableList(snapshots);
    }

    public List<DividendRecord> getDividends() {
        return Collections.unmodifiableList(dividends);
    }

    public BigDecimal getRealizedPnl() {
        return realizedPnl;
    }

    public BigDecimal getTotalCommission() {
        return totalCommission;
    }

    public BigDecimal getDividendIncome() {
        return dividendIncome;
    }

    @Override
    public String toString() {
        return String.format(
                "Portfolio(start=%s, cash=%s, holdings=%d, netValue=%s)",
                startTime.toLocalDate(), cash, holdings.size(), getNetValue());
    }

    private BusinessException insufficientFunds(BigDecimal amount) {
        return new BusinessException(
                ErrorCode.INSUFFICIENT_FUNDS,
                String.format("Cannot remove %s: insufficient cash. Available: %s", amount, cash),
                Map.of("required", amount, "available", cash));
    }

    private static void requireNonNegative(BigDecimal amount, String label) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException(label + " must be a non-negative number: " + amount);
        }
    }
}
