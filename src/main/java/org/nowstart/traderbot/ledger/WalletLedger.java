package org.nowstart.traderbot.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.traderbot.data.dto.ClosedTrade;
import org.nowstart.traderbot.data.dto.Fill;
import org.nowstart.traderbot.data.dto.LedgerSnapshot;
import org.nowstart.traderbot.data.dto.Position;
import org.nowstart.traderbot.data.exception.InsufficientBalanceException;
import org.nowstart.traderbot.data.type.OrderSide;
import org.nowstart.traderbot.data.type.PositionSide;

/**
 * Balance and position bookkeeping for one session. State changes only through {@link #applyFill(Fill)},
 * which either applies a fill completely or leaves the ledger untouched.
 *
 * <p>Cash moves by {@code -(notional + commission)} on a buy and {@code +(notional - commission)} on a sell.
 * A fill against an opposite position closes it first, pro rata for partial closes; any remaining quantity
 * opens a position on the fill's side. Realized profit of a round trip includes the commission of both legs.
 */
@Slf4j
public class WalletLedger {

    private static final int SCALE = 12;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BigDecimal initialBalance;
    private final boolean enforceSolvency;
    private final Map<String, Position> positions = new LinkedHashMap<>();
    private final List<Fill> fills = new ArrayList<>();
    private final List<ClosedTrade> closedTrades = new ArrayList<>();
    private BigDecimal balance;
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    /**
     * @param enforceSolvency reject fills that would take the balance below zero
     */
    public WalletLedger(BigDecimal initialBalance, boolean enforceSolvency) {
        Objects.requireNonNull(initialBalance, "initialBalance is required");
        if (initialBalance.signum() < 0) {
            throw new IllegalArgumentException("initialBalance must be >= 0");
        }
        this.initialBalance = initialBalance;
        this.balance = initialBalance;
        this.enforceSolvency = enforceSolvency;
    }

    public synchronized void applyFill(Fill fill) {
        validate(fill);
        BigDecimal cashDelta = fill.side() == OrderSide.BUY
                ? fill.notional().add(fill.commission()).negate()
                : fill.notional().subtract(fill.commission());
        BigDecimal nextBalance = balance.add(cashDelta);
        if (enforceSolvency && nextBalance.signum() < 0) {
            throw new InsufficientBalanceException(fill.symbol(), balance, cashDelta.negate());
        }

        Position current = position(fill.symbol());
        PositionSide fillSide = fill.side() == OrderSide.BUY ? PositionSide.LONG : PositionSide.SHORT;
        Position next;
        ClosedTrade closed = null;

        if (current.isFlat()) {
            next = open(fill, fillSide, fill.quantity(), fill.commission());
        } else if (current.side() == fillSide) {
            next = add(current, fill);
        } else {
            BigDecimal closeQty = current.quantity().min(fill.quantity());
            BigDecimal exitCommission = share(fill.commission(), closeQty, fill.quantity());
            closed = close(current, fill, closeQty, exitCommission);

            BigDecimal remainingQty = current.quantity().subtract(closeQty);
            BigDecimal reverseQty = fill.quantity().subtract(closeQty);
            if (remainingQty.signum() > 0) {
                next = new Position(
                        current.symbol(),
                        current.side(),
                        current.entryPrice(),
                        remainingQty,
                        current.openedAt(),
                        current.entryCommission().subtract(share(current.entryCommission(), closeQty, current.quantity()))
                );
            } else if (reverseQty.signum() > 0) {
                next = open(fill, fillSide, reverseQty, fill.commission().subtract(exitCommission));
            } else {
                next = null;
            }
        }

        balance = nextBalance;
        if (next == null) {
            positions.remove(fill.symbol());
        } else {
            positions.put(fill.symbol(), next);
        }
        if (closed != null) {
            closedTrades.add(closed);
            realizedPnl = realizedPnl.add(closed.profit());
        }
        fills.add(fill);
        log.debug(
                "event=fill_applied fill_id={} symbol={} side={} price={} qty={} commission={} balance={}",
                fill.fillId(),
                fill.symbol(),
                fill.side(),
                fill.price(),
                fill.quantity(),
                fill.commission(),
                balance
        );
    }

    public synchronized Position position(String symbol) {
        return positions.getOrDefault(symbol, Position.flat(symbol));
    }

    public synchronized BigDecimal balance() {
        return balance;
    }

    public BigDecimal initialBalance() {
        return initialBalance;
    }

    public synchronized BigDecimal realizedPnl() {
        return realizedPnl;
    }

    /**
     * Balance plus the marked value of open positions. Positions without a mark are valued at entry price.
     */
    public synchronized BigDecimal equity(Map<String, BigDecimal> markPrices) {
        BigDecimal equity = balance;
        for (Position position : positions.values()) {
            BigDecimal mark = markPrices.getOrDefault(position.symbol(), position.entryPrice());
            BigDecimal value = mark.multiply(position.quantity());
            equity = position.side() == PositionSide.SHORT ? equity.subtract(value) : equity.add(value);
        }
        return equity;
    }

    public synchronized LedgerSnapshot snapshot() {
        return new LedgerSnapshot(
                balance,
                initialBalance,
                realizedPnl,
                List.copyOf(positions.values()),
                List.copyOf(closedTrades),
                List.copyOf(fills)
        );
    }

    private void validate(Fill fill) {
        Objects.requireNonNull(fill, "fill is required");
        if (fill.price() == null || fill.price().signum() <= 0) {
            throw new IllegalArgumentException("fill price must be > 0: " + fill.fillId());
        }
        if (fill.quantity() == null || fill.quantity().signum() <= 0) {
            throw new IllegalArgumentException("fill quantity must be > 0: " + fill.fillId());
        }
        if (fill.commission() == null || fill.commission().signum() < 0) {
            throw new IllegalArgumentException("fill commission must be >= 0: " + fill.fillId());
        }
    }

    private Position open(Fill fill, PositionSide side, BigDecimal quantity, BigDecimal commission) {
        return new Position(fill.symbol(), side, fill.price(), quantity, fill.executedAt(), commission);
    }

    private Position add(Position current, Fill fill) {
        BigDecimal newQty = current.quantity().add(fill.quantity());
        BigDecimal weighted = current.entryPrice().multiply(current.quantity()).add(fill.notional());
        return new Position(
                current.symbol(),
                current.side(),
                weighted.divide(newQty, SCALE, RoundingMode.HALF_UP),
                newQty,
                current.openedAt(),
                current.entryCommission().add(fill.commission())
        );
    }

    private ClosedTrade close(Position current, Fill fill, BigDecimal closeQty, BigDecimal exitCommission) {
        BigDecimal entryCommission = share(current.entryCommission(), closeQty, current.quantity());
        BigDecimal commission = entryCommission.add(exitCommission);
        boolean isLong = current.side() == PositionSide.LONG;
        BigDecimal buyPrice = isLong ? current.entryPrice() : fill.price();
        BigDecimal sellPrice = isLong ? fill.price() : current.entryPrice();
        BigDecimal profit = sellPrice.subtract(buyPrice).multiply(closeQty).subtract(commission);
        BigDecimal cost = buyPrice.multiply(closeQty);
        BigDecimal profitPct = cost.signum() == 0
                ? BigDecimal.ZERO
                : profit.multiply(HUNDRED).divide(cost, SCALE, RoundingMode.HALF_UP);
        return new ClosedTrade(
                current.symbol(),
                current.side(),
                current.entryPrice(),
                fill.price(),
                closeQty,
                current.openedAt(),
                fill.executedAt(),
                commission,
                profit,
                profitPct
        );
    }

    private BigDecimal share(BigDecimal amount, BigDecimal part, BigDecimal whole) {
        if (part.compareTo(whole) == 0) {
            return amount;
        }
        return amount.multiply(part).divide(whole, SCALE, RoundingMode.HALF_UP);
    }
}
