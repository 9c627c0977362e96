package org.nowstart.traderbot.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.traderbot.data.dto.ClosedTrade;
import org.nowstart.traderbot.data.dto.Fill;
import org.nowstart.traderbot.data.dto.LedgerSnapshot;
import org.nowstart.traderbot.data.dto.Position;
import org.nowstart.traderbot.data.exception.InsufficientBalanceException;
import org.nowstart.traderbot.data.type.OrderSide;
import org.nowstart.traderbot.data.type.PositionSide;

class WalletLedgerTest {

    private static final String SYMBOL = "BTCUSDT";
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private int sequence;

    @Test
    void applyFill_roundTripChargesBothCommissions() {
        WalletLedger ledger = new WalletLedger(new BigDecimal("1000"), true);

        ledger.applyFill(fill(OrderSide.BUY, "105", "1", "0.105"));
        ledger.applyFill(fill(OrderSide.SELL, "110", "1", "0.110"));

        assertThat(ledger.balance()).isEqualByComparingTo("1004.785");
        assertThat(ledger.position(SYMBOL).isFlat()).isTrue();
        assertThat(ledger.realizedPnl()).isEqualByComparingTo("4.785");
        LedgerSnapshot snapshot = ledger.snapshot();
        assertThat(snapshot.fills()).hasSize(2);
        assertThat(snapshot.openPositions()).isEmpty();
        ClosedTrade trade = snapshot.closedTrades().get(0);
        assertThat(trade.side()).isEqualTo(PositionSide.LONG);
        assertThat(trade.commission()).isEqualByComparingTo("0.215");
        assertThat(trade.profit()).isEqualByComparingTo("4.785");
        assertThat(trade.profitPct()).isEqualByComparingTo("4.557142857143");
        assertThat(trade.isWin()).isTrue();
    }

    @Test
    void applyFill_rejectsOverdraftAndLeavesLedgerUnchanged() {
        WalletLedger ledger = new WalletLedger(new BigDecimal("100"), true);

        InsufficientBalanceException exception = catchThrowableOfType(
                () -> ledger.applyFill(fill(OrderSide.BUY, "105", "1", "0.105")),
                InsufficientBalanceException.class
        );

        assertThat(exception.getBalance()).isEqualByComparingTo("100");
        assertThat(exception.getRequired()).isEqualByComparingTo("105.105");
        assertThat(ledger.balance()).isEqualByComparingTo("100");
        assertThat(ledger.position(SYMBOL).isFlat()).isTrue();
        assertThat(ledger.snapshot().fills()).isEmpty();
    }

    @Test
    void applyFill_allowsOverdraftWhenSolvencyNotEnforced() {
        WalletLedger ledger = new WalletLedger(new BigDecimal("100"), false);

        ledger.applyFill(fill(OrderSide.BUY, "105", "1", "0"));

        assertThat(ledger.balance()).isEqualByComparingTo("-5");
        assertThat(ledger.position(SYMBOL).side()).isEqualTo(PositionSide.LONG);
    }

    @Test
    void applyFill_addingToPositionAveragesEntryPrice() {
        WalletLedger ledger = new WalletLedger(new BigDecimal("1000"), true);

        ledger.applyFill(fill(OrderSide.BUY, "100", "1", "0.1"));
        ledger.applyFill(fill(OrderSide.BUY, "130", "2", "0.26"));

        Position position = ledger.position(SYMBOL);
        assertThat(position.quantity()).isEqualByComparingTo("3");
        assertThat(position.entryPrice()).isEqualByComparingTo("120");
        assertThat(position.entryCommission()).isEqualByComparingTo("0.36");
        assertThat(position.openedAt()).isEqualTo(T0.plusSeconds(60));
        assertThat(ledger.balance()).isEqualByComparingTo("639.64");
    }

    @Test
    void applyFill_partialCloseRealizesProRata() {
        WalletLedger ledger = new WalletLedger(new BigDecimal("1000"), true);

        ledger.applyFill(fill(OrderSide.BUY, "100", "2", "0.2"));
        ledger.applyFill(fill(OrderSide.SELL, "110", "1", "0.11"));

        Position position = ledger.position(SYMBOL);
        assertThat(position.side()).isEqualTo(PositionSide.LONG);
        assertThat(position.quantity()).isEqualByComparingTo("1");
        assertThat(position.entryCommission()).isEqualByComparingTo("0.1");
        ClosedTrade trade = ledger.snapshot().closedTrades().get(0);
        assertThat(trade.quantity()).isEqualByComparingTo("1");
        assertThat(trade.profit()).isEqualByComparingTo("9.79");
        assertThat(ledger.balance()).isEqualByComparingTo("909.69");
    }

    @Test
    void applyFill_oversizedOppositeFillReversesPosition() {
        WalletLedger ledger = new WalletLedger(new BigDecimal("1000"), true);

        ledger.applyFill(fill(OrderSide.BUY, "100", "1", "0"));
        ledger.applyFill(fill(OrderSide.SELL, "90", "3", "0.3"));

        Position position = ledger.position(SYMBOL);
        assertThat(position.side()).isEqualTo(PositionSide.SHORT);
        assertThat(position.quantity()).isEqualByComparingTo("2");
        assertThat(position.entryPrice()).isEqualByComparingTo("90");
        assertThat(position.entryCommission()).isEqualByComparingTo("0.2");
        assertThat(ledger.realizedPnl()).isEqualByComparingTo("-10.1");
    }

    @Test
    void applyFill_shortRoundTripProfitsWhenPriceFalls() {
        WalletLedger ledger = new WalletLedger(new BigDecimal("1000"), true);

        ledger.applyFill(fill(OrderSide.SELL, "110", "1", "0"));
        assertThat(ledger.equity(Map.of(SYMBOL, new BigDecimal("100")))).isEqualByComparingTo("1010");

        ledger.applyFill(fill(OrderSide.BUY, "100", "1", "0"));

        ClosedTrade trade = ledger.snapshot().closedTrades().get(0);
        assertThat(trade.side()).isEqualTo(PositionSide.SHORT);
        assertThat(trade.profit()).isEqualByComparingTo("10");
        assertThat(ledger.balance()).isEqualByComparingTo("1010");
    }

    @Test
    void equity_valuesOpenPositionAtMarkOrEntry() {
        WalletLedger ledger = new WalletLedger(new BigDecimal("1000"), true);
        ledger.applyFill(fill(OrderSide.BUY, "100", "2", "0"));

        assertThat(ledger.equity(Map.of(SYMBOL, new BigDecimal("120")))).isEqualByComparingTo("1040");
        assertThat(ledger.equity(Map.of())).isEqualByComparingTo("1000");
    }

    @Test
    void applyFill_rejectsNonPositiveQuantity() {
        WalletLedger ledger = new WalletLedger(new BigDecimal("1000"), true);

        assertThatThrownBy(() -> ledger.applyFill(fill(OrderSide.BUY, "100", "0", "0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("quantity");
        assertThat(ledger.balance()).isEqualByComparingTo("1000");
    }

    @Test
    void constructor_rejectsNegativeInitialBalance() {
        assertThatThrownBy(() -> new WalletLedger(new BigDecimal("-1"), true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private Fill fill(OrderSide side, String price, String quantity, String commission) {
        sequence++;
        return new Fill(
                "fill-" + sequence,
                SYMBOL,
                side,
                new BigDecimal(price),
                new BigDecimal(quantity),
                new BigDecimal(commission),
                T0.plusSeconds(60L * sequence),
                "order-" + sequence
        );
    }
}
