package org.nowstart.traderbot.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.traderbot.data.dto.OrderReceipt;
import org.nowstart.traderbot.data.dto.OrderStatusReport;
import org.nowstart.traderbot.data.dto.PendingOrder;
import org.nowstart.traderbot.data.dto.Signal;
import org.nowstart.traderbot.data.exception.OrderSinkException;
import org.nowstart.traderbot.data.exception.TradingApiException;
import org.nowstart.traderbot.data.type.ExecutionMode;
import org.nowstart.traderbot.data.type.OrderSide;
import org.nowstart.traderbot.data.type.OrderStatus;
import org.nowstart.traderbot.data.type.PositionSide;
import org.nowstart.traderbot.data.type.TradeOrderType;
import org.nowstart.traderbot.gateway.OrderSink;
import org.nowstart.traderbot.session.TradingSession;
import org.nowstart.traderbot.support.ScriptedStrategy;
import org.nowstart.traderbot.support.TestBars;
import org.nowstart.traderbot.support.TestProperties;
import org.nowstart.traderbot.support.TestSessions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class OrderRouterTest {

    private static final Instant NOW = Instant.parse("2026-01-01T01:00:00Z");

    @Mock
    private ObjectProvider<OrderSink> orderSinkProvider;
    @Mock
    private OrderSink orderSink;

    private OrderRouter router;
    private TradingSession session;

    @BeforeEach
    void setUp() {
        router = new OrderRouter(
                orderSinkProvider,
                new SignalOrderPlanner(),
                TestProperties.engine(),
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
        session = TestSessions.session(
                TestSessions.settings(ExecutionMode.LIVE, false),
                new ScriptedStrategy(Map.of()),
                router::submit
        );
        session.start();
    }

    @Test
    void submit_placesMarketOrderAndTracksItAsPending() {
        when(orderSinkProvider.getIfAvailable()).thenReturn(orderSink);
        when(orderSink.placeOrder(TestBars.SYMBOL, OrderSide.BUY, TradeOrderType.MARKET, BigDecimal.ONE))
                .thenReturn(new OrderReceipt("order-1", OrderStatus.SUBMITTED));

        Optional<PendingOrder> pending = router.submit(session, Signal.buy(TestBars.SYMBOL, "entry"), TestBars.bar(0, "100"));

        assertThat(pending).map(PendingOrder::orderId).contains("order-1");
        assertThat(pending).map(PendingOrder::submittedAt).contains(NOW);
        assertThat(session.pendingOrders()).hasSize(1);
        assertThat(session.ledger().balance()).isEqualByComparingTo("1000");
    }

    @Test
    void submit_wrapsSinkFailure() {
        when(orderSinkProvider.getIfAvailable()).thenReturn(orderSink);
        when(orderSink.placeOrder(any(), any(), any(), any())).thenThrow(new IllegalStateException("exchange down"));

        assertThatThrownBy(() -> router.submit(session, Signal.buy(TestBars.SYMBOL, "entry"), TestBars.bar(0, "100")))
                .isInstanceOf(OrderSinkException.class)
                .hasMessageContaining("exchange down");
        assertThat(session.pendingOrders()).isEmpty();
    }

    @Test
    void submit_rejectedReceiptIsNotTracked() {
        when(orderSinkProvider.getIfAvailable()).thenReturn(orderSink);
        when(orderSink.placeOrder(any(), any(), any(), any())).thenReturn(new OrderReceipt("order-2", OrderStatus.REJECTED));

        Optional<PendingOrder> pending = router.submit(session, Signal.buy(TestBars.SYMBOL, "entry"), TestBars.bar(0, "100"));

        assertThat(pending).isEmpty();
        assertThat(session.pendingOrders()).isEmpty();
    }

    @Test
    void submit_ignoredSignalNeverReachesSink() {
        Optional<PendingOrder> pending = router.submit(session, Signal.sell(TestBars.SYMBOL, "flat"), TestBars.bar(0, "100"));

        assertThat(pending).isEmpty();
        verify(orderSinkProvider, never()).getIfAvailable();
    }

    @Test
    void requireOrderSink_throwsServiceUnavailableWhenMissing() {
        assertThatThrownBy(router::requireOrderSink)
                .isInstanceOf(TradingApiException.class)
                .hasFieldOrPropertyWithValue("status", HttpStatus.SERVICE_UNAVAILABLE)
                .hasFieldOrPropertyWithValue("code", "order_sink_unavailable");
    }

    @Test
    void reconcile_appliesFilledOrderToLedger() {
        when(orderSinkProvider.getIfAvailable()).thenReturn(orderSink);
        session.addPendingOrder(pending("order-1", NOW.minusSeconds(10)));
        when(orderSink.getOrderStatus("order-1")).thenReturn(
                new OrderStatusReport("order-1", OrderStatus.FILLED, BigDecimal.ONE, new BigDecimal("100"), null, NOW)
        );

        int completed = router.reconcile(session, NOW);

        assertThat(completed).isEqualTo(1);
        assertThat(session.pendingOrders()).isEmpty();
        assertThat(session.ledger().balance()).isEqualByComparingTo("899.9");
        assertThat(session.ledger().position(TestBars.SYMBOL).side()).isEqualTo(PositionSide.LONG);
        assertThat(session.ledgerSnapshot().fills().get(0).executedAt()).isEqualTo(NOW);
    }

    @Test
    void reconcile_canceledOrderAppliesOnlyExecutedQuantity() {
        when(orderSinkProvider.getIfAvailable()).thenReturn(orderSink);
        session.addPendingOrder(pending("order-1", NOW.minusSeconds(10)));
        when(orderSink.getOrderStatus("order-1")).thenReturn(
                new OrderStatusReport("order-1", OrderStatus.CANCELED, new BigDecimal("0.5"), new BigDecimal("100"), new BigDecimal("0.05"), NOW)
        );

        router.reconcile(session, NOW);

        assertThat(session.ledger().balance()).isEqualByComparingTo("949.95");
        assertThat(session.ledger().position(TestBars.SYMBOL).quantity()).isEqualByComparingTo("0.5");
        assertThat(session.pendingOrders()).isEmpty();
    }

    @Test
    void reconcile_cancelsExpiredOrderOnlyOnce() {
        when(orderSinkProvider.getIfAvailable()).thenReturn(orderSink);
        session.addPendingOrder(pending("order-1", NOW.minus(Duration.ofMinutes(3))));
        when(orderSink.getOrderStatus("order-1")).thenReturn(
                new OrderStatusReport("order-1", OrderStatus.SUBMITTED, BigDecimal.ZERO, null, null, NOW)
        );

        router.reconcile(session, NOW);
        router.reconcile(session, NOW.plusSeconds(5));

        verify(orderSink, times(1)).cancelOrder("order-1");
        assertThat(session.pendingOrders()).singleElement()
                .extracting(PendingOrder::cancelRequested)
                .isEqualTo(true);
        assertThat(session.ledger().balance()).isEqualByComparingTo("1000");
    }

    @Test
    void reconcile_timesOutSubmittedOrderAgainstSameClock() {
        when(orderSinkProvider.getIfAvailable()).thenReturn(orderSink);
        when(orderSink.placeOrder(any(), any(), any(), any())).thenReturn(new OrderReceipt("order-1", OrderStatus.SUBMITTED));
        when(orderSink.getOrderStatus("order-1")).thenReturn(
                new OrderStatusReport("order-1", OrderStatus.SUBMITTED, BigDecimal.ZERO, null, null, NOW)
        );
        router.submit(session, Signal.buy(TestBars.SYMBOL, "entry"), TestBars.bar(0, "100"));

        router.reconcile(session, NOW.plus(Duration.ofMinutes(1)));
        verify(orderSink, never()).cancelOrder("order-1");

        router.reconcile(session, NOW.plus(Duration.ofMinutes(2)).plusSeconds(1));
        verify(orderSink, times(1)).cancelOrder("order-1");
    }

    @Test
    void reconcile_keepsOrderPendingWhenStatusLookupFails() {
        when(orderSinkProvider.getIfAvailable()).thenReturn(orderSink);
        session.addPendingOrder(pending("order-1", NOW.minusSeconds(10)));
        when(orderSink.getOrderStatus("order-1")).thenThrow(new IllegalStateException("timeout"));

        int completed = router.reconcile(session, NOW);

        assertThat(completed).isZero();
        assertThat(session.pendingOrders()).hasSize(1);
    }

    private PendingOrder pending(String orderId, Instant submittedAt) {
        return new PendingOrder(orderId, TestBars.SYMBOL, OrderSide.BUY, BigDecimal.ONE, submittedAt, "entry", false);
    }
}
