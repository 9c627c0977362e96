package org.nowstart.traderbot.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.traderbot.data.dto.Bar;
import org.nowstart.traderbot.data.dto.Fill;
import org.nowstart.traderbot.data.dto.OrderReceipt;
import org.nowstart.traderbot.data.dto.OrderStatusReport;
import org.nowstart.traderbot.data.dto.PendingOrder;
import org.nowstart.traderbot.data.dto.Signal;
import org.nowstart.traderbot.data.exception.OrderSinkException;
import org.nowstart.traderbot.data.exception.TradingApiException;
import org.nowstart.traderbot.data.property.EngineProperties;
import org.nowstart.traderbot.data.type.OrderStatus;
import org.nowstart.traderbot.data.type.TradeOrderType;
import org.nowstart.traderbot.gateway.OrderSink;
import org.nowstart.traderbot.service.SignalOrderPlanner.OrderPlan;
import org.nowstart.traderbot.session.TradingSession;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Live execution. Orders are placed as market orders and tracked as pending until the sink reports a terminal
 * status; only then does the executed quantity reach the ledger.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderRouter {

    private final ObjectProvider<OrderSink> orderSinkProvider;
    private final SignalOrderPlanner signalOrderPlanner;
    private final EngineProperties engineProperties;
    private final Clock clock;

    public Optional<PendingOrder> submit(TradingSession session, Signal signal, Bar bar) {
        Optional<OrderPlan> plan = signalOrderPlanner.plan(
                session.settings(),
                session.ledger().position(bar.symbol()),
                signal
        );
        if (plan.isEmpty()) {
            return Optional.empty();
        }

        OrderSink orderSink = requireOrderSink();
        OrderReceipt receipt;
        try {
            receipt = orderSink.placeOrder(bar.symbol(), plan.get().side(), TradeOrderType.MARKET, plan.get().quantity());
        } catch (RuntimeException exception) {
            throw new OrderSinkException("Order placement failed for " + bar.symbol() + ": " + exception.getMessage(), exception);
        }
        if (receipt == null || receipt.orderId() == null) {
            throw new OrderSinkException("Order sink returned no order id for " + bar.symbol(), null);
        }
        if (receipt.status() == OrderStatus.REJECTED || receipt.status() == OrderStatus.FAILED) {
            log.warn(
                    "event=order_rejected session={} order_id={} side={} qty={} status={}",
                    session.key(),
                    receipt.orderId(),
                    plan.get().side(),
                    plan.get().quantity(),
                    receipt.status()
            );
            return Optional.empty();
        }

        PendingOrder pending = new PendingOrder(
                receipt.orderId(),
                bar.symbol(),
                plan.get().side(),
                plan.get().quantity(),
                clock.instant(),
                signal.reason(),
                false
        );
        session.addPendingOrder(pending);
        log.info(
                "event=order_submitted session={} order_id={} side={} qty={} status={} reason={}",
                session.key(),
                pending.orderId(),
                pending.side(),
                pending.quantity(),
                receipt.status(),
                signal.reason()
        );
        return Optional.of(pending);
    }

    /**
     * Polls every pending order of the session once. Sink failures are logged and retried on the next call.
     *
     * @return number of orders that reached a terminal status
     */
    public int reconcile(TradingSession session, Instant now) {
        OrderSink orderSink = orderSinkProvider.getIfAvailable();
        if (orderSink == null) {
            return 0;
        }
        return session.exclusive(() -> {
            int completed = 0;
            for (PendingOrder pending : session.pendingOrders()) {
                if (reconcileOrder(session, orderSink, pending, now)) {
                    completed++;
                }
            }
            return completed;
        });
    }

    private boolean reconcileOrder(TradingSession session, OrderSink orderSink, PendingOrder pending, Instant now) {
        OrderStatusReport report;
        try {
            report = orderSink.getOrderStatus(pending.orderId());
        } catch (RuntimeException exception) {
            log.warn(
                    "event=order_reconcile_failed session={} order_id={} reason={}",
                    session.key(),
                    pending.orderId(),
                    exception.getMessage()
            );
            return false;
        }

        if (report == null || report.status() == null || !report.status().isTerminal()) {
            cancelIfExpired(session, orderSink, pending, now);
            return false;
        }

        BigDecimal executedQty = report.executedQuantity() == null ? BigDecimal.ZERO : report.executedQuantity();
        if (report.status() == OrderStatus.FILLED && executedQty.signum() == 0) {
            executedQty = pending.quantity();
        }
        if (executedQty.signum() > 0) {
            applyExecution(session, pending, report, executedQty, now);
        }
        session.removePendingOrder(pending.orderId());
        log.info(
                "event=order_reconciled session={} order_id={} status={} executed_qty={} balance={}",
                session.key(),
                pending.orderId(),
                report.status(),
                executedQty,
                session.ledger().balance()
        );
        return true;
    }

    private void applyExecution(
            TradingSession session,
            PendingOrder pending,
            OrderStatusReport report,
            BigDecimal executedQty,
            Instant now
    ) {
        BigDecimal price = report.averagePrice();
        if (price == null || price.signum() <= 0) {
            price = session.markPrice().orElse(null);
        }
        if (price == null) {
            log.error(
                    "event=order_execution_unpriced session={} order_id={} executed_qty={}",
                    session.key(),
                    pending.orderId(),
                    executedQty
            );
            return;
        }
        BigDecimal commission = report.commission() != null
                ? report.commission()
                : price.multiply(executedQty).multiply(session.settings().commissionRate());
        Fill fill = new Fill(
                pending.orderId(),
                pending.symbol(),
                pending.side(),
                price,
                executedQty,
                commission,
                report.updatedAt() == null ? now : report.updatedAt(),
                pending.orderId()
        );
        session.ledger().applyFill(fill);
    }

    private void cancelIfExpired(TradingSession session, OrderSink orderSink, PendingOrder pending, Instant now) {
        if (pending.cancelRequested() || !pending.submittedAt().plus(engineProperties.orderTimeout()).isBefore(now)) {
            return;
        }
        try {
            orderSink.cancelOrder(pending.orderId());
            session.addPendingOrder(pending.withCancelRequested());
            log.warn(
                    "event=order_cancel_requested session={} order_id={} submitted_at={} timeout={}",
                    session.key(),
                    pending.orderId(),
                    pending.submittedAt(),
                    engineProperties.orderTimeout()
            );
        } catch (RuntimeException exception) {
            log.warn(
                    "event=order_cancel_failed session={} order_id={} reason={}",
                    session.key(),
                    pending.orderId(),
                    exception.getMessage()
            );
        }
    }

    public OrderSink requireOrderSink() {
        OrderSink orderSink = orderSinkProvider.getIfAvailable();
        if (orderSink == null) {
            throw new TradingApiException(
                    HttpStatus.SERVICE_UNAVAILABLE,
                    "order_sink_unavailable",
                    "No order sink is configured for live trading"
            );
        }
        return orderSink;
    }
}
