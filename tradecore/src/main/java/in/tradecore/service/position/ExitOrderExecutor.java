package in.tradecore.service.position;

import in.tradecore.application.monitoring.AlertService;
import in.tradecore.domain.common.EventType;
import in.tradecore.domain.order.OrderPurpose;
import in.tradecore.domain.order.OrderRequest;
import in.tradecore.domain.order.OrderResult;
import in.tradecore.domain.order.OrderType;
import in.tradecore.domain.trade.ExitReason;
import in.tradecore.domain.trade.Position;
import in.tradecore.infrastructure.broker.common.ErrorCategory;
import in.tradecore.infrastructure.broker.common.ErrorClassifier;
import in.tradecore.infrastructure.broker.common.ExternalCallExecutor;
import in.tradecore.infrastructure.broker.metrics.EngineMetrics;
import in.tradecore.infrastructure.broker.order.OrderGateway;
import in.tradecore.service.core.AuditEventBus;
import in.tradecore.service.execution.DailyLossMonitor;
import in.tradecore.service.execution.ExecutionGate;
import in.tradecore.service.execution.SlotState;
import in.tradecore.service.execution.SymbolSlotRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Sends closing orders on a dedicated executor so exits never queue behind entry orders
 * and the monitor loop never waits on the venue.
 *
 * An exit claims the symbol's slot (POSITION_OPEN → EXITING) before anything is sent;
 * reconciliation can only remove a position whose slot it can release from POSITION_OPEN,
 * so the two never act on the same position. A position leaves the ledger only after its
 * exit order is confirmed filled.
 *
 * On failure the slot returns to POSITION_OPEN and re-submission backs off per the gateway
 * retry policy. The correlation id is kept until the fill so the venue can discard
 * duplicates of an order that did get through.
 */
public final class ExitOrderExecutor {
    private static final Logger log = LoggerFactory.getLogger(ExitOrderExecutor.class);

    static final Duration ALERT_INTERVAL = Duration.ofMinutes(5);

    private final OrderGateway gateway;
    private final ExternalCallExecutor gatewayCalls;
    private final Executor exitExecutor;
    private final PositionLedger ledger;
    private final SymbolSlotRegistry slots;
    private final ExecutionGate gate;
    private final DailyLossMonitor dailyLoss;
    private final AlertService alertService;
    private final AuditEventBus audit;
    private final EngineMetrics metrics;
    private final Clock clock;

    private final Map<String, String> correlationIds = new ConcurrentHashMap<>();
    private final Map<String, Integer> failures = new ConcurrentHashMap<>();
    private final Map<String, Instant> retryNotBefore = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastAlertAt = new ConcurrentHashMap<>();

    public ExitOrderExecutor(OrderGateway gateway, ExternalCallExecutor gatewayCalls, Executor exitExecutor,
                             PositionLedger ledger, SymbolSlotRegistry slots, ExecutionGate gate,
                             DailyLossMonitor dailyLoss, AlertService alertService, AuditEventBus audit,
                             EngineMetrics metrics, Clock clock) {
        this.gateway = gateway;
        this.gatewayCalls = gatewayCalls;
        this.exitExecutor = exitExecutor;
        this.ledger = ledger;
        this.slots = slots;
        this.gate = gate;
        this.dailyLoss = dailyLoss;
        this.alertService = alertService;
        this.audit = audit;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Submit a closing order unless one is already in flight, the previous attempt is still
     * backing off, or the position is no longer held.
     *
     * @return future completing true once the position is closed, or null if nothing was submitted
     */
    public CompletableFuture<Boolean> submitExit(Position position, ExitReason reason, BigDecimal triggerPrice) {
        String symbol = position.symbol();
        Instant notBefore = retryNotBefore.get(symbol);
        if (notBefore != null && clock.instant().isBefore(notBefore)) {
            return null;
        }
        if (!slots.tryTransition(symbol, SlotState.POSITION_OPEN, SlotState.EXITING)) {
            return null;
        }
        String correlationId = correlationIds.computeIfAbsent(symbol, s -> OrderRequest.newCorrelationId());
        OrderRequest request = new OrderRequest(correlationId, symbol, position.direction().exitSide(),
            position.quantity(), OrderType.MARKET, null, OrderPurpose.EXIT);
        log.info("[{}] Exit triggered ({}) at {}: {} x{}", symbol, reason.getDescription(), triggerPrice,
            request.side(), request.quantity());
        try {
            return CompletableFuture.supplyAsync(() -> close(position, reason, triggerPrice, request), exitExecutor);
        } catch (RuntimeException e) {
            // executor rejected (shutting down): leave the position for the next attempt
            slots.tryTransition(symbol, SlotState.EXITING, SlotState.POSITION_OPEN);
            log.error("[{}] Exit submission rejected: {}", symbol, e.getMessage());
            return CompletableFuture.completedFuture(false);
        }
    }

    boolean close(Position position, ExitReason reason, BigDecimal triggerPrice, OrderRequest request) {
        String symbol = position.symbol();
        if (!ledger.contains(symbol)) {
            slots.release(symbol, SlotState.EXITING);
            log.warn("[{}] Exit skipped, position no longer in the ledger", symbol);
            return false;
        }
        try {
            Map<String, Object> submitted = new HashMap<>();
            submitted.put("correlationId", request.correlationId());
            submitted.put("purpose", OrderPurpose.EXIT.name());
            submitted.put("side", request.side().name());
            submitted.put("quantity", request.quantity());
            submitted.put("reason", reason.name());
            audit.emit(EventType.ORDER_SUBMITTED, symbol, submitted);

            OrderResult result = gatewayCalls.execute("placeOrder", () -> gateway.placeOrder(request));
            if (!result.isFilled()) {
                metrics.recordOrder(OrderPurpose.EXIT, "REJECTED");
                exitFailed(position, reason, "rejected: " + result.message());
                return false;
            }

            metrics.recordOrder(OrderPurpose.EXIT, "FILLED");
            clearRetryState(symbol);
            ledger.remove(symbol);
            slots.release(symbol, SlotState.EXITING);
            metrics.recordPositionClosed(reason);
            metrics.setOpenPositions(ledger.size());

            BigDecimal exitPrice = result.averagePrice() != null ? result.averagePrice() : triggerPrice;
            BigDecimal pnl = position.direction().favorableMove(position.entryPrice(), exitPrice)
                .multiply(BigDecimal.valueOf(position.quantity()));
            Map<String, Object> payload = new HashMap<>();
            payload.put("reason", reason.name());
            payload.put("orderId", result.orderId());
            payload.put("entryPrice", position.entryPrice());
            payload.put("exitPrice", exitPrice);
            payload.put("quantity", position.quantity());
            payload.put("pnl", pnl);
            payload.put("closedAt", clock.instant().toString());
            audit.emit(EventType.POSITION_CLOSED, symbol, payload);
            log.info("[{}] ✅ Position CLOSED ({}) @ {} pnl={}", symbol, reason, exitPrice, pnl);
            dailyLoss.recordClosed(symbol, pnl);
            return true;
        } catch (RuntimeException e) {
            ErrorCategory category = ErrorClassifier.classify(e);
            if (category == ErrorCategory.CRITICAL) {
                metrics.recordOrder(OrderPurpose.EXIT, "AUTH_FAILED");
                gate.suspend("venue authentication failed on exit: " + e.getMessage());
                alertService.sendCriticalAlert("GATEWAY_AUTH_FAILED",
                    "Exit for " + symbol + " refused by venue authentication; new entries suspended");
            } else {
                metrics.recordOrder(OrderPurpose.EXIT, "FAILED");
            }
            exitFailed(position, reason, category + ": " + e.getMessage());
            return false;
        }
    }

    private void exitFailed(Position position, ExitReason reason, String detail) {
        String symbol = position.symbol();
        int attempt = failures.merge(symbol, 1, Integer::sum);
        Instant now = clock.instant();
        Duration backoff = gatewayCalls.getPolicy().baseDelayForAttempt(attempt);
        retryNotBefore.put(symbol, now.plus(backoff));
        slots.tryTransition(symbol, SlotState.EXITING, SlotState.POSITION_OPEN);

        log.error("[{}] Exit order FAILED ({}, attempt {}), position kept in ledger, retry in {}ms: {}",
            symbol, reason, attempt, backoff.toMillis(), detail);
        Map<String, Object> payload = new HashMap<>();
        payload.put("purpose", OrderPurpose.EXIT.name());
        payload.put("reason", reason.name());
        payload.put("attempt", attempt);
        payload.put("detail", detail);
        audit.emit(EventType.ORDER_FAILED, symbol, payload);

        Instant lastAlert = lastAlertAt.get(symbol);
        if (lastAlert == null || !now.isBefore(lastAlert.plus(ALERT_INTERVAL))) {
            lastAlertAt.put(symbol, now);
            alertService.sendCriticalAlert("EXIT_ORDER_FAILED",
                "Could not close " + symbol + " (" + reason + ", attempt " + attempt + "): " + detail
                    + ". Retrying with backoff.");
        }
    }

    private void clearRetryState(String symbol) {
        correlationIds.remove(symbol);
        failures.remove(symbol);
        retryNotBefore.remove(symbol);
        lastAlertAt.remove(symbol);
    }

    public boolean isExiting(String symbol) {
        return slots.stateOf(symbol).orElse(null) == SlotState.EXITING;
    }

    /**
     * Drop the stored retry state for a position removed by reconciliation.
     */
    public void forget(String symbol) {
        clearRetryState(symbol);
    }

    public int inFlightCount() {
        return (int) slots.count(SlotState.EXITING);
    }
}
