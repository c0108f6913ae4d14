package in.tradecore.service.execution;

import in.tradecore.application.monitoring.AlertService;
import in.tradecore.domain.common.EventType;
import in.tradecore.domain.order.OrderPurpose;
import in.tradecore.domain.order.OrderRequest;
import in.tradecore.domain.order.OrderResult;
import in.tradecore.domain.trade.Position;
import in.tradecore.infrastructure.broker.common.ErrorCategory;
import in.tradecore.infrastructure.broker.common.ErrorClassifier;
import in.tradecore.infrastructure.broker.common.ExternalCallExecutor;
import in.tradecore.infrastructure.broker.metrics.EngineMetrics;
import in.tradecore.infrastructure.broker.order.GatewayTimeoutException;
import in.tradecore.infrastructure.broker.order.OrderGateway;
import in.tradecore.service.core.AuditEventBus;
import in.tradecore.service.position.PositionLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Places entry orders off the calling loop.
 *
 * The caller must already hold the symbol's slot in {@link SlotState#ENTRY_IN_FLIGHT}.
 * A fill opens the position and moves the slot to POSITION_OPEN; any other outcome
 * releases the slot, including a submission the executor refuses during shutdown.
 * An authentication failure suspends further entries.
 */
public final class EntryOrderService {
    private static final Logger log = LoggerFactory.getLogger(EntryOrderService.class);

    private final OrderGateway gateway;
    private final ExternalCallExecutor gatewayCalls;
    private final Executor orderExecutor;
    private final PositionLedger ledger;
    private final SymbolSlotRegistry slots;
    private final ExecutionGate gate;
    private final OrderToTradeRatioMonitor otrMonitor;
    private final AlertService alertService;
    private final AuditEventBus audit;
    private final EngineMetrics metrics;
    private final Clock clock;

    public EntryOrderService(OrderGateway gateway, ExternalCallExecutor gatewayCalls, Executor orderExecutor,
                             PositionLedger ledger, SymbolSlotRegistry slots, ExecutionGate gate,
                             OrderToTradeRatioMonitor otrMonitor, AlertService alertService,
                             AuditEventBus audit, EngineMetrics metrics, Clock clock) {
        this.gateway = gateway;
        this.gatewayCalls = gatewayCalls;
        this.orderExecutor = orderExecutor;
        this.ledger = ledger;
        this.slots = slots;
        this.gate = gate;
        this.otrMonitor = otrMonitor;
        this.alertService = alertService;
        this.audit = audit;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Submit asynchronously.
     *
     * @return completes with the opened position, or empty when the entry did not fill
     */
    public CompletableFuture<Optional<Position>> submit(EntryIntent intent) {
        OrderRequest request = OrderRequest.market(intent.symbol(), intent.direction().entrySide(),
            intent.quantity(), OrderPurpose.ENTRY);
        try {
            return CompletableFuture.supplyAsync(() -> place(intent, request), orderExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("[{}] Entry not submitted, order executor shutting down", intent.symbol());
            metrics.recordOrder(OrderPurpose.ENTRY, "FAILED");
            failed(intent, request, "executor rejected: " + e.getMessage());
            return CompletableFuture.completedFuture(Optional.empty());
        }
    }

    Optional<Position> place(EntryIntent intent, OrderRequest request) {
        String symbol = intent.symbol();
        audit.emit(EventType.ORDER_SUBMITTED, symbol, orderPayload(intent, request));
        otrMonitor.recordPlaced();
        log.info("[{}] Placing {} entry: {} x{} ({}), correlationId={}", symbol, intent.source(),
            request.side(), request.quantity(), intent.strategyId(), request.correlationId());

        OrderResult result;
        try {
            result = gatewayCalls.execute("placeOrder", () -> gateway.placeOrder(request));
        } catch (RuntimeException e) {
            handleFailure(intent, request, e);
            return Optional.empty();
        }

        if (!result.isFilled()) {
            log.warn("[{}] Entry order rejected: {}", symbol, result.message());
            metrics.recordOrder(OrderPurpose.ENTRY, "REJECTED");
            failed(intent, request, "rejected: " + result.message());
            return Optional.empty();
        }

        otrMonitor.recordFilled();
        metrics.recordOrder(OrderPurpose.ENTRY, "FILLED");
        BigDecimal fillPrice = result.averagePrice() != null ? result.averagePrice() : intent.referencePrice();
        Position position = Position.opened(symbol, intent.direction(), fillPrice, result.filledQuantity() > 0
                ? result.filledQuantity() : intent.quantity(),
            intent.stopLoss(), intent.target(), result.orderId(), intent.strategyId(), clock.instant());
        try {
            ledger.add(position);
        } catch (IllegalStateException e) {
            // unreachable while the slot registry is respected
            log.error("[{}] Filled entry {} but ledger already holds a position", symbol, result.orderId());
            alertService.sendCriticalAlert("LEDGER_CONFLICT",
                "Entry " + result.orderId() + " filled for " + symbol + " while a position was already open");
            return Optional.empty();
        }
        slots.transition(symbol, SlotState.ENTRY_IN_FLIGHT, SlotState.POSITION_OPEN);
        metrics.setOpenPositions(ledger.size());

        Map<String, Object> payload = new HashMap<>();
        payload.put("orderId", result.orderId());
        payload.put("direction", position.direction().name());
        payload.put("entryPrice", position.entryPrice());
        payload.put("quantity", position.quantity());
        payload.put("stopLoss", position.stopLoss());
        payload.put("target", position.target() == null ? "" : position.target());
        payload.put("strategy", intent.strategyId());
        payload.put("source", intent.source());
        audit.emit(EventType.POSITION_OPENED, symbol, payload);
        log.info("[{}] ✅ Position OPEN: {} {} @ {} stop={} target={}", symbol, position.direction(),
            position.quantity(), position.entryPrice(), position.stopLoss(), position.target());
        return Optional.of(position);
    }

    private void handleFailure(EntryIntent intent, OrderRequest request, RuntimeException e) {
        ErrorCategory category = ErrorClassifier.classify(e);
        String symbol = intent.symbol();
        if (category == ErrorCategory.CRITICAL) {
            metrics.recordOrder(OrderPurpose.ENTRY, "AUTH_FAILED");
            gate.suspend("venue authentication failed: " + e.getMessage());
            alertService.sendCriticalAlert("GATEWAY_AUTH_FAILED",
                "Entry for " + symbol + " refused by venue authentication; new entries suspended");
        } else if (e instanceof GatewayTimeoutException) {
            metrics.recordOrder(OrderPurpose.ENTRY, "TIMEOUT");
        } else {
            metrics.recordOrder(OrderPurpose.ENTRY, "FAILED");
        }
        log.error("[{}] Entry order failed ({}): {}", symbol, category, e.getMessage());
        failed(intent, request, category + ": " + e.getMessage());
    }

    private void failed(EntryIntent intent, OrderRequest request, String reason) {
        slots.release(intent.symbol(), SlotState.ENTRY_IN_FLIGHT);
        Map<String, Object> payload = orderPayload(intent, request);
        payload.put("reason", reason);
        audit.emit(EventType.ORDER_FAILED, intent.symbol(), payload);
    }

    private static Map<String, Object> orderPayload(EntryIntent intent, OrderRequest request) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("correlationId", request.correlationId());
        payload.put("purpose", request.purpose().name());
        payload.put("side", request.side().name());
        payload.put("quantity", request.quantity());
        payload.put("referencePrice", intent.referencePrice());
        payload.put("source", intent.source());
        return payload;
    }
}
