package in.tradecore.service.position;

import in.tradecore.application.monitoring.AlertService;
import in.tradecore.config.RiskConfig;
import in.tradecore.domain.common.AuditEvent;
import in.tradecore.domain.common.EventType;
import in.tradecore.domain.order.OrderPurpose;
import in.tradecore.domain.order.OrderRequest;
import in.tradecore.domain.order.OrderResult;
import in.tradecore.domain.order.OrderSide;
import in.tradecore.domain.trade.Direction;
import in.tradecore.domain.trade.ExitReason;
import in.tradecore.domain.trade.Position;
import in.tradecore.infrastructure.broker.common.ExternalCallExecutor;
import in.tradecore.infrastructure.broker.common.RetryPolicy;
import in.tradecore.infrastructure.broker.metrics.PrometheusEngineMetrics;
import in.tradecore.infrastructure.broker.order.GatewayAuthenticationException;
import in.tradecore.infrastructure.broker.order.OrderGateway;
import in.tradecore.service.core.AuditEventBus;
import in.tradecore.service.execution.DailyLossMonitor;
import in.tradecore.service.execution.ExecutionGate;
import in.tradecore.service.execution.SlotState;
import in.tradecore.service.execution.SymbolSlotRegistry;
import in.tradecore.testutil.MutableClock;
import in.tradecore.testutil.RecordingAuditSink;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static in.tradecore.testutil.Bars.bd;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests:
 * - Filled exit removes the position, frees the slot and audits the realized P&L
 * - Failed exit keeps the position and raises a critical alert
 * - Only one exit per symbol is in flight; retries reuse the correlation id
 * - Re-submission backs off and repeated failures do not repeat the alert every cycle
 * - Authentication failure on an exit suspends new entries
 * - An exit never goes out for a position reconciliation already removed
 */
@ExtendWith(MockitoExtension.class)
class ExitOrderExecutorTest {

    private static final Instant NOW = Instant.parse("2026-03-02T06:00:00Z");

    @Mock
    private OrderGateway gateway;

    @Mock
    private AlertService alertService;

    private final MutableClock clock = new MutableClock(NOW);
    private final CollectorRegistry registry = new CollectorRegistry();
    private final RecordingAuditSink sink = new RecordingAuditSink();
    private final List<Runnable> queued = new ArrayList<>();

    private PositionLedger ledger;
    private SymbolSlotRegistry slots;
    private AuditEventBus audit;
    private ExternalCallExecutor calls;
    private PrometheusEngineMetrics metrics;
    private ExecutionGate gate;
    private DailyLossMonitor dailyLoss;
    private Position position;

    @BeforeEach
    void setUp() {
        metrics = new PrometheusEngineMetrics(registry);
        // backoff between exit re-submissions: 1s, 2s, 4s ... capped at 1m
        calls = new ExternalCallExecutor("PAPER", RetryPolicy.builder().maxAttempts(1).build(),
            Duration.ofSeconds(1), d -> { }, metrics);
        gate = new ExecutionGate(clock);
        dailyLoss = new DailyLossMonitor(RiskConfig.defaults(), gate, clock, ZoneId.of("Asia/Kolkata"));
        ledger = new PositionLedger();
        slots = new SymbolSlotRegistry();
        audit = new AuditEventBus(sink, 100, clock, metrics);
        audit.start();

        position = Position.opened("INFY", Direction.LONG, new BigDecimal("100.00"), 10,
            new BigDecimal("98.00"), null, "ORD-1", "MEAN_REVERSION", NOW.minusSeconds(3600));
        ledger.add(position);
        slots.tryReserve("INFY", SlotState.POSITION_OPEN);
    }

    @AfterEach
    void tearDown() {
        audit.stop();
    }

    private ExitOrderExecutor executor(Executor orderExecutor) {
        return new ExitOrderExecutor(gateway, calls, orderExecutor, ledger, slots, gate, dailyLoss, alertService,
            audit, metrics, clock);
    }

    @Test
    void testFilledExitClosesPosition() {
        when(gateway.placeOrder(any())).thenAnswer(inv -> CompletableFuture.completedFuture(
            OrderResult.filled("ORD-2", "c", 10, new BigDecimal("97.50"), NOW)));

        Boolean closed = executor(Runnable::run).submitExit(position, ExitReason.STOP_LOSS, bd(97.8)).join();

        assertTrue(closed);
        assertFalse(ledger.contains("INFY"));
        assertFalse(slots.isOccupied("INFY"));
        assertEquals(0, new BigDecimal("-25.00").compareTo(dailyLoss.realizedToday()));
        assertEquals(1.0, registry.getSampleValue("engine_positions_closed_total",
            new String[]{"reason"}, new String[]{"STOP_LOSS"}));

        audit.stop();
        List<AuditEvent> closedEvents = sink.ofType(EventType.POSITION_CLOSED);
        assertEquals(1, closedEvents.size());
        assertEquals(0, new BigDecimal("-25.00").compareTo((BigDecimal) closedEvents.get(0).payload().get("pnl")));
        assertEquals(0, new BigDecimal("97.50").compareTo((BigDecimal) closedEvents.get(0).payload().get("exitPrice")));
    }

    @Test
    void testExitUsesOppositeSide() {
        ArgumentCaptor<OrderRequest> captor = ArgumentCaptor.forClass(OrderRequest.class);
        when(gateway.placeOrder(captor.capture())).thenAnswer(inv -> CompletableFuture.completedFuture(
            OrderResult.filled("ORD-2", "c", 10, new BigDecimal("106.00"), NOW)));

        executor(Runnable::run).submitExit(position, ExitReason.TARGET, bd(106)).join();

        assertEquals(OrderSide.SELL, captor.getValue().side());
        assertEquals(OrderPurpose.EXIT, captor.getValue().purpose());
        assertEquals(10, captor.getValue().quantity());
    }

    @Test
    void testRejectedExitKeepsPosition() {
        when(gateway.placeOrder(any())).thenAnswer(inv -> CompletableFuture.completedFuture(
            OrderResult.rejected("c", "circuit limit", NOW)));
        ExitOrderExecutor exits = executor(Runnable::run);

        Boolean closed = exits.submitExit(position, ExitReason.STOP_LOSS, bd(97.8)).join();

        assertFalse(closed);
        assertTrue(ledger.contains("INFY"));
        assertEquals(SlotState.POSITION_OPEN, slots.stateOf("INFY").orElseThrow());
        assertFalse(exits.isExiting("INFY"), "Next cycle may retry");
        verify(alertService).sendCriticalAlert(eq("EXIT_ORDER_FAILED"), anyString());
    }

    @Test
    void testSecondExitWhileInFlightIgnored() {
        when(gateway.placeOrder(any())).thenAnswer(inv -> CompletableFuture.completedFuture(
            OrderResult.filled("ORD-2", "c", 10, new BigDecimal("97.50"), NOW)));
        ExitOrderExecutor exits = executor(queued::add);

        CompletableFuture<Boolean> first = exits.submitExit(position, ExitReason.STOP_LOSS, bd(97.8));
        assertNull(exits.submitExit(position, ExitReason.STOP_LOSS, bd(97.6)));
        assertTrue(exits.isExiting("INFY"));
        assertEquals(SlotState.EXITING, slots.stateOf("INFY").orElseThrow());
        assertEquals(1, queued.size());

        queued.get(0).run();

        assertTrue(first.join());
        assertEquals(0, exits.inFlightCount());
        verify(gateway, times(1)).placeOrder(any());
    }

    @Test
    void testRetryReusesCorrelationId() {
        ArgumentCaptor<OrderRequest> captor = ArgumentCaptor.forClass(OrderRequest.class);
        when(gateway.placeOrder(captor.capture()))
            .thenAnswer(inv -> CompletableFuture.completedFuture(OrderResult.rejected("c", "busy", NOW)))
            .thenAnswer(inv -> CompletableFuture.completedFuture(
                OrderResult.filled("ORD-3", "c", 10, new BigDecimal("97.40"), NOW)));
        ExitOrderExecutor exits = executor(Runnable::run);

        assertFalse(exits.submitExit(position, ExitReason.STOP_LOSS, bd(97.8)).join());
        clock.advance(Duration.ofSeconds(1));
        assertTrue(exits.submitExit(position, ExitReason.STOP_LOSS, bd(97.5)).join());

        List<OrderRequest> requests = captor.getAllValues();
        assertEquals(2, requests.size());
        assertEquals(requests.get(0).correlationId(), requests.get(1).correlationId());
    }

    @Test
    void testResubmissionBacksOff() {
        when(gateway.placeOrder(any())).thenAnswer(inv -> CompletableFuture.completedFuture(
            OrderResult.rejected("c", "circuit limit", NOW)));
        ExitOrderExecutor exits = executor(Runnable::run);

        assertFalse(exits.submitExit(position, ExitReason.STOP_LOSS, bd(97.8)).join());
        assertNull(exits.submitExit(position, ExitReason.STOP_LOSS, bd(97.8)), "Still inside the 1s backoff");

        clock.advance(Duration.ofSeconds(1));
        assertFalse(exits.submitExit(position, ExitReason.STOP_LOSS, bd(97.8)).join());
        clock.advance(Duration.ofSeconds(1));
        assertNull(exits.submitExit(position, ExitReason.STOP_LOSS, bd(97.8)), "Second failure waits 2s");

        clock.advance(Duration.ofSeconds(1));
        assertFalse(exits.submitExit(position, ExitReason.STOP_LOSS, bd(97.8)).join());
        verify(gateway, times(3)).placeOrder(any());
    }

    @Test
    void testRepeatedFailuresAlertOncePerInterval() {
        when(gateway.placeOrder(any())).thenAnswer(inv -> CompletableFuture.completedFuture(
            OrderResult.rejected("c", "venue down", NOW)));
        ExitOrderExecutor exits = executor(Runnable::run);

        for (int i = 0; i < 6; i++) {
            exits.submitExit(position, ExitReason.STOP_LOSS, bd(97.8));
            clock.advance(Duration.ofSeconds(40));
        }
        verify(alertService, times(1)).sendCriticalAlert(eq("EXIT_ORDER_FAILED"), anyString());

        clock.advance(ExitOrderExecutor.ALERT_INTERVAL);
        exits.submitExit(position, ExitReason.STOP_LOSS, bd(97.8));
        verify(alertService, times(2)).sendCriticalAlert(eq("EXIT_ORDER_FAILED"), anyString());
        assertTrue(ledger.contains("INFY"));
    }

    @Test
    void testAuthFailureOnExitSuspendsEntries() {
        when(gateway.placeOrder(any())).thenAnswer(inv ->
            CompletableFuture.failedFuture(new GatewayAuthenticationException("PAPER", "session expired")));

        assertFalse(executor(Runnable::run).submitExit(position, ExitReason.STOP_LOSS, bd(97.8)).join());

        assertTrue(gate.isSuspended());
        assertTrue(ledger.contains("INFY"));
        assertEquals(SlotState.POSITION_OPEN, slots.stateOf("INFY").orElseThrow());
        verify(alertService).sendCriticalAlert(eq("GATEWAY_AUTH_FAILED"), anyString());
        assertEquals(1.0, registry.getSampleValue("engine_orders_total",
            new String[]{"purpose", "outcome"}, new String[]{"EXIT", "AUTH_FAILED"}));
    }

    @Test
    void testNoExitForPositionAlreadyRemoved() {
        // reconciliation released the slot and dropped the position after the monitor's snapshot
        assertTrue(slots.release("INFY", SlotState.POSITION_OPEN));
        ledger.remove("INFY");

        assertNull(executor(Runnable::run).submitExit(position, ExitReason.STOP_LOSS, bd(97.8)));

        verify(gateway, never()).placeOrder(any());
    }

    @Test
    void testQueuedExitSkippedIfLedgerNoLongerHoldsPosition() {
        ExitOrderExecutor exits = executor(queued::add);
        CompletableFuture<Boolean> pending = exits.submitExit(position, ExitReason.STOP_LOSS, bd(97.8));
        ledger.remove("INFY");

        queued.get(0).run();

        assertFalse(pending.join());
        assertFalse(slots.isOccupied("INFY"));
        verify(gateway, never()).placeOrder(any());
    }
}
