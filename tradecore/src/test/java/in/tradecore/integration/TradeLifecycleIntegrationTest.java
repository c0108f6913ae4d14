package in.tradecore.integration;

import in.tradecore.application.monitoring.AlertService;
import in.tradecore.config.ReconciliationConfig;
import in.tradecore.config.RetestConfig;
import in.tradecore.config.RiskConfig;
import in.tradecore.config.SessionConfig;
import in.tradecore.config.StopConfig;
import in.tradecore.domain.common.AuditEvent;
import in.tradecore.domain.common.EventType;
import in.tradecore.domain.monitoring.ReconciliationReport;
import in.tradecore.domain.trade.Direction;
import in.tradecore.domain.trade.Position;
import in.tradecore.infrastructure.broker.adapters.PaperOrderGateway;
import in.tradecore.infrastructure.broker.common.ExternalCallExecutor;
import in.tradecore.infrastructure.broker.common.RetryPolicy;
import in.tradecore.infrastructure.broker.metrics.PrometheusEngineMetrics;
import in.tradecore.service.candle.SessionClock;
import in.tradecore.service.core.AuditEventBus;
import in.tradecore.service.execution.DailyLossMonitor;
import in.tradecore.service.execution.EntryOrderService;
import in.tradecore.service.execution.ExecutionGate;
import in.tradecore.service.execution.OrderToTradeRatioMonitor;
import in.tradecore.service.execution.SlotState;
import in.tradecore.service.execution.SymbolSlotRegistry;
import in.tradecore.service.position.ExitOrderExecutor;
import in.tradecore.service.position.PositionLedger;
import in.tradecore.service.position.PositionMonitor;
import in.tradecore.service.position.StopRatchet;
import in.tradecore.service.reconcile.ReconciliationService;
import in.tradecore.service.retest.RetestWaitQueue;
import in.tradecore.testutil.MutableClock;
import in.tradecore.testutil.RecordingAuditSink;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration Test: breakout retest to stop-out against the paper venue.
 *
 * Wires the real execution path (retest queue, entry service, monitor, ratchet, exit executor,
 * reconciliation) around a {@link PaperOrderGateway}, driving prices by hand:
 * 1. Breakout parks, price runs away, then pulls back into the band
 * 2. Entry fills at the touch price
 * 3. Stop ratchets to breakeven, then trails
 * 4. Pullback hits the trailed stop, position closes with a locked-in gain
 * 5. Reconciliation finds ledger and venue in agreement
 */
class TradeLifecycleIntegrationTest {
    private static final Logger log = LoggerFactory.getLogger(TradeLifecycleIntegrationTest.class);

    private static final String SYMBOL = "INFY";
    // 10:00 IST
    private static final Instant START = Instant.parse("2026-03-02T04:30:00Z");

    private final MutableClock clock = new MutableClock(START);
    private final Map<String, BigDecimal> prices = new ConcurrentHashMap<>();
    private final RecordingAuditSink sink = new RecordingAuditSink();

    private PaperOrderGateway venue;
    private SymbolSlotRegistry slots;
    private PositionLedger ledger;
    private RetestWaitQueue retests;
    private PositionMonitor monitor;
    private ReconciliationService reconciliation;
    private AuditEventBus audit;

    @BeforeEach
    void setUp() {
        PrometheusEngineMetrics metrics = new PrometheusEngineMetrics(new CollectorRegistry());
        SessionClock sessionClock = new SessionClock(SessionConfig.defaults(), clock);
        AlertService alertService = new AlertService(clock);
        audit = new AuditEventBus(sink, 1000, clock, metrics);
        audit.start();

        venue = new PaperOrderGateway(this::price, clock);
        ExternalCallExecutor calls = new ExternalCallExecutor(venue.getGatewayCode(),
            RetryPolicy.builder().maxAttempts(2).build(), Duration.ofSeconds(5), d -> { }, metrics);

        slots = new SymbolSlotRegistry();
        ledger = new PositionLedger();
        ExecutionGate gate = new ExecutionGate(clock);
        OrderToTradeRatioMonitor otr = new OrderToTradeRatioMonitor(RiskConfig.defaults(), gate, clock,
            sessionClock.zone());
        EntryOrderService entries = new EntryOrderService(venue, calls, Runnable::run, ledger, slots, gate, otr,
            alertService, audit, metrics, clock);
        DailyLossMonitor dailyLoss = new DailyLossMonitor(RiskConfig.defaults(), gate, clock, sessionClock.zone());
        ExitOrderExecutor exits = new ExitOrderExecutor(venue, calls, Runnable::run, ledger, slots, gate,
            dailyLoss, alertService, audit, metrics, clock);
        retests = new RetestWaitQueue(slots, entries, gate, RetestConfig.defaults(), clock, audit, metrics);
        monitor = new PositionMonitor(ledger, new StopRatchet(StopConfig.defaults()), exits, retests,
            sessionClock, this::price, audit, metrics);
        reconciliation = new ReconciliationService(venue, calls, ledger, slots, exits, gate,
            ReconciliationConfig.defaults(), clock, alertService, audit, metrics);
    }

    @AfterEach
    void tearDown() {
        audit.stop();
    }

    private Optional<BigDecimal> price(String symbol) {
        return Optional.ofNullable(prices.get(symbol));
    }

    private void tick(String price) {
        clock.advance(Duration.ofMinutes(1));
        prices.put(SYMBOL, new BigDecimal(price));
        monitor.runCycle();
    }

    private void parkBreakout() {
        assertTrue(slots.tryReserve(SYMBOL, SlotState.SCREENING));
        assertTrue(retests.enqueue(SYMBOL, Direction.LONG, new BigDecimal("100.00"), new BigDecimal("98.00"),
            new BigDecimal("110.00"), 10, "BREAKOUT").isPresent());
    }

    @Test
    @DisplayName("Breakout → retest fill → breakeven → trail → stop-out")
    void testRetestEntryTrailedToStop() {
        parkBreakout();

        tick("101.50");
        assertFalse(ledger.contains(SYMBOL), "Price above the retest band");

        tick("100.20");
        Position opened = ledger.get(SYMBOL).orElseThrow();
        assertEquals(0, new BigDecimal("100.20").compareTo(opened.entryPrice()));
        assertEquals(SlotState.POSITION_OPEN, slots.stateOf(SYMBOL).orElseThrow());

        tick("103.00");
        Position atBreakeven = ledger.get(SYMBOL).orElseThrow();
        assertTrue(atBreakeven.breakevenMoved());
        assertEquals(0, new BigDecimal("100.20").compareTo(atBreakeven.stopLoss()));

        tick("105.00");
        assertEquals(new BigDecimal("102.60"), ledger.get(SYMBOL).orElseThrow().stopLoss());

        tick("104.00");
        assertEquals(new BigDecimal("102.60"), ledger.get(SYMBOL).orElseThrow().stopLoss(), "Stop never loosens");

        tick("102.50");
        assertFalse(ledger.contains(SYMBOL));
        assertFalse(slots.isOccupied(SYMBOL));

        ReconciliationReport report = reconciliation.reconcile();
        assertTrue(report.fetched());
        assertFalse(report.hasDiscrepancies());
        assertEquals(0, report.venuePositions());

        audit.stop();
        List<AuditEvent> closed = sink.ofType(EventType.POSITION_CLOSED);
        assertEquals(1, closed.size());
        BigDecimal pnl = (BigDecimal) closed.get(0).payload().get("pnl");
        log.info("Round trip P&L: {}", pnl);
        assertEquals(0, new BigDecimal("23.00").compareTo(pnl));
        assertEquals(1, sink.ofType(EventType.RETEST_PENDING).size());
        assertEquals(1, sink.ofType(EventType.RETEST_FILLED).size());
        assertEquals(1, sink.ofType(EventType.POSITION_OPENED).size());
        assertEquals(2, sink.ofType(EventType.STOP_MOVED).size());
    }

    @Test
    @DisplayName("Position closed outside the engine is removed by reconciliation")
    void testExternalCloseReconciled() {
        parkBreakout();
        tick("100.10");
        assertTrue(ledger.contains(SYMBOL));
        assertEquals(1, reconciliation.reconcile().venuePositions());

        venue.closeExternally(SYMBOL);
        clock.advance(Duration.ofMinutes(1));
        ReconciliationReport report = reconciliation.reconcile();

        assertEquals(List.of(SYMBOL), report.phantomRemoved());
        assertFalse(ledger.contains(SYMBOL));
        assertFalse(slots.isOccupied(SYMBOL));
    }

    @Test
    @DisplayName("Retest deadline passes without an order")
    void testRetestExpires() {
        parkBreakout();

        for (int i = 0; i < 31; i++) {
            tick("101.80");
        }

        assertEquals(0, retests.size());
        assertFalse(slots.isOccupied(SYMBOL));
        assertTrue(ledger.getAll().isEmpty());
        assertEquals(0, reconciliation.reconcile().venuePositions());
    }
}
