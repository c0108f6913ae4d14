package in.tradecore.service.retest;

import in.tradecore.config.RetestConfig;
import in.tradecore.domain.common.EventType;
import in.tradecore.domain.trade.Direction;
import in.tradecore.domain.trade.PendingRetest;
import in.tradecore.domain.trade.RetestState;
import in.tradecore.infrastructure.broker.metrics.PrometheusEngineMetrics;
import in.tradecore.service.core.AuditEventBus;
import in.tradecore.service.execution.EntryIntent;
import in.tradecore.service.execution.EntryOrderService;
import in.tradecore.service.execution.ExecutionGate;
import in.tradecore.service.execution.SlotState;
import in.tradecore.service.execution.SymbolSlotRegistry;
import in.tradecore.testutil.MutableClock;
import in.tradecore.testutil.RecordingAuditSink;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static in.tradecore.testutil.Bars.bd;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests:
 * - A breakout parks in PENDING_RETEST and a second one for the symbol is ignored
 * - A pullback into the band submits exactly one entry at the touch price
 * - The deadline expires the wait without ordering and frees the slot
 * - Touches are ignored while new entries are blocked
 */
@ExtendWith(MockitoExtension.class)
class RetestWaitQueueTest {

    private static final Instant T0 = Instant.parse("2026-03-02T04:30:00Z");

    @Mock
    private EntryOrderService entryOrders;

    private final MutableClock clock = new MutableClock(T0);
    private final RecordingAuditSink sink = new RecordingAuditSink();
    private final Map<String, BigDecimal> prices = new HashMap<>();

    private SymbolSlotRegistry slots;
    private ExecutionGate gate;
    private AuditEventBus audit;
    private RetestWaitQueue queue;

    @BeforeEach
    void setUp() {
        PrometheusEngineMetrics metrics = new PrometheusEngineMetrics(new CollectorRegistry());
        slots = new SymbolSlotRegistry();
        gate = new ExecutionGate(clock);
        audit = new AuditEventBus(sink, 100, clock, metrics);
        audit.start();
        queue = new RetestWaitQueue(slots, entryOrders, gate, RetestConfig.defaults(), clock, audit, metrics);
    }

    @AfterEach
    void tearDown() {
        audit.stop();
    }

    private Optional<PendingRetest> parkLongBreakout() {
        slots.tryReserve("INFY", SlotState.SCREENING);
        return queue.enqueue("INFY", Direction.LONG, new BigDecimal("100.00"), new BigDecimal("98.00"),
            new BigDecimal("106.00"), 25, "BREAKOUT");
    }

    private void evaluate() {
        queue.evaluate(symbol -> Optional.ofNullable(prices.get(symbol)));
    }

    @Test
    void testEnqueueMovesSlotToPending() {
        Optional<PendingRetest> parked = parkLongBreakout();

        assertTrue(parked.isPresent());
        assertEquals(T0.plus(Duration.ofMinutes(30)), parked.get().deadline());
        assertEquals(SlotState.PENDING_RETEST, slots.stateOf("INFY").orElseThrow());
        assertEquals(RetestState.PENDING, queue.stateOf("INFY"));
    }

    @Test
    void testDuplicateBreakoutIgnored() {
        parkLongBreakout();

        Optional<PendingRetest> second = queue.enqueue("INFY", Direction.LONG, new BigDecimal("101.00"),
            new BigDecimal("99.00"), null, 25, "BREAKOUT");

        assertTrue(second.isEmpty());
        assertEquals(1, queue.size());
        assertEquals(0, new BigDecimal("100.00").compareTo(queue.snapshot().get(0).breakoutPrice()));
    }

    @Test
    void testEnqueueWithoutScreeningSlotRefused() {
        slots.tryReserve("INFY", SlotState.POSITION_OPEN);

        assertTrue(queue.enqueue("INFY", Direction.LONG, bd(100), bd(98), null, 25, "BREAKOUT").isEmpty());
        assertEquals(0, queue.size());
    }

    @Test
    @DisplayName("Pullback into the band fills once at the touch price")
    void testTouchWithinBandSubmitsEntry() {
        when(entryOrders.submit(any())).thenReturn(CompletableFuture.completedFuture(Optional.empty()));
        parkLongBreakout();
        prices.put("INFY", new BigDecimal("100.25"));

        evaluate();
        evaluate();

        ArgumentCaptor<EntryIntent> captor = ArgumentCaptor.forClass(EntryIntent.class);
        verify(entryOrders).submit(captor.capture());
        EntryIntent intent = captor.getValue();
        assertEquals("RETEST", intent.source());
        assertEquals(new BigDecimal("100.25"), intent.referencePrice());
        assertEquals(25, intent.quantity());
        assertEquals(Direction.LONG, intent.direction());
        assertEquals(SlotState.ENTRY_IN_FLIGHT, slots.stateOf("INFY").orElseThrow());
        assertEquals(RetestState.NONE, queue.stateOf("INFY"));

        audit.stop();
        assertEquals(1, sink.ofType(EventType.RETEST_FILLED).size());
    }

    @Test
    void testPriceOutsideBandKeepsWaiting() {
        parkLongBreakout();
        prices.put("INFY", new BigDecimal("101.00"));

        evaluate();

        verify(entryOrders, never()).submit(any());
        assertEquals(RetestState.PENDING, queue.stateOf("INFY"));
    }

    @Test
    void testDeadlineExpiresWithoutOrder() {
        parkLongBreakout();
        prices.put("INFY", new BigDecimal("101.00"));

        clock.advance(Duration.ofMinutes(29));
        evaluate();
        assertEquals(1, queue.size());

        clock.advance(Duration.ofMinutes(1));
        prices.put("INFY", new BigDecimal("100.00"));
        evaluate();

        assertEquals(0, queue.size());
        assertFalse(slots.isOccupied("INFY"));
        verify(entryOrders, never()).submit(any());

        audit.stop();
        assertEquals(1, sink.ofType(EventType.RETEST_EXPIRED).size());
    }

    @Test
    void testTouchIgnoredWhileGateBlocks() {
        parkLongBreakout();
        prices.put("INFY", new BigDecimal("100.10"));
        gate.suspend("operator halt");

        evaluate();

        verify(entryOrders, never()).submit(any());
        assertEquals(RetestState.PENDING, queue.stateOf("INFY"));
    }

    @Test
    void testBandIsSymmetricForShort() {
        slots.tryReserve("TCS", SlotState.SCREENING);
        PendingRetest retest = queue.enqueue("TCS", Direction.SHORT, new BigDecimal("200.00"),
            new BigDecimal("204.00"), null, 10, "BREAKOUT").orElseThrow();

        assertTrue(queue.isQualifyingTouch(retest, new BigDecimal("199.50")));
        assertTrue(queue.isQualifyingTouch(retest, new BigDecimal("200.60")));
        assertFalse(queue.isQualifyingTouch(retest, new BigDecimal("200.61")));
        assertFalse(queue.isQualifyingTouch(retest, new BigDecimal("199.30")));
    }

    @Test
    void testCancelReleasesSlot() {
        parkLongBreakout();

        assertTrue(queue.cancel("INFY", "session flatten").isPresent());
        assertFalse(slots.isOccupied("INFY"));
        assertTrue(queue.cancel("INFY", "again").isEmpty());
    }
}
