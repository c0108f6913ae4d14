package in.tradecore.service.execution;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SymbolSlotRegistryTest {

    private final SymbolSlotRegistry slots = new SymbolSlotRegistry();

    @Test
    void testSingleOccupantPerSymbol() {
        assertTrue(slots.tryReserve("INFY", SlotState.SCREENING));
        assertFalse(slots.tryReserve("INFY", SlotState.PENDING_RETEST));
        assertTrue(slots.tryReserve("TCS", SlotState.SCREENING), "Other symbols are independent");
    }

    @Test
    void testTransitionRequiresExpectedState() {
        slots.tryReserve("INFY", SlotState.SCREENING);

        assertFalse(slots.transition("INFY", SlotState.PENDING_RETEST, SlotState.ENTRY_IN_FLIGHT));
        assertTrue(slots.transition("INFY", SlotState.SCREENING, SlotState.ENTRY_IN_FLIGHT));
        assertEquals(SlotState.ENTRY_IN_FLIGHT, slots.stateOf("INFY").orElseThrow());
    }

    @Test
    void testConditionalRelease() {
        slots.tryReserve("INFY", SlotState.POSITION_OPEN);

        assertFalse(slots.release("INFY", SlotState.SCREENING), "Stale holder cannot release");
        assertTrue(slots.isOccupied("INFY"));
        assertTrue(slots.release("INFY", SlotState.POSITION_OPEN));
        assertFalse(slots.isOccupied("INFY"));
    }

    @Test
    void testCountAndSnapshot() {
        slots.tryReserve("TCS", SlotState.POSITION_OPEN);
        slots.tryReserve("INFY", SlotState.POSITION_OPEN);
        slots.tryReserve("ACC", SlotState.PENDING_RETEST);

        assertEquals(2, slots.count(SlotState.POSITION_OPEN));
        assertEquals("ACC", slots.snapshot().keySet().iterator().next());
    }

    @Test
    void testConcurrentReserveHasOneWinner() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        try {
            for (int i = 0; i < threads; i++) {
                SlotState state = i % 2 == 0 ? SlotState.SCREENING : SlotState.ENTRY_IN_FLIGHT;
                pool.execute(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    if (slots.tryReserve("INFY", state)) {
                        winners.incrementAndGet();
                    }
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        }

        assertEquals(1, winners.get());
    }
}
