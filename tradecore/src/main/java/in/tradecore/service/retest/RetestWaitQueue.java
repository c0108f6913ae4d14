package in.tradecore.service.retest;

import in.tradecore.config.RetestConfig;
import in.tradecore.domain.common.EventType;
import in.tradecore.domain.trade.Direction;
import in.tradecore.domain.trade.PendingRetest;
import in.tradecore.domain.trade.RetestState;
import in.tradecore.infrastructure.broker.metrics.EngineMetrics;
import in.tradecore.service.core.AuditEventBus;
import in.tradecore.service.execution.EntryIntent;
import in.tradecore.service.execution.EntryOrderService;
import in.tradecore.service.execution.ExecutionGate;
import in.tradecore.service.execution.SlotState;
import in.tradecore.service.execution.SymbolSlotRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Breakout entries waiting for a pullback to the breakout level.
 *
 * Per symbol: NONE → PENDING → FILLED | EXPIRED. {@link #evaluate} runs on every monitor
 * cycle: expired entries are dropped without ordering, a price inside the tolerance band
 * around the breakout level hands the entry to {@link EntryOrderService} at the current price.
 *
 * The queue lock is held only while reading or removing entries. Orders are submitted
 * after it is released.
 */
public final class RetestWaitQueue {
    private static final Logger log = LoggerFactory.getLogger(RetestWaitQueue.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final SymbolSlotRegistry slots;
    private final EntryOrderService entryOrders;
    private final ExecutionGate gate;
    private final RetestConfig config;
    private final Clock clock;
    private final AuditEventBus audit;
    private final EngineMetrics metrics;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, PendingRetest> pending = new LinkedHashMap<>();

    public RetestWaitQueue(SymbolSlotRegistry slots, EntryOrderService entryOrders, ExecutionGate gate,
                           RetestConfig config, Clock clock, AuditEventBus audit, EngineMetrics metrics) {
        this.slots = slots;
        this.entryOrders = entryOrders;
        this.gate = gate;
        this.config = config;
        this.clock = clock;
        this.audit = audit;
        this.metrics = metrics;
    }

    /**
     * Park a breakout. The caller holds the symbol's slot in SCREENING; on success the slot
     * moves to PENDING_RETEST.
     *
     * @return the pending entry, empty if one already existed for the symbol
     */
    public Optional<PendingRetest> enqueue(String symbol, Direction direction, BigDecimal breakoutPrice,
                                           BigDecimal stopLoss, BigDecimal target, int quantity,
                                           String strategyId) {
        Instant now = clock.instant();
        PendingRetest retest = new PendingRetest(symbol, breakoutPrice, direction, stopLoss, target, quantity,
            strategyId, now, now.plus(Duration.ofMinutes(config.maxWaitMinutes())));

        lock.lock();
        try {
            if (pending.containsKey(symbol)) {
                log.info("[{}] Breakout ignored, retest already pending at {}", symbol,
                    pending.get(symbol).breakoutPrice());
                return Optional.empty();
            }
            if (!slots.transition(symbol, SlotState.SCREENING, SlotState.PENDING_RETEST)) {
                return Optional.empty();
            }
            pending.put(symbol, retest);
        } finally {
            lock.unlock();
        }

        log.info("[{}] Retest PENDING: {} breakout @ {}, deadline {}", symbol, direction, breakoutPrice,
            retest.deadline());
        metrics.recordRetest("PENDING");
        metrics.setPendingRetests(size());
        audit.emit(EventType.RETEST_PENDING, symbol, payload(retest, null));
        return Optional.of(retest);
    }

    /**
     * Expire overdue entries and fill the ones whose price has pulled back into the band.
     *
     * @param priceLookup Latest price per symbol, empty when unknown
     */
    public void evaluate(Function<String, Optional<BigDecimal>> priceLookup) {
        Instant now = clock.instant();
        List<PendingRetest> expired = new ArrayList<>();
        List<Map.Entry<PendingRetest, BigDecimal>> touched = new ArrayList<>();
        boolean entriesAllowed = gate.allowsEntries();

        lock.lock();
        try {
            var it = pending.values().iterator();
            while (it.hasNext()) {
                PendingRetest retest = it.next();
                if (retest.isExpired(now)) {
                    it.remove();
                    expired.add(retest);
                    continue;
                }
                if (!entriesAllowed) {
                    continue;
                }
                Optional<BigDecimal> price = priceLookup.apply(retest.symbol());
                if (price.isPresent() && isQualifyingTouch(retest, price.get())) {
                    it.remove();
                    touched.add(Map.entry(retest, price.get()));
                }
            }
        } finally {
            lock.unlock();
        }

        for (PendingRetest retest : expired) {
            slots.release(retest.symbol(), SlotState.PENDING_RETEST);
            log.info("[{}] Retest EXPIRED at {} without a pullback to {}", retest.symbol(), now,
                retest.breakoutPrice());
            metrics.recordRetest("EXPIRED");
            audit.emit(EventType.RETEST_EXPIRED, retest.symbol(), payload(retest, null));
        }

        for (Map.Entry<PendingRetest, BigDecimal> entry : touched) {
            fill(entry.getKey(), entry.getValue());
        }

        if (!expired.isEmpty() || !touched.isEmpty()) {
            metrics.setPendingRetests(size());
        }
    }

    private void fill(PendingRetest retest, BigDecimal price) {
        String symbol = retest.symbol();
        if (!slots.transition(symbol, SlotState.PENDING_RETEST, SlotState.ENTRY_IN_FLIGHT)) {
            return;
        }
        log.info("[{}] Retest FILLED: price {} within {}% of breakout {}", symbol, price,
            config.tolerancePercent(), retest.breakoutPrice());
        metrics.recordRetest("FILLED");
        audit.emit(EventType.RETEST_FILLED, symbol, payload(retest, price));
        entryOrders.submit(new EntryIntent(symbol, retest.direction(), retest.quantity(), retest.stopLoss(),
            retest.target(), retest.strategyId(), price, "RETEST"));
    }

    /**
     * Long: price pulled back to within the band above (or just below) the level.
     * Short: price rebounded to within the band below (or just above) it.
     */
    boolean isQualifyingTouch(PendingRetest retest, BigDecimal price) {
        BigDecimal level = retest.breakoutPrice();
        BigDecimal band = level.multiply(BigDecimal.valueOf(config.tolerancePercent())).divide(HUNDRED);
        BigDecimal upper = level.add(band);
        BigDecimal lower = level.subtract(band);
        return price.compareTo(lower) >= 0 && price.compareTo(upper) <= 0;
    }

    /**
     * Drop a pending entry without ordering (session end, shutdown).
     */
    public Optional<PendingRetest> cancel(String symbol, String reason) {
        PendingRetest removed;
        lock.lock();
        try {
            removed = pending.remove(symbol);
        } finally {
            lock.unlock();
        }
        if (removed != null) {
            slots.release(symbol, SlotState.PENDING_RETEST);
            log.info("[{}] Retest cancelled: {}", symbol, reason);
            metrics.recordRetest("EXPIRED");
            metrics.setPendingRetests(size());
            audit.emit(EventType.RETEST_EXPIRED, symbol, payload(removed, null));
        }
        return Optional.ofNullable(removed);
    }

    public RetestState stateOf(String symbol) {
        lock.lock();
        try {
            return pending.containsKey(symbol) ? RetestState.PENDING : RetestState.NONE;
        } finally {
            lock.unlock();
        }
    }

    public List<PendingRetest> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(pending.values());
        } finally {
            lock.unlock();
        }
    }

    public List<String> symbols() {
        return snapshot().stream().map(PendingRetest::symbol).toList();
    }

    public int size() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    private static Map<String, Object> payload(PendingRetest retest, BigDecimal fillPrice) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("direction", retest.direction().name());
        payload.put("breakoutPrice", retest.breakoutPrice());
        payload.put("stopLoss", retest.stopLoss());
        payload.put("quantity", retest.quantity());
        payload.put("strategy", retest.strategyId());
        payload.put("deadline", retest.deadline().toString());
        if (fillPrice != null) {
            payload.put("retestPrice", fillPrice);
        }
        return payload;
    }
}
