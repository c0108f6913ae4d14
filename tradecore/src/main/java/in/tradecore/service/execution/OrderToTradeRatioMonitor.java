package in.tradecore.service.execution;

import in.tradecore.config.RiskConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks orders placed versus orders filled for the trading day. Once at least
 * {@code minOrdersForRatio} orders have been sent and the ratio exceeds the limit,
 * new entries are throttled for {@code throttleSeconds}.
 */
public final class OrderToTradeRatioMonitor {
    private static final Logger log = LoggerFactory.getLogger(OrderToTradeRatioMonitor.class);

    private final RiskConfig config;
    private final ExecutionGate gate;
    private final Clock clock;
    private final ZoneId zone;

    private final AtomicLong placed = new AtomicLong();
    private final AtomicLong filled = new AtomicLong();
    private volatile LocalDate day;

    public OrderToTradeRatioMonitor(RiskConfig config, ExecutionGate gate, Clock clock, ZoneId zone) {
        this.config = config;
        this.gate = gate;
        this.clock = clock;
        this.zone = zone;
        this.day = LocalDate.now(clock.withZone(zone));
    }

    public void recordPlaced() {
        rollDay();
        placed.incrementAndGet();
        check();
    }

    public void recordFilled() {
        rollDay();
        filled.incrementAndGet();
    }

    /**
     * Orders per fill; with no fills yet this is the order count itself.
     */
    public double ratio() {
        long fills = filled.get();
        return fills == 0 ? placed.get() : (double) placed.get() / fills;
    }

    public long getPlacedCount() {
        return placed.get();
    }

    public long getFilledCount() {
        return filled.get();
    }

    private void check() {
        if (placed.get() < config.minOrdersForRatio()) {
            return;
        }
        double ratio = ratio();
        if (ratio > config.maxOrderToTradeRatio()) {
            log.warn("Order-to-trade ratio {} exceeds {} (placed={}, filled={})",
                String.format("%.1f", ratio), config.maxOrderToTradeRatio(), placed.get(), filled.get());
            gate.throttleUntil(clock.instant().plus(Duration.ofSeconds(config.throttleSeconds())),
                String.format("order-to-trade ratio %.1f", ratio));
        }
    }

    private synchronized void rollDay() {
        LocalDate today = LocalDate.now(clock.withZone(zone));
        if (!today.equals(day)) {
            log.info("New trading day {}, resetting order-to-trade counters (placed={}, filled={})",
                today, placed.get(), filled.get());
            placed.set(0);
            filled.set(0);
            day = today;
        }
    }
}
