package in.tradecore.service.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Controls whether new entries may be placed.
 *
 * Independent brakes:
 * - suspension (venue authentication failure), held until {@link #resume()}
 * - throttle (order-to-trade ratio breach), lifted automatically at its deadline
 * - halt (daily loss limit), held until the next trading day starts
 *
 * Exit orders never consult the gate.
 */
public final class ExecutionGate {
    private static final Logger log = LoggerFactory.getLogger(ExecutionGate.class);

    private final Clock clock;

    private volatile String suspensionReason;
    private volatile Instant throttledUntil;
    private volatile String throttleReason;
    private volatile Instant haltedUntil;
    private volatile String haltReason;

    public ExecutionGate(Clock clock) {
        this.clock = clock;
    }

    public void suspend(String reason) {
        if (suspensionReason == null) {
            log.error("⛔ New entries SUSPENDED: {}", reason);
        }
        suspensionReason = reason;
    }

    public void resume() {
        if (suspensionReason != null) {
            log.info("✅ New entries resumed (was: {})", suspensionReason);
        }
        suspensionReason = null;
    }

    public void throttleUntil(Instant until, String reason) {
        throttledUntil = until;
        throttleReason = reason;
        log.warn("New entries throttled until {}: {}", until, reason);
    }

    public void haltUntil(Instant until, String reason) {
        haltedUntil = until;
        haltReason = reason;
        log.error("⛔ New entries HALTED until {}: {}", until, reason);
    }

    public boolean allowsEntries() {
        return blockReason() == null;
    }

    /**
     * @return why entries are blocked right now, or null when they are allowed
     */
    public String blockReason() {
        String suspended = suspensionReason;
        if (suspended != null) {
            return "suspended: " + suspended;
        }
        Instant now = clock.instant();
        Instant halted = haltedUntil;
        if (halted != null && now.isBefore(halted)) {
            return "halted until " + halted + ": " + haltReason;
        }
        Instant until = throttledUntil;
        if (until != null && now.isBefore(until)) {
            return "throttled until " + until + ": " + throttleReason;
        }
        return null;
    }

    public boolean isSuspended() {
        return suspensionReason != null;
    }
}
