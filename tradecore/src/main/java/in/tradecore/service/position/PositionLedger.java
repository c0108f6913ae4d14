package in.tradecore.service.position;

import in.tradecore.domain.trade.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Authoritative local record of open positions.
 *
 * One lock guards the whole ledger. Every method holds it only for the map operation;
 * callers get immutable {@link Position} snapshots and must never call out to the
 * venue while holding anything obtained here.
 */
public final class PositionLedger {
    private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Position> positions = new LinkedHashMap<>();

    /**
     * @throws IllegalStateException if the symbol already has an open position
     */
    public void add(Position position) {
        lock.lock();
        try {
            if (positions.containsKey(position.symbol())) {
                throw new IllegalStateException("Position already open for " + position.symbol());
            }
            positions.put(position.symbol(), position);
        } finally {
            lock.unlock();
        }
        log.info("[{}] Position added: {} {} @ {} stop={} target={}", position.symbol(), position.direction(),
            position.quantity(), position.entryPrice(), position.stopLoss(), position.target());
    }

    /**
     * Remove a position.
     *
     * @return the removed position, empty if none was open
     */
    public Optional<Position> remove(String symbol) {
        Position removed;
        lock.lock();
        try {
            removed = positions.remove(symbol);
        } finally {
            lock.unlock();
        }
        if (removed != null) {
            log.info("[{}] Position removed from ledger", symbol);
        }
        return Optional.ofNullable(removed);
    }

    public Optional<Position> get(String symbol) {
        lock.lock();
        try {
            return Optional.ofNullable(positions.get(symbol));
        } finally {
            lock.unlock();
        }
    }

    public List<Position> getAll() {
        lock.lock();
        try {
            return new ArrayList<>(positions.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Move the stop. Only tightening moves are applied; a candidate that would loosen the
     * stop (or equals it) is ignored.
     *
     * @return the updated position, empty if nothing changed
     */
    public Optional<Position> updateStop(String symbol, BigDecimal newStop, boolean breakevenMoved) {
        lock.lock();
        try {
            Position current = positions.get(symbol);
            if (current == null) {
                return Optional.empty();
            }
            if (!current.tightens(newStop)) {
                if (newStop.compareTo(current.stopLoss()) != 0) {
                    log.warn("[{}] Refused stop move {} -> {} (would loosen)", symbol, current.stopLoss(), newStop);
                }
                return Optional.empty();
            }
            Position updated = current.withStop(newStop, current.breakevenMoved() || breakevenMoved);
            positions.put(symbol, updated);
            return Optional.of(updated);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Record a new favorable extreme. Ignored unless the price improves on the stored peak.
     */
    public Optional<Position> updatePeak(String symbol, BigDecimal price) {
        lock.lock();
        try {
            Position current = positions.get(symbol);
            if (current == null || !current.direction().isBetter(price, current.peakFavorablePrice())) {
                return Optional.empty();
            }
            Position updated = current.withPeak(price);
            positions.put(symbol, updated);
            return Optional.of(updated);
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String symbol) {
        lock.lock();
        try {
            return positions.containsKey(symbol);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return positions.size();
        } finally {
            lock.unlock();
        }
    }
}
