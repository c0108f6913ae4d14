package in.tradecore.service.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One trade slot per symbol: at most one of {screening signal, pending retest, in-flight entry,
 * open position} exists for a symbol at any time.
 *
 * Every transition is a single atomic map operation, so concurrent signal processing and
 * retest fills cannot both claim a symbol.
 */
public final class SymbolSlotRegistry {
    private static final Logger log = LoggerFactory.getLogger(SymbolSlotRegistry.class);

    private final ConcurrentHashMap<String, SlotState> slots = new ConcurrentHashMap<>();

    /**
     * Claim a free slot.
     *
     * @return true if the slot was free and is now held in {@code state}
     */
    public boolean tryReserve(String symbol, SlotState state) {
        SlotState existing = slots.putIfAbsent(symbol, state);
        if (existing != null) {
            log.debug("[{}] Slot busy ({}), cannot reserve for {}", symbol, existing, state);
            return false;
        }
        return true;
    }

    /**
     * Move a held slot from one state to another.
     *
     * @return false if the slot was not in {@code from}
     */
    public boolean transition(String symbol, SlotState from, SlotState to) {
        boolean moved = slots.replace(symbol, from, to);
        if (!moved) {
            log.warn("[{}] Slot transition {} -> {} refused (current: {})", symbol, from, to, slots.get(symbol));
        }
        return moved;
    }

    /**
     * Same as {@link #transition} without the warning, for claims expected to lose races.
     */
    public boolean tryTransition(String symbol, SlotState from, SlotState to) {
        return slots.replace(symbol, from, to);
    }

    /**
     * Release the slot only if it is held in {@code expected}.
     */
    public boolean release(String symbol, SlotState expected) {
        return slots.remove(symbol, expected);
    }

    public void release(String symbol) {
        slots.remove(symbol);
    }

    public boolean isOccupied(String symbol) {
        return slots.containsKey(symbol);
    }

    public Optional<SlotState> stateOf(String symbol) {
        return Optional.ofNullable(slots.get(symbol));
    }

    public Map<String, SlotState> snapshot() {
        return new TreeMap<>(slots);
    }

    public long count(SlotState state) {
        return slots.values().stream().filter(s -> s == state).count();
    }
}
