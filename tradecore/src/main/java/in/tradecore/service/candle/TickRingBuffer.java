package in.tradecore.service.candle;

import in.tradecore.domain.data.Tick;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-capacity tick buffer. When full, the oldest tick is overwritten.
 *
 * Not thread-safe; the owning series guards it.
 */
final class TickRingBuffer {

    private final Tick[] ticks;
    private int head;      // index of oldest element
    private int size;
    private long dropped;

    TickRingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.ticks = new Tick[capacity];
    }

    /**
     * @return true if an older tick was evicted to make room
     */
    boolean add(Tick tick) {
        int capacity = ticks.length;
        if (size < capacity) {
            ticks[(head + size) % capacity] = tick;
            size++;
            return false;
        }
        ticks[head] = tick;
        head = (head + 1) % capacity;
        dropped++;
        return true;
    }

    /**
     * Oldest-first copy of the buffered ticks.
     */
    List<Tick> snapshot() {
        List<Tick> copy = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            copy.add(ticks[(head + i) % ticks.length]);
        }
        return copy;
    }

    int size() {
        return size;
    }

    int capacity() {
        return ticks.length;
    }

    long droppedTotal() {
        return dropped;
    }
}
