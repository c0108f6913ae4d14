package in.tradecore.service.candle;

import in.tradecore.domain.data.Bar;
import in.tradecore.domain.data.Tick;
import in.tradecore.infrastructure.broker.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Candle Aggregator - Build fixed-interval bars per symbol from the live tick stream.
 *
 * Pattern: ticks land in a bounded per-symbol ring buffer; on its own schedule the
 * aggregator recomputes every bucket present in the buffer (open=first, high=max, low=min,
 * close=last, volume=sum) and upserts the result into the symbol's bar sequence.
 * Recomputation overwrites, so repeated rebuilds are harmless.
 *
 * Data-loss policy: when the ring buffer is full the oldest tick is dropped and counted.
 * After a drop, the earliest bucket in the buffer is incomplete and does not overwrite a
 * bar that was already built for it.
 *
 * Alignment: buckets align from session open in the exchange zone (see {@link SessionClock}).
 */
public final class CandleAggregator {
    private static final Logger log = LoggerFactory.getLogger(CandleAggregator.class);

    private final SessionClock sessionClock;
    private final int intervalMinutes;
    private final int bufferCapacity;
    private final int maxBars;
    private final EngineMetrics metrics;

    private final Map<String, SymbolSeries> series = new ConcurrentHashMap<>();

    public CandleAggregator(SessionClock sessionClock, int intervalMinutes, int bufferCapacity,
                            int maxBars, EngineMetrics metrics) {
        this.sessionClock = sessionClock;
        this.intervalMinutes = intervalMinutes;
        this.bufferCapacity = bufferCapacity;
        this.maxBars = maxBars;
        this.metrics = metrics;
    }

    /**
     * Buffer a tick. Thread-safe; holds only the symbol's lock for a constant-time append.
     * Consecutive duplicate ticks are ignored.
     */
    public void ingest(Tick tick) {
        SymbolSeries s = seriesFor(tick.symbol());
        boolean evicted;
        s.lock.lock();
        try {
            if (tick.equals(s.lastTick)) {
                return;
            }
            s.lastTick = tick;
            evicted = s.ticks.add(tick);
        } finally {
            s.lock.unlock();
        }
        metrics.recordTickIngested();
        if (evicted) {
            metrics.recordTicksDropped(tick.symbol(), 1);
        }
    }

    /**
     * Recompute bars for every symbol.
     *
     * @return number of bars written
     */
    public int rebuildAll() {
        int written = 0;
        for (String symbol : series.keySet()) {
            written += rebuild(symbol);
        }
        return written;
    }

    /**
     * Recompute bars for one symbol from its buffered ticks.
     * Ticks are copied under the lock and folded outside it.
     *
     * @return number of bars written
     */
    public int rebuild(String symbol) {
        SymbolSeries s = series.get(symbol);
        if (s == null) {
            return 0;
        }

        List<Tick> ticks;
        boolean hadDrops;
        s.lock.lock();
        try {
            ticks = s.ticks.snapshot();
            hadDrops = s.ticks.droppedTotal() > 0;
        } finally {
            s.lock.unlock();
        }
        if (ticks.isEmpty()) {
            return 0;
        }

        TreeMap<Instant, Bar> built = fold(symbol, ticks);
        Instant earliest = built.firstKey();

        int written = 0;
        s.lock.lock();
        try {
            for (Map.Entry<Instant, Bar> entry : built.entrySet()) {
                if (hadDrops && entry.getKey().equals(earliest) && s.bars.containsKey(earliest)) {
                    continue;
                }
                s.bars.put(entry.getKey(), entry.getValue());
                written++;
            }
            trim(s);
        } finally {
            s.lock.unlock();
        }
        log.debug("Rebuilt {} bars for {} from {} ticks", written, symbol, ticks.size());
        return written;
    }

    TreeMap<Instant, Bar> fold(String symbol, List<Tick> ticks) {
        List<Tick> ordered = new ArrayList<>(ticks);
        ordered.sort(Comparator.comparing(Tick::timestamp));

        TreeMap<Instant, List<Tick>> buckets = new TreeMap<>();
        for (Tick tick : ordered) {
            Instant bucket = sessionClock.floorToInterval(tick.timestamp(), intervalMinutes);
            buckets.computeIfAbsent(bucket, k -> new ArrayList<>()).add(tick);
        }

        TreeMap<Instant, Bar> bars = new TreeMap<>();
        for (Map.Entry<Instant, List<Tick>> entry : buckets.entrySet()) {
            List<Tick> bucketTicks = entry.getValue();
            BigDecimal open = bucketTicks.get(0).price();
            BigDecimal close = bucketTicks.get(bucketTicks.size() - 1).price();
            BigDecimal high = bucketTicks.stream()
                .map(Tick::price)
                .max(BigDecimal::compareTo)
                .orElse(open);
            BigDecimal low = bucketTicks.stream()
                .map(Tick::price)
                .min(BigDecimal::compareTo)
                .orElse(open);
            long volume = bucketTicks.stream()
                .mapToLong(Tick::size)
                .sum();
            bars.put(entry.getKey(), new Bar(symbol, entry.getKey(), open, high, low, close, volume));
        }
        return bars;
    }

    /**
     * Merge historical bars into the symbol's sequence. Keyed by interval start; a later write
     * for the same start replaces the earlier one, so merging the same bars twice is a no-op.
     * Bars must already be normalized to instants in the exchange zone.
     *
     * @return number of bars merged
     */
    public int mergeHistorical(String symbol, List<Bar> historical) {
        SymbolSeries s = seriesFor(symbol);
        int merged = 0;
        s.lock.lock();
        try {
            for (Bar bar : historical) {
                if (!symbol.equals(bar.symbol())) {
                    log.warn("Skipping historical bar for {} while merging {}", bar.symbol(), symbol);
                    continue;
                }
                Instant key = sessionClock.floorToInterval(bar.start(), intervalMinutes);
                s.bars.put(key, key.equals(bar.start()) ? bar
                    : new Bar(symbol, key, bar.open(), bar.high(), bar.low(), bar.close(), bar.volume()));
                merged++;
            }
            trim(s);
        } finally {
            s.lock.unlock();
        }
        log.info("Merged {} historical bars for {}", merged, symbol);
        return merged;
    }

    /**
     * Ordered bar sequence for a symbol (copy).
     */
    public List<Bar> snapshot(String symbol) {
        SymbolSeries s = series.get(symbol);
        if (s == null) {
            return List.of();
        }
        s.lock.lock();
        try {
            return new ArrayList<>(s.bars.values());
        } finally {
            s.lock.unlock();
        }
    }

    /**
     * Latest traded price seen for a symbol.
     */
    public Optional<BigDecimal> latestPrice(String symbol) {
        SymbolSeries s = series.get(symbol);
        if (s == null) {
            return Optional.empty();
        }
        s.lock.lock();
        try {
            return s.lastTick == null ? Optional.empty() : Optional.of(s.lastTick.price());
        } finally {
            s.lock.unlock();
        }
    }

    public long droppedTicks(String symbol) {
        SymbolSeries s = series.get(symbol);
        if (s == null) {
            return 0;
        }
        s.lock.lock();
        try {
            return s.ticks.droppedTotal();
        } finally {
            s.lock.unlock();
        }
    }

    public Set<String> symbols() {
        return new TreeSet<>(series.keySet());
    }

    private SymbolSeries seriesFor(String symbol) {
        return series.computeIfAbsent(symbol, k -> new SymbolSeries(bufferCapacity));
    }

    private void trim(SymbolSeries s) {
        while (s.bars.size() > maxBars) {
            s.bars.pollFirstEntry();
        }
    }

    /**
     * Per-symbol state guarded by its own lock.
     */
    private static final class SymbolSeries {
        final ReentrantLock lock = new ReentrantLock();
        final TickRingBuffer ticks;
        final TreeMap<Instant, Bar> bars = new TreeMap<>();
        Tick lastTick;

        SymbolSeries(int capacity) {
            this.ticks = new TickRingBuffer(capacity);
        }
    }
}
