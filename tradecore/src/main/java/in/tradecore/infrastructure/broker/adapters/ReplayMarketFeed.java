package in.tradecore.infrastructure.broker.adapters;

import in.tradecore.domain.data.Tick;
import in.tradecore.infrastructure.broker.data.FeedDisconnectedException;
import in.tradecore.infrastructure.broker.data.MarketFeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Market feed that replays ticks from a CSV file: {@code symbol,epochMillis,price,size}.
 *
 * Lines starting with '#' and a header line are skipped; malformed lines are logged and
 * skipped. Ticks keep their recorded timestamps and are emitted one per {@code pace}.
 */
public class ReplayMarketFeed implements MarketFeed {
    private static final Logger log = LoggerFactory.getLogger(ReplayMarketFeed.class);

    private final Path file;
    private final Duration pace;

    private final List<Consumer<Tick>> tickListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<Throwable>> disconnectListeners = new CopyOnWriteArrayList<>();
    private final Set<String> subscribed = ConcurrentHashMap.newKeySet();
    private final AtomicInteger cursor = new AtomicInteger();
    private final ScheduledExecutorService emitter = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "replay-feed");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean connected = false;
    private volatile List<Tick> ticks = List.of();
    private ScheduledFuture<?> emitTask;

    public ReplayMarketFeed(Path file, Duration pace) {
        this.file = file;
        this.pace = pace;
    }

    @Override
    public String getFeedCode() {
        return "REPLAY";
    }

    @Override
    public CompletableFuture<Void> connect() {
        return CompletableFuture.runAsync(() -> {
            if (ticks.isEmpty()) {
                ticks = load(file);
            }
            connected = true;
            log.info("[REPLAY] Connected: {} ticks from {}", ticks.size(), file);
        });
    }

    List<Tick> load(Path path) {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new FeedDisconnectedException(getFeedCode(), "Cannot read replay file " + path, e);
        }
        List<Tick> parsed = new ArrayList<>();
        int lineNo = 0;
        for (String line : lines) {
            lineNo++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith("symbol")) {
                continue;
            }
            String[] parts = trimmed.split(",");
            try {
                if (parts.length < 3) {
                    throw new IllegalArgumentException("expected symbol,epochMillis,price[,size]");
                }
                long size = parts.length > 3 ? Long.parseLong(parts[3].trim()) : 0L;
                parsed.add(new Tick(parts[0].trim(), new BigDecimal(parts[2].trim()), size,
                    Instant.ofEpochMilli(Long.parseLong(parts[1].trim()))));
            } catch (IllegalArgumentException e) {
                log.warn("[REPLAY] Skipping line {}: {} ({})", lineNo, trimmed, e.getMessage());
            }
        }
        return parsed;
    }

    @Override
    public synchronized void disconnect() {
        log.info("[REPLAY] Disconnecting...");
        connected = false;
        if (emitTask != null) {
            emitTask.cancel(false);
            emitTask = null;
        }
        emitter.shutdownNow();
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public synchronized CompletableFuture<Void> subscribe(List<String> symbols) {
        if (!connected) {
            return CompletableFuture.failedFuture(
                new FeedDisconnectedException(getFeedCode(), "Subscribe while disconnected"));
        }
        subscribed.addAll(symbols);
        log.info("[REPLAY] Subscribed to {}", symbols);
        if (emitTask == null) {
            emitTask = emitter.scheduleAtFixedRate(this::emitNext, 0, Math.max(1, pace.toMillis()),
                TimeUnit.MILLISECONDS);
        }
        return CompletableFuture.completedFuture(null);
    }

    private void emitNext() {
        if (!connected) {
            return;
        }
        List<Tick> all = ticks;
        while (true) {
            int i = cursor.getAndIncrement();
            if (i >= all.size()) {
                if (i == all.size()) {
                    log.info("[REPLAY] Replay complete ({} ticks)", all.size());
                }
                return;
            }
            Tick tick = all.get(i);
            if (!subscribed.contains(tick.symbol())) {
                continue;
            }
            for (Consumer<Tick> listener : tickListeners) {
                try {
                    listener.accept(tick);
                } catch (RuntimeException e) {
                    log.warn("[REPLAY] Tick listener error: {}", e.getMessage());
                }
            }
            return;
        }
    }

    /**
     * Simulate a dropped connection; registered disconnect listeners are notified.
     */
    public void simulateDisconnect(String reason) {
        connected = false;
        FeedDisconnectedException cause = new FeedDisconnectedException(getFeedCode(), reason);
        log.warn("[REPLAY] Connection lost: {}", reason);
        for (Consumer<Throwable> listener : disconnectListeners) {
            listener.accept(cause);
        }
    }

    @Override
    public void onTick(Consumer<Tick> listener) {
        tickListeners.add(listener);
    }

    @Override
    public void onDisconnect(Consumer<Throwable> listener) {
        disconnectListeners.add(listener);
    }

    public int remaining() {
        return Math.max(0, ticks.size() - cursor.get());
    }
}
