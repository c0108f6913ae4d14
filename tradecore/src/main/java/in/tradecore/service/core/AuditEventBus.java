package in.tradecore.service.core;

import in.tradecore.application.port.output.AuditSink;
import in.tradecore.domain.common.AuditEvent;
import in.tradecore.domain.common.EventType;
import in.tradecore.infrastructure.broker.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fire-and-forget audit channel.
 *
 * Engine loops call {@link #emit}; events go into a bounded queue and a daemon thread
 * drains them into the {@link AuditSink}. A full queue drops the event and counts the drop;
 * emit never blocks.
 */
public final class AuditEventBus {
    private static final Logger log = LoggerFactory.getLogger(AuditEventBus.class);

    private final AuditSink sink;
    private final BlockingQueue<AuditEvent> queue;
    private final Clock clock;
    private final EngineMetrics metrics;
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong published = new AtomicLong();

    private volatile boolean running;
    private Thread drainThread;

    public AuditEventBus(AuditSink sink, int capacity, Clock clock, EngineMetrics metrics) {
        this.sink = sink;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.clock = clock;
        this.metrics = metrics;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        drainThread = new Thread(this::drainLoop, "audit-drain");
        drainThread.setDaemon(true);
        drainThread.start();
        log.info("Audit event bus started (capacity {})", queue.remainingCapacity() + queue.size());
    }

    /**
     * Queue an event. Never blocks.
     *
     * @return false if the event was dropped
     */
    public boolean emit(EventType type, String symbol, Map<String, Object> payload) {
        AuditEvent event = AuditEvent.of(type, symbol, clock.instant(), payload);
        if (queue.offer(event)) {
            return true;
        }
        long total = dropped.incrementAndGet();
        metrics.recordAuditEventDropped();
        if (total == 1 || total % 1000 == 0) {
            log.warn("Audit queue full, dropped {} events so far (latest: {} {})", total, type, symbol);
        }
        return false;
    }

    private void drainLoop() {
        while (running || !queue.isEmpty()) {
            try {
                AuditEvent event = queue.poll(200, TimeUnit.MILLISECONDS);
                if (event != null) {
                    deliver(event);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        // flush what is left after interrupt
        AuditEvent event;
        while ((event = queue.poll()) != null) {
            deliver(event);
        }
    }

    private void deliver(AuditEvent event) {
        try {
            sink.write(event);
            published.incrementAndGet();
        } catch (RuntimeException e) {
            log.warn("Audit sink failed for {} {}: {}", event.type(), event.symbol(), e.getMessage());
        }
    }

    /**
     * Stop the drain thread after flushing queued events.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        try {
            drainThread.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (drainThread.isAlive()) {
            drainThread.interrupt();
        }
        log.info("Audit event bus stopped (published {}, dropped {})", published.get(), dropped.get());
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public long getPublishedCount() {
        return published.get();
    }

    public int getQueueDepth() {
        return queue.size();
    }
}
