package in.tradecore.infrastructure.broker.common;

import in.tradecore.domain.data.Tick;
import in.tradecore.infrastructure.broker.data.FeedDisconnectedException;
import in.tradecore.infrastructure.broker.data.FeedTimeoutException;
import in.tradecore.infrastructure.broker.data.MarketFeed;
import in.tradecore.infrastructure.broker.metrics.EngineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Keeps the market feed connected while the engine runs.
 *
 * - Reconnects with the feed {@link RetryPolicy} (capped backoff with jitter, unlimited attempts)
 * - Replays subscriptions in sorted symbol order after every (re)connect
 * - Forwards ticks only while streaming, i.e. after the replay has completed
 *
 * Connection work runs on a dedicated single thread, never on a loop thread.
 */
public final class FeedConnectionManager {
    private static final Logger log = LoggerFactory.getLogger(FeedConnectionManager.class);

    private final MarketFeed feed;
    private final RetryPolicy policy;
    private final Duration timeout;
    private final Sleeper sleeper;
    private final EngineMetrics metrics;

    private final TreeSet<String> subscriptions = new TreeSet<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean streaming = new AtomicBoolean(false);
    private final AtomicBoolean reconnecting = new AtomicBoolean(false);

    private ExecutorService connector;
    private volatile CompletableFuture<Void> firstStream = new CompletableFuture<>();

    public FeedConnectionManager(MarketFeed feed, RetryPolicy policy, Duration timeout,
                                 Sleeper sleeper, EngineMetrics metrics) {
        if (!policy.isUnlimited()) {
            log.warn("[{}] Feed retry policy is bounded ({} attempts); feed may stay down",
                feed.getFeedCode(), policy.getMaxAttempts());
        }
        this.feed = feed;
        this.policy = policy;
        this.timeout = timeout;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    /**
     * Start connecting in the background.
     *
     * @param symbols Symbols to subscribe (replayed on every reconnect)
     * @param tickSink Receives ticks once streaming
     * @return Future completing when the first subscription replay succeeds
     */
    public synchronized CompletableFuture<Void> start(Collection<String> symbols, Consumer<Tick> tickSink) {
        if (!running.compareAndSet(false, true)) {
            return firstStream;
        }
        synchronized (subscriptions) {
            subscriptions.clear();
            subscriptions.addAll(symbols);
        }
        firstStream = new CompletableFuture<>();
        connector = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "feed-connector");
            t.setDaemon(true);
            return t;
        });

        feed.onTick(tick -> {
            if (streaming.get()) {
                tickSink.accept(tick);
            }
        });
        feed.onDisconnect(this::handleDisconnect);

        scheduleReconnect("initial connect");
        return firstStream;
    }

    /**
     * Called by the feed on unexpected connection loss.
     */
    void handleDisconnect(Throwable cause) {
        if (!running.get()) {
            return;
        }
        if (streaming.compareAndSet(true, false)) {
            metrics.setFeedConnected(false);
            log.warn("[{}] Feed disconnected: {}", feed.getFeedCode(),
                cause != null ? cause.getMessage() : "unknown cause");
        }
        scheduleReconnect("disconnect");
    }

    private void scheduleReconnect(String reason) {
        if (!reconnecting.compareAndSet(false, true)) {
            return;
        }
        log.info("[{}] Scheduling feed connect ({})", feed.getFeedCode(), reason);
        connector.execute(this::connectLoop);
    }

    private void connectLoop() {
        int attempt = 0;
        boolean connected = false;
        try {
            while (running.get()) {
                try {
                    await(feed.connect(), "connect");
                    resubscribe();
                    streaming.set(true);
                    if (!feed.isConnected()) {
                        streaming.set(false);
                        throw new FeedDisconnectedException(feed.getFeedCode(),
                            "Connection lost during subscription replay");
                    }
                    metrics.setFeedConnected(true);
                    log.info("[{}] ✅ Feed streaming ({} symbols, attempt {})",
                        feed.getFeedCode(), subscriptionCount(), attempt + 1);
                    firstStream.complete(null);
                    connected = true;
                    return;
                } catch (RuntimeException e) {
                    attempt++;
                    metrics.recordFeedReconnect();
                    if (!policy.shouldRetry(attempt)) {
                        log.error("[{}] Feed connect gave up after {} attempts: {}",
                            feed.getFeedCode(), attempt, e.getMessage());
                        return;
                    }
                    Duration delay = policy.delayForAttempt(attempt);
                    log.warn("[{}] Feed connect attempt {} failed, retrying in {}ms: {}",
                        feed.getFeedCode(), attempt, delay.toMillis(), e.getMessage());
                    sleeper.sleep(delay);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("[{}] Feed connect loop interrupted", feed.getFeedCode());
        } finally {
            reconnecting.set(false);
            // a disconnect that raced the end of this loop was not scheduled
            if (connected && running.get() && !streaming.get()) {
                scheduleReconnect("disconnect during replay");
            }
        }
    }

    /**
     * Replay all subscriptions in sorted order. Runs before streaming resumes.
     */
    private void resubscribe() {
        List<String> ordered = orderedSubscriptions();
        log.info("[{}] Replaying {} subscriptions", feed.getFeedCode(), ordered.size());
        await(feed.subscribe(ordered), "subscribe");
    }

    private void await(CompletableFuture<Void> future, String operation) {
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new FeedTimeoutException(feed.getFeedCode(), operation, timeout);
        } catch (ExecutionException e) {
            Throwable cause = ErrorClassifier.unwrap(e);
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException(cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("[" + feed.getFeedCode() + "] " + operation + " interrupted", e);
        }
    }

    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        streaming.set(false);
        metrics.setFeedConnected(false);
        if (connector != null) {
            connector.shutdownNow();
        }
        try {
            feed.disconnect();
        } catch (RuntimeException e) {
            log.warn("[{}] Error during feed disconnect: {}", feed.getFeedCode(), e.getMessage());
        }
        log.info("[{}] Feed connection manager stopped", feed.getFeedCode());
    }

    public List<String> orderedSubscriptions() {
        synchronized (subscriptions) {
            return new ArrayList<>(subscriptions);
        }
    }

    private int subscriptionCount() {
        synchronized (subscriptions) {
            return subscriptions.size();
        }
    }

    /**
     * True once connected and subscriptions replayed.
     */
    public boolean isStreaming() {
        return streaming.get() && feed.isConnected();
    }

    public boolean isRunning() {
        return running.get();
    }
}
