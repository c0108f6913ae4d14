package in.tradecore.application.service;

import in.tradecore.application.monitoring.AlertService;
import in.tradecore.application.port.input.EngineControl;
import in.tradecore.config.EngineConfig;
import in.tradecore.domain.common.EngineStartupException;
import in.tradecore.domain.common.EventType;
import in.tradecore.domain.data.Bar;
import in.tradecore.domain.data.HistoricalBar;
import in.tradecore.domain.monitoring.EngineSnapshot;
import in.tradecore.domain.monitoring.EngineState;
import in.tradecore.domain.signal.Signal;
import in.tradecore.infrastructure.broker.common.FeedConnectionManager;
import in.tradecore.infrastructure.broker.data.HistoricalBarSource;
import in.tradecore.infrastructure.broker.metrics.EngineMetrics;
import in.tradecore.service.candle.CandleAggregator;
import in.tradecore.service.candle.SessionClock;
import in.tradecore.service.core.AuditEventBus;
import in.tradecore.service.execution.ExecutionGate;
import in.tradecore.service.position.PositionLedger;
import in.tradecore.service.position.PositionMonitor;
import in.tradecore.service.reconcile.ReconciliationService;
import in.tradecore.service.retest.RetestWaitQueue;
import in.tradecore.service.screening.ScreeningPipeline;
import in.tradecore.service.strategy.StrategyRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns the engine loops and their startup/shutdown order.
 *
 * Loops, each on its own single-thread scheduler so a slow loop never delays another:
 * - monitor (fastest): position exits, stop ratchet, retest fills
 * - candles: bar rebuild from buffered ticks, paused while the feed is not streaming
 * - strategy (slow): routing, screening, entries
 * - reconcile (slowest): ledger vs venue
 *
 * Entry and exit orders run on two separate executors so a hung entry never delays an
 * exit. Shutdown drains entries first, then stops the monitor, then drains exits so exits
 * already sent are seen through.
 */
public final class EngineSupervisor implements EngineControl {
    private static final Logger log = LoggerFactory.getLogger(EngineSupervisor.class);

    static final String LOOP_MONITOR = "monitor";
    static final String LOOP_CANDLES = "candles";
    static final String LOOP_STRATEGY = "strategy";
    static final String LOOP_RECONCILE = "reconcile";

    private static final Duration ORDER_DRAIN_TIMEOUT = Duration.ofSeconds(30);

    private final EngineConfig config;
    private final SessionClock sessionClock;
    private final FeedConnectionManager feedManager;
    private final CandleAggregator candles;
    private final HistoricalBarSource historicalSource;
    private final StrategyRouter router;
    private final SignalProcessor signalProcessor;
    private final PositionMonitor positionMonitor;
    private final ReconciliationService reconciliation;
    private final PositionLedger ledger;
    private final RetestWaitQueue retests;
    private final ScreeningPipeline pipeline;
    private final ExecutionGate gate;
    private final AuditEventBus audit;
    private final AlertService alertService;
    private final EngineMetrics metrics;
    private final ExecutorService entryExecutor;
    private final ExecutorService exitExecutor;

    private final Map<String, Instant> lastLoopRuns = new ConcurrentHashMap<>();
    private volatile EngineState state = EngineState.STOPPED;
    private int consecutiveStrategyErrors = 0;

    private ScheduledExecutorService monitorScheduler;
    private ScheduledExecutorService candleScheduler;
    private ScheduledExecutorService strategyScheduler;
    private ScheduledExecutorService reconcileScheduler;

    private EngineSupervisor(Builder b) {
        this.config = b.config;
        this.sessionClock = b.sessionClock;
        this.feedManager = b.feedManager;
        this.candles = b.candles;
        this.historicalSource = b.historicalSource;
        this.router = b.router;
        this.signalProcessor = b.signalProcessor;
        this.positionMonitor = b.positionMonitor;
        this.reconciliation = b.reconciliation;
        this.ledger = b.ledger;
        this.retests = b.retests;
        this.pipeline = b.pipeline;
        this.gate = b.gate;
        this.audit = b.audit;
        this.alertService = b.alertService;
        this.metrics = b.metrics;
        this.entryExecutor = b.entryExecutor;
        this.exitExecutor = b.exitExecutor;
    }

    // ═══ Lifecycle ═══

    @Override
    public synchronized void start() {
        if (state != EngineState.STOPPED) {
            log.info("Engine already {}", state);
            return;
        }
        state = EngineState.STARTING;
        log.info("Starting engine: mode={}, symbols={}", config.tradingMode(), config.symbols());

        try {
            validateStartup();
            audit.start();
            emitState(EngineState.STARTING);
            loadHistory();
            connectFeed();
            scheduleLoops();
        } catch (RuntimeException e) {
            log.error("❌ Engine failed to start: {}", e.getMessage());
            shutdownSchedulers();
            feedManager.stop();
            audit.stop();
            state = EngineState.STOPPED;
            throw e instanceof EngineStartupException
                ? e
                : new EngineStartupException("Engine startup failed: " + e.getMessage(), e);
        }

        state = EngineState.RUNNING;
        emitState(EngineState.RUNNING);
        log.info("✅ Engine RUNNING ({} symbols)", config.symbols().size());
    }

    private void validateStartup() {
        List<String> problems = config.validate();
        if (!problems.isEmpty()) {
            throw new EngineStartupException("Invalid configuration: " + String.join("; ", problems));
        }
        List<String> resolvable = config.symbols().stream()
            .filter(s -> s != null && !s.isBlank())
            .toList();
        if (resolvable.isEmpty()) {
            throw new EngineStartupException("No tradable instruments resolvable from configuration");
        }
    }

    void loadHistory() {
        if (historicalSource == null) {
            log.info("No historical bar source configured, bars will build from live ticks only");
            return;
        }
        int interval = config.candles().intervalMinutes();
        int count = config.candles().historicalBars();
        for (String symbol : config.symbols()) {
            try {
                List<HistoricalBar> fetched = historicalSource.fetchBars(symbol, interval, count);
                List<Bar> bars = fetched.stream().map(h -> h.toBar(sessionClock.zone())).toList();
                int merged = candles.mergeHistorical(symbol, bars);
                log.info("[{}] Loaded {} historical bars", symbol, merged);
            } catch (RuntimeException e) {
                log.warn("[{}] Historical bars unavailable, continuing with live data: {}", symbol, e.getMessage());
            }
        }
    }

    private void connectFeed() {
        long timeoutMillis = config.retry().feedTimeoutMillis();
        try {
            feedManager.start(config.symbols(), candles::ingest).get(timeoutMillis, TimeUnit.MILLISECONDS);
            log.info("Market feed streaming");
        } catch (TimeoutException e) {
            log.warn("Market feed not streaming after {}ms, continuing; connector keeps retrying", timeoutMillis);
        } catch (ExecutionException e) {
            log.warn("Market feed connect failed, connector keeps retrying: {}", e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineStartupException("Interrupted while connecting market feed", e);
        }
    }

    private void scheduleLoops() {
        var schedule = config.schedule();
        orderExecutorsCheck();
        monitorScheduler = newScheduler("position-monitor");
        candleScheduler = newScheduler("candle-builder");
        strategyScheduler = newScheduler("strategy-loop");
        reconcileScheduler = newScheduler("reconciler");

        monitorScheduler.scheduleWithFixedDelay(() -> runLoop(LOOP_MONITOR, positionMonitor::runCycle),
            0, schedule.positionMonitorMillis(), TimeUnit.MILLISECONDS);
        candleScheduler.scheduleWithFixedDelay(() -> runLoop(LOOP_CANDLES, this::candleCycle),
            0, schedule.candleRebuildMillis(), TimeUnit.MILLISECONDS);
        strategyScheduler.scheduleWithFixedDelay(() -> runLoop(LOOP_STRATEGY, this::strategyCycle),
            schedule.strategyMillis(), schedule.strategyMillis(), TimeUnit.MILLISECONDS);
        reconcileScheduler.scheduleWithFixedDelay(() -> runLoop(LOOP_RECONCILE, reconciliation::reconcile),
            schedule.reconciliationMillis(), schedule.reconciliationMillis(), TimeUnit.MILLISECONDS);

        log.info("Loops scheduled: monitor={}ms, candles={}ms, strategy={}ms, reconcile={}ms",
            schedule.positionMonitorMillis(), schedule.candleRebuildMillis(),
            schedule.strategyMillis(), schedule.reconciliationMillis());
    }

    private void orderExecutorsCheck() {
        if (entryExecutor.isShutdown() || exitExecutor.isShutdown()) {
            throw new EngineStartupException("Order executors already shut down; build a new engine to restart");
        }
    }

    @Override
    public synchronized void stop() {
        if (state != EngineState.RUNNING) {
            log.info("Engine not running ({}), nothing to stop", state);
            return;
        }
        state = EngineState.STOPPING;
        emitState(EngineState.STOPPING);
        log.info("Stopping engine...");

        // no new entries, no new bars
        shutdown(strategyScheduler, "strategy-loop");
        shutdown(reconcileScheduler, "reconciler");
        shutdown(candleScheduler, "candle-builder");

        // entries already sent run to completion; retest fills from here on are refused
        drain(entryExecutor, "entry orders");
        shutdown(monitorScheduler, "position-monitor");
        drain(exitExecutor, "exit orders");
        feedManager.stop();

        if (ledger.size() > 0) {
            log.warn("Engine stopped with {} open position(s) still at the venue", ledger.size());
        }
        state = EngineState.STOPPED;
        emitState(EngineState.STOPPED);
        audit.stop();
        log.info("Engine STOPPED");
    }

    private static void drain(ExecutorService executor, String name) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(ORDER_DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} still busy after {}s, abandoning wait", name, ORDER_DRAIN_TIMEOUT.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // ═══ Loops ═══

    void candleCycle() {
        if (!feedManager.isStreaming()) {
            log.debug("Feed not streaming, bar rebuild paused");
            metrics.setFeedConnected(false);
            return;
        }
        metrics.setFeedConnected(true);
        candles.rebuildAll();
    }

    void strategyCycle() {
        try {
            List<Signal> signals = router.route(config.symbols());
            if (!signals.isEmpty()) {
                int accepted = signalProcessor.process(signals);
                log.info("Strategy cycle: {} signal(s), {} accepted", signals.size(), accepted);
            }
            consecutiveStrategyErrors = 0;
        } catch (RuntimeException e) {
            consecutiveStrategyErrors++;
            int max = config.schedule().maxConsecutiveStrategyErrors();
            if (consecutiveStrategyErrors == max) {
                alertService.sendHighAlert("STRATEGY_LOOP_FAILING",
                    "Strategy loop failed " + max + " times in a row: " + e.getMessage());
            }
            throw e;
        }
    }

    private void runLoop(String loop, Runnable task) {
        long start = System.nanoTime();
        try {
            task.run();
            lastLoopRuns.put(loop, sessionClock.now());
            metrics.recordLoopRun(loop, Duration.ofNanos(System.nanoTime() - start));
        } catch (RuntimeException e) {
            metrics.recordLoopFailure(loop);
            log.error("Loop {} failed: {}", loop, e.getMessage(), e);
        }
    }

    private static ScheduledExecutorService newScheduler(String name) {
        return Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, name));
    }

    private void shutdownSchedulers() {
        shutdown(strategyScheduler, "strategy-loop");
        shutdown(reconcileScheduler, "reconciler");
        shutdown(candleScheduler, "candle-builder");
        shutdown(monitorScheduler, "position-monitor");
    }

    private static void shutdown(ScheduledExecutorService scheduler, String name) {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("{} did not stop in 5s, forcing", name);
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void emitState(EngineState newState) {
        audit.emit(EventType.ENGINE_STATE, null, Map.of("state", newState.name(),
            "tradingMode", config.tradingMode().name()));
    }

    // ═══ Status ═══

    @Override
    public EngineSnapshot status() {
        String blockReason = gate.blockReason();
        return new EngineSnapshot(
            state,
            config.tradingMode().name(),
            feedManager.isStreaming(),
            blockReason != null,
            blockReason,
            ledger.getAll(),
            retests.snapshot(),
            new TreeMap<>(lastLoopRuns),
            pipeline.getScreenedCount(),
            pipeline.getBlockedCount(),
            audit.getDroppedCount(),
            reconciliation.getLastReport(),
            sessionClock.now()
        );
    }

    public EngineState getState() {
        return state;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private EngineConfig config;
        private SessionClock sessionClock;
        private FeedConnectionManager feedManager;
        private CandleAggregator candles;
        private HistoricalBarSource historicalSource;
        private StrategyRouter router;
        private SignalProcessor signalProcessor;
        private PositionMonitor positionMonitor;
        private ReconciliationService reconciliation;
        private PositionLedger ledger;
        private RetestWaitQueue retests;
        private ScreeningPipeline pipeline;
        private ExecutionGate gate;
        private AuditEventBus audit;
        private AlertService alertService;
        private EngineMetrics metrics;
        private ExecutorService entryExecutor;
        private ExecutorService exitExecutor;

        public Builder config(EngineConfig config) { this.config = config; return this; }
        public Builder sessionClock(SessionClock sessionClock) { this.sessionClock = sessionClock; return this; }
        public Builder feedManager(FeedConnectionManager feedManager) { this.feedManager = feedManager; return this; }
        public Builder candles(CandleAggregator candles) { this.candles = candles; return this; }
        public Builder historicalSource(HistoricalBarSource source) { this.historicalSource = source; return this; }
        public Builder router(StrategyRouter router) { this.router = router; return this; }
        public Builder signalProcessor(SignalProcessor processor) { this.signalProcessor = processor; return this; }
        public Builder positionMonitor(PositionMonitor monitor) { this.positionMonitor = monitor; return this; }
        public Builder reconciliation(ReconciliationService service) { this.reconciliation = service; return this; }
        public Builder ledger(PositionLedger ledger) { this.ledger = ledger; return this; }
        public Builder retests(RetestWaitQueue retests) { this.retests = retests; return this; }
        public Builder pipeline(ScreeningPipeline pipeline) { this.pipeline = pipeline; return this; }
        public Builder gate(ExecutionGate gate) { this.gate = gate; return this; }
        public Builder audit(AuditEventBus audit) { this.audit = audit; return this; }
        public Builder alertService(AlertService alertService) { this.alertService = alertService; return this; }
        public Builder metrics(EngineMetrics metrics) { this.metrics = metrics; return this; }
        public Builder entryExecutor(ExecutorService executor) { this.entryExecutor = executor; return this; }
        public Builder exitExecutor(ExecutorService executor) { this.exitExecutor = executor; return this; }

        public EngineSupervisor build() {
            if (config == null || sessionClock == null || feedManager == null || candles == null
                || router == null || signalProcessor == null || positionMonitor == null
                || reconciliation == null || ledger == null || retests == null || pipeline == null
                || gate == null || audit == null || alertService == null || metrics == null
                || entryExecutor == null || exitExecutor == null) {
                throw new IllegalStateException("EngineSupervisor is missing a required component");
            }
            if (entryExecutor == exitExecutor) {
                throw new IllegalStateException("Exit orders need an executor of their own");
            }
            return new EngineSupervisor(this);
        }
    }
}
