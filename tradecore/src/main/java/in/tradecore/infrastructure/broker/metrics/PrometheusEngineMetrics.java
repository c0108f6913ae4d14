package in.tradecore.infrastructure.broker.metrics;

import in.tradecore.domain.order.OrderPurpose;
import in.tradecore.domain.trade.ExitReason;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import io.prometheus.client.exporter.common.TextFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Duration;

/**
 * Prometheus implementation of EngineMetrics.
 *
 * Key Metrics:
 * - engine_ticks_total / engine_ticks_dropped_total{symbol}
 * - engine_loop_duration_seconds{loop} - per-loop run time
 * - engine_screening_verdicts_total{outcome, level}
 * - engine_orders_total{purpose, outcome}
 * - engine_open_positions / engine_pending_retests
 * - engine_reconciliation_discrepancies_total{type}
 *
 * Usage:
 * <pre>
 * PrometheusEngineMetrics metrics = new PrometheusEngineMetrics();
 * String text = metrics.scrape();   // Prometheus text exposition format
 * </pre>
 */
public class PrometheusEngineMetrics implements EngineMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusEngineMetrics.class);

    private final CollectorRegistry registry;

    // Market data
    private final Counter ticksIngested;
    private final Counter ticksDropped;
    private final Counter feedReconnects;
    private final Gauge feedConnected;

    // Loops
    private final Histogram loopDuration;
    private final Counter loopFailures;

    // Signals and screening
    private final Counter signals;
    private final Counter screeningVerdicts;

    // Orders
    private final Counter orders;
    private final Counter retries;

    // Positions
    private final Gauge openPositions;
    private final Gauge pendingRetests;
    private final Counter retests;
    private final Counter stopMoves;
    private final Counter positionsClosed;

    // Reconciliation and audit
    private final Counter discrepancies;
    private final Counter auditDropped;

    public PrometheusEngineMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusEngineMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.ticksIngested = Counter.build()
            .name("engine_ticks_total")
            .help("Total ticks ingested")
            .register(registry);

        this.ticksDropped = Counter.build()
            .name("engine_ticks_dropped_total")
            .help("Ticks evicted from full ring buffers")
            .labelNames("symbol")
            .register(registry);

        this.feedReconnects = Counter.build()
            .name("engine_feed_reconnects_total")
            .help("Market feed reconnect attempts")
            .register(registry);

        this.feedConnected = Gauge.build()
            .name("engine_feed_connected")
            .help("Market feed streaming status (1=streaming, 0=down)")
            .register(registry);

        this.loopDuration = Histogram.build()
            .name("engine_loop_duration_seconds")
            .help("Scheduled loop run duration in seconds")
            .labelNames("loop")
            .buckets(0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 5.0)
            .register(registry);

        this.loopFailures = Counter.build()
            .name("engine_loop_failures_total")
            .help("Scheduled loop runs that threw")
            .labelNames("loop")
            .register(registry);

        this.signals = Counter.build()
            .name("engine_signals_total")
            .help("Signals produced by generators")
            .labelNames("strategy")
            .register(registry);

        this.screeningVerdicts = Counter.build()
            .name("engine_screening_verdicts_total")
            .help("Screening verdicts by outcome and blocking level")
            .labelNames("outcome", "level")
            .register(registry);

        this.orders = Counter.build()
            .name("engine_orders_total")
            .help("Orders by purpose and outcome")
            .labelNames("purpose", "outcome")
            .register(registry);

        this.retries = Counter.build()
            .name("engine_retries_total")
            .help("Retry attempts on external calls")
            .labelNames("target", "operation")
            .register(registry);

        this.openPositions = Gauge.build()
            .name("engine_open_positions")
            .help("Open positions in the ledger")
            .register(registry);

        this.pendingRetests = Gauge.build()
            .name("engine_pending_retests")
            .help("Breakouts waiting for a retest")
            .register(registry);

        this.retests = Counter.build()
            .name("engine_retests_total")
            .help("Retest transitions by outcome")
            .labelNames("outcome")
            .register(registry);

        this.stopMoves = Counter.build()
            .name("engine_stop_moves_total")
            .help("Stop ratchet moves by kind")
            .labelNames("kind")
            .register(registry);

        this.positionsClosed = Counter.build()
            .name("engine_positions_closed_total")
            .help("Closed positions by exit reason")
            .labelNames("reason")
            .register(registry);

        this.discrepancies = Counter.build()
            .name("engine_reconciliation_discrepancies_total")
            .help("Ledger/venue discrepancies found by reconciliation")
            .labelNames("type")
            .register(registry);

        this.auditDropped = Counter.build()
            .name("engine_audit_events_dropped_total")
            .help("Audit events dropped because the queue was full")
            .register(registry);

        log.info("[PrometheusEngineMetrics] Initialized");
    }

    @Override
    public void recordTickIngested() {
        ticksIngested.inc();
    }

    @Override
    public void recordTicksDropped(String symbol, long count) {
        if (count > 0) {
            ticksDropped.labels(symbol).inc(count);
        }
    }

    @Override
    public void recordLoopRun(String loop, Duration duration) {
        loopDuration.labels(loop).observe(duration.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordLoopFailure(String loop) {
        loopFailures.labels(loop).inc();
    }

    @Override
    public void recordSignal(String strategyId) {
        signals.labels(strategyId).inc();
    }

    @Override
    public void recordScreeningVerdict(boolean passed, String blockingLevel) {
        screeningVerdicts.labels(passed ? "passed" : "blocked",
            blockingLevel != null ? blockingLevel : "none").inc();
    }

    @Override
    public void recordOrder(OrderPurpose purpose, String outcome) {
        orders.labels(purpose.name(), outcome).inc();
    }

    @Override
    public void recordRetry(String target, String operation) {
        retries.labels(target, operation).inc();
    }

    @Override
    public void recordFeedReconnect() {
        feedReconnects.inc();
    }

    @Override
    public void setFeedConnected(boolean connected) {
        feedConnected.set(connected ? 1 : 0);
    }

    @Override
    public void setOpenPositions(int count) {
        openPositions.set(count);
    }

    @Override
    public void setPendingRetests(int count) {
        pendingRetests.set(count);
    }

    @Override
    public void recordRetest(String outcome) {
        retests.labels(outcome).inc();
    }

    @Override
    public void recordStopMove(String kind) {
        stopMoves.labels(kind).inc();
    }

    @Override
    public void recordPositionClosed(ExitReason reason) {
        positionsClosed.labels(reason.name()).inc();
    }

    @Override
    public void recordReconciliationDiscrepancy(String type) {
        discrepancies.labels(type).inc();
    }

    @Override
    public void recordAuditEventDropped() {
        auditDropped.inc();
    }

    /**
     * Render all metrics in Prometheus text format (0.0.4).
     */
    public String scrape() {
        StringWriter writer = new StringWriter();
        try {
            TextFormat.write004(writer, registry.metricFamilySamples());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
