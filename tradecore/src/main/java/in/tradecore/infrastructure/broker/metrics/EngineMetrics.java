package in.tradecore.infrastructure.broker.metrics;

import in.tradecore.domain.order.OrderPurpose;
import in.tradecore.domain.trade.ExitReason;

import java.time.Duration;

/**
 * Engine metrics interface for monitoring and alerting.
 *
 * Key metrics:
 * - Tick ingestion and ring-buffer drops
 * - Loop durations and failures per loop
 * - Screening pass/block counts by blocking level
 * - Order outcomes and retries per external target
 * - Open positions and pending retests
 * - Reconciliation discrepancies
 */
public interface EngineMetrics {

    void recordTickIngested();

    /**
     * Record ticks evicted from a full per-symbol ring buffer.
     */
    void recordTicksDropped(String symbol, long count);

    /**
     * Record one completed run of a scheduled loop.
     *
     * @param loop Loop name (monitor, candles, strategy, reconcile)
     * @param duration Run duration
     */
    void recordLoopRun(String loop, Duration duration);

    void recordLoopFailure(String loop);

    void recordSignal(String strategyId);

    /**
     * @param blockingLevel Level that blocked, or null when passed
     */
    void recordScreeningVerdict(boolean passed, String blockingLevel);

    /**
     * @param outcome FILLED, REJECTED, FAILED, TIMEOUT, AUTH_FAILED
     */
    void recordOrder(OrderPurpose purpose, String outcome);

    void recordRetry(String target, String operation);

    void recordFeedReconnect();

    void setFeedConnected(boolean connected);

    void setOpenPositions(int count);

    void setPendingRetests(int count);

    /**
     * @param outcome PENDING, FILLED, EXPIRED
     */
    void recordRetest(String outcome);

    /**
     * @param kind BREAKEVEN or TRAIL
     */
    void recordStopMove(String kind);

    void recordPositionClosed(ExitReason reason);

    /**
     * @param type PHANTOM_LOCAL, UNOWNED_VENUE or QUANTITY_MISMATCH
     */
    void recordReconciliationDiscrepancy(String type);

    void recordAuditEventDropped();
}
