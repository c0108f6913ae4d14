package in.tradecore.domain.monitoring;

import in.tradecore.domain.trade.PendingRetest;
import in.tradecore.domain.trade.Position;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the engine, returned by the control surface.
 *
 * @param lastLoopRuns last completed run per loop name (monitor, candles, strategy, reconcile)
 * @param lastReconciliation most recent reconciliation outcome, null before the first run
 */
public record EngineSnapshot(
    EngineState state,
    String tradingMode,
    boolean feedConnected,
    boolean entriesSuspended,
    String suspensionReason,
    List<Position> openPositions,
    List<PendingRetest> pendingRetests,
    Map<String, Instant> lastLoopRuns,
    long signalsScreened,
    long signalsBlocked,
    long auditEventsDropped,
    ReconciliationReport lastReconciliation,
    Instant capturedAt
) {
}
