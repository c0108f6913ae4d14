package in.tradecore.domain.common;

/**
 * Audit event types emitted by the engine.
 */
public enum EventType {
    SIGNAL,
    SCREENING_VERDICT,
    RETEST_PENDING,
    RETEST_FILLED,
    RETEST_EXPIRED,
    ORDER_SUBMITTED,
    ORDER_FAILED,
    POSITION_OPENED,
    STOP_MOVED,
    POSITION_CLOSED,
    RECONCILIATION_DISCREPANCY,
    ENGINE_STATE
}
