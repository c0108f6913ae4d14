package in.tradecore.domain.trade;

/**
 * Retest lifecycle: NONE -> PENDING -> FILLED | EXPIRED.
 */
public enum RetestState {
    NONE,
    PENDING,
    FILLED,
    EXPIRED
}
