package in.tradecore.domain.signal;

/**
 * Market behavior driving strategy choice.
 */
public enum Regime {
    RANGE_BOUND,
    TRENDING
}
