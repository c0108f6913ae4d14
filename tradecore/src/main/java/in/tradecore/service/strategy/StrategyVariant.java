package in.tradecore.service.strategy;

import in.tradecore.domain.signal.Regime;

/**
 * Fixed set of strategy variants, selected by regime. Exactly one runs per symbol per cycle.
 */
public enum StrategyVariant {
    MEAN_REVERSION,
    BREAKOUT;

    public static StrategyVariant forRegime(Regime regime) {
        return switch (regime) {
            case RANGE_BOUND -> MEAN_REVERSION;
            case TRENDING -> BREAKOUT;
        };
    }
}
