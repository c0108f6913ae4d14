package in.tradecore.service.screening.level;

import in.tradecore.domain.data.Bar;
import in.tradecore.domain.screening.LevelResult;
import in.tradecore.domain.screening.LevelSeverity;
import in.tradecore.domain.signal.Signal;
import in.tradecore.domain.trade.Position;
import in.tradecore.service.screening.MarketState;

import java.util.Arrays;
import java.util.List;

/**
 * Narrow-range bar trigger: the current bar must not be among the narrowest of the
 * recent bars. Consolidation precedes a move; trade after it, not during.
 */
public final class RangeCompressionLevel extends AbstractScreeningLevel {

    public static final String NAME = "RANGE_COMPRESSION";

    private final int lookback;
    private final int percentile;

    public RangeCompressionLevel(int lookback, int percentile) {
        super(NAME, LevelSeverity.ADVISORY);
        this.lookback = lookback;
        this.percentile = percentile;
    }

    @Override
    public LevelResult evaluate(Signal signal, MarketState state, List<Position> openPositions) {
        List<Bar> bars = state.bars();
        if (bars.size() < lookback) {
            return pass("Insufficient data for range check");
        }
        double[] ranges = new double[lookback];
        for (int i = 0; i < lookback; i++) {
            ranges[i] = bars.get(bars.size() - lookback + i).rangePct().doubleValue();
        }
        double current = ranges[lookback - 1];
        double threshold = quantile(ranges, percentile / 100.0);

        if (current <= threshold) {
            return fail(String.format("Narrow range bar (%.4f <= p%d %.4f), awaiting expansion",
                current, percentile, threshold));
        }
        return pass(String.format("Bar range %.4f above p%d %.4f", current, percentile, threshold));
    }

    /**
     * Linear-interpolated quantile.
     */
    static double quantile(double[] values, double q) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double pos = q * (sorted.length - 1);
        int lower = (int) Math.floor(pos);
        int upper = (int) Math.ceil(pos);
        if (lower == upper) return sorted[lower];
        return sorted[lower] + (pos - lower) * (sorted[upper] - sorted[lower]);
    }
}
