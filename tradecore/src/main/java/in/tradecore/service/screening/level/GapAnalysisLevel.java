package in.tradecore.service.screening.level;

import in.tradecore.domain.data.Bar;
import in.tradecore.domain.screening.LevelResult;
import in.tradecore.domain.screening.LevelSeverity;
import in.tradecore.domain.signal.Signal;
import in.tradecore.domain.trade.Direction;
import in.tradecore.domain.trade.Position;
import in.tradecore.service.screening.MarketState;

import java.math.BigDecimal;
import java.util.List;

/**
 * Unfilled opposing gaps near the entry act as a wall: an unfilled gap-down just above a
 * long entry, or an unfilled gap-up just below a short entry, blocks the trade.
 */
public final class GapAnalysisLevel extends AbstractScreeningLevel {

    public static final String NAME = "GAP_ANALYSIS";

    private static final int SCAN_BARS = 20;
    private static final double NEAR_PERCENT = 1.0;

    private final double minGapPercent;

    public GapAnalysisLevel(double minGapPercent) {
        super(NAME, LevelSeverity.ADVISORY);
        this.minGapPercent = minGapPercent;
    }

    @Override
    public LevelResult evaluate(Signal signal, MarketState state, List<Position> openPositions) {
        List<Bar> bars = state.bars();
        if (bars.size() < 2) {
            return pass("Insufficient data for gap analysis");
        }
        double entry = signal.entryPrice().doubleValue();
        int from = Math.max(1, bars.size() - SCAN_BARS);

        for (int i = from; i < bars.size(); i++) {
            double prevClose = bars.get(i - 1).close().doubleValue();
            double open = bars.get(i).open().doubleValue();
            double gapPct = Math.abs(open - prevClose) / prevClose * 100.0;
            if (gapPct <= minGapPercent) {
                continue;
            }
            boolean gapUp = open > prevClose;
            if (!isUnfilled(bars, i, gapUp, bars.get(i - 1).close())) {
                continue;
            }
            double mid = (prevClose + open) / 2.0;
            double distancePct = Math.abs(entry - mid) / mid * 100.0;

            if (signal.direction() == Direction.LONG && !gapUp && mid > entry && distancePct < NEAR_PERCENT) {
                return fail(String.format("Unfilled gap-down at %.2f overhead (%.2f%% above entry)", mid, distancePct));
            }
            if (signal.direction() == Direction.SHORT && gapUp && mid < entry && distancePct < NEAR_PERCENT) {
                return fail(String.format("Unfilled gap-up at %.2f below (%.2f%% under entry)", mid, distancePct));
            }
        }
        return pass("No conflicting gaps");
    }

    private static boolean isUnfilled(List<Bar> bars, int gapIndex, boolean gapUp, BigDecimal prevClose) {
        for (int j = gapIndex; j < bars.size(); j++) {
            Bar bar = bars.get(j);
            if (gapUp && bar.low().compareTo(prevClose) <= 0) return false;
            if (!gapUp && bar.high().compareTo(prevClose) >= 0) return false;
        }
        return true;
    }
}
