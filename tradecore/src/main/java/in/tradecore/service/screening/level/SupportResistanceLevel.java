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
 * Entry must not sit just under resistance (longs) or just above support (shorts).
 *
 * Resistance is the nearest swing high above the entry within the lookback window;
 * support the nearest swing low below it.
 */
public final class SupportResistanceLevel extends AbstractScreeningLevel {

    public static final String NAME = "SUPPORT_RESISTANCE";

    private final int lookback;
    private final double proximityPercent;

    public SupportResistanceLevel(int lookback, double proximityPercent) {
        super(NAME, LevelSeverity.ADVISORY);
        this.lookback = lookback;
        this.proximityPercent = proximityPercent;
    }

    @Override
    public LevelResult evaluate(Signal signal, MarketState state, List<Position> openPositions) {
        List<Bar> bars = state.bars();
        if (bars.size() < 3) {
            return pass("Insufficient data for S/R");
        }
        int from = Math.max(1, bars.size() - lookback);
        BigDecimal entry = signal.entryPrice();
        BigDecimal nearest = null;

        // swing point: bar extreme beyond both neighbours
        for (int i = from; i < bars.size() - 1; i++) {
            Bar prev = bars.get(i - 1);
            Bar bar = bars.get(i);
            Bar next = bars.get(i + 1);
            if (signal.direction() == Direction.LONG) {
                boolean swingHigh = bar.high().compareTo(prev.high()) > 0 && bar.high().compareTo(next.high()) >= 0;
                if (swingHigh && bar.high().compareTo(entry) > 0
                    && (nearest == null || bar.high().compareTo(nearest) < 0)) {
                    nearest = bar.high();
                }
            } else {
                boolean swingLow = bar.low().compareTo(prev.low()) < 0 && bar.low().compareTo(next.low()) <= 0;
                if (swingLow && bar.low().compareTo(entry) < 0
                    && (nearest == null || bar.low().compareTo(nearest) > 0)) {
                    nearest = bar.low();
                }
            }
        }

        String kind = signal.direction() == Direction.LONG ? "resistance" : "support";
        if (nearest == null) {
            return pass("No " + kind + " near entry");
        }
        double distancePct = nearest.subtract(entry).abs().doubleValue() / entry.doubleValue() * 100.0;
        if (distancePct < proximityPercent) {
            return fail(String.format("Entry %.2f within %.2f%% of %s %.2f",
                entry.doubleValue(), distancePct, kind, nearest.doubleValue()));
        }
        return pass(String.format("Nearest %s %.2f is %.2f%% away", kind, nearest.doubleValue(), distancePct));
    }
}
