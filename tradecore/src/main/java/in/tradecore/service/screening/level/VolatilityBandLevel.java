package in.tradecore.service.screening.level;

import in.tradecore.domain.data.Bar;
import in.tradecore.domain.screening.LevelResult;
import in.tradecore.domain.screening.LevelSeverity;
import in.tradecore.domain.signal.Signal;
import in.tradecore.domain.trade.Position;
import in.tradecore.service.indicator.IndicatorLibrary;
import in.tradecore.service.indicator.IndicatorSpec;
import in.tradecore.service.screening.MarketState;

import java.util.List;

/**
 * Bollinger squeeze: block while band width is below the squeeze threshold,
 * trade once it expands.
 */
public final class VolatilityBandLevel extends AbstractScreeningLevel {

    public static final String NAME = "VOLATILITY_BAND";

    private final IndicatorLibrary indicators;
    private final int period;
    private final double squeezeThreshold;

    public VolatilityBandLevel(IndicatorLibrary indicators, int period, double squeezeThreshold) {
        super(NAME, LevelSeverity.ADVISORY);
        this.indicators = indicators;
        this.period = period;
        this.squeezeThreshold = squeezeThreshold;
    }

    @Override
    public LevelResult evaluate(Signal signal, MarketState state, List<Position> openPositions) {
        List<Bar> bars = state.bars();
        if (bars.size() < period) {
            return pass("Insufficient data for band width");
        }
        double[] widths = indicators.compute(bars, IndicatorSpec.bollingerWidth(period, 2.0));
        double current = widths[widths.length - 1];
        if (!Double.isFinite(current)) {
            return pass("Band width unavailable");
        }
        if (current < squeezeThreshold) {
            return fail(String.format("Band squeeze active (width %.4f < %.4f), awaiting expansion",
                current, squeezeThreshold));
        }

        boolean wasSqueezed = false;
        for (int i = Math.max(0, widths.length - 5); i < widths.length - 1; i++) {
            if (Double.isFinite(widths[i]) && widths[i] < squeezeThreshold) {
                wasSqueezed = true;
                break;
            }
        }
        return pass(wasSqueezed
            ? String.format("Expansion from squeeze (width %.4f)", current)
            : String.format("Band width normal (%.4f)", current));
    }
}
