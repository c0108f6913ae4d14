package in.tradecore.service.screening.level;

import in.tradecore.domain.data.Bar;
import in.tradecore.domain.screening.LevelResult;
import in.tradecore.domain.screening.LevelSeverity;
import in.tradecore.domain.signal.Signal;
import in.tradecore.domain.trade.Direction;
import in.tradecore.domain.trade.Position;
import in.tradecore.service.indicator.IndicatorLibrary;
import in.tradecore.service.indicator.IndicatorSpec;
import in.tradecore.service.screening.MarketState;

import java.util.List;

/**
 * Fast/slow EMA alignment: longs need fast above slow, shorts fast below slow.
 */
public final class TrendAlignmentLevel extends AbstractScreeningLevel {

    public static final String NAME = "TREND_ALIGNMENT";

    private final IndicatorLibrary indicators;
    private final int fastPeriod;
    private final int slowPeriod;

    public TrendAlignmentLevel(IndicatorLibrary indicators, int fastPeriod, int slowPeriod) {
        super(NAME, LevelSeverity.ADVISORY);
        this.indicators = indicators;
        this.fastPeriod = fastPeriod;
        this.slowPeriod = slowPeriod;
    }

    @Override
    public LevelResult evaluate(Signal signal, MarketState state, List<Position> openPositions) {
        List<Bar> bars = state.bars();
        if (bars.size() < slowPeriod) {
            return pass("Insufficient data for EMA alignment");
        }
        double fast = indicators.latest(bars, IndicatorSpec.ema(fastPeriod));
        double slow = indicators.latest(bars, IndicatorSpec.ema(slowPeriod));

        boolean aligned = signal.direction() == Direction.LONG ? fast > slow : fast < slow;
        String detail = String.format("EMA%d %.2f vs EMA%d %.2f", fastPeriod, fast, slowPeriod, slow);
        if (!aligned) {
            return fail("Trend against " + signal.direction() + ": " + detail);
        }
        return pass("Trend aligned: " + detail);
    }
}
