package in.tradecore.service.screening.level;

import in.tradecore.domain.screening.LevelResult;
import in.tradecore.domain.screening.LevelSeverity;
import in.tradecore.domain.signal.Signal;
import in.tradecore.domain.trade.Direction;
import in.tradecore.domain.trade.Position;
import in.tradecore.service.screening.BreadthSnapshot;
import in.tradecore.service.screening.MarketState;

import java.util.List;

/**
 * Do not trade against the universe's advance/decline balance.
 */
public final class MarketBreadthLevel extends AbstractScreeningLevel {

    public static final String NAME = "MARKET_BREADTH";

    private final double neutralBand;

    public MarketBreadthLevel(double neutralBand) {
        super(NAME, LevelSeverity.ADVISORY);
        this.neutralBand = neutralBand;
    }

    @Override
    public LevelResult evaluate(Signal signal, MarketState state, List<Position> openPositions) {
        BreadthSnapshot breadth = state.breadth();
        if (breadth == null || breadth.total() == 0) {
            return pass("Breadth unavailable");
        }
        double ratio = breadth.ratio();
        String detail = String.format("%d adv / %d dec / %d unch (ratio %+.2f)",
            breadth.advancing(), breadth.declining(), breadth.unchanged(), ratio);

        if (signal.direction() == Direction.LONG && ratio < -neutralBand) {
            return fail("Breadth bearish for long: " + detail);
        }
        if (signal.direction() == Direction.SHORT && ratio > neutralBand) {
            return fail("Breadth bullish for short: " + detail);
        }
        return pass("Breadth supports " + signal.direction() + ": " + detail);
    }
}
