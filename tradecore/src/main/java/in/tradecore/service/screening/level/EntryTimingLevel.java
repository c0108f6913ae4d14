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
 * Do not chase: an immediate entry must not be more than {@code maxChasePercent} past the
 * recent swing extreme. Signals routed through the retest queue pass, since they only
 * fill on a pullback to the level.
 */
public final class EntryTimingLevel extends AbstractScreeningLevel {

    public static final String NAME = "ENTRY_TIMING";

    private static final int RECENT_BARS = 5;

    private final double maxChasePercent;

    public EntryTimingLevel(double maxChasePercent) {
        super(NAME, LevelSeverity.ADVISORY);
        this.maxChasePercent = maxChasePercent;
    }

    @Override
    public LevelResult evaluate(Signal signal, MarketState state, List<Position> openPositions) {
        if (signal.requiresRetest()) {
            return pass("Entry deferred to retest of " + signal.entryPrice());
        }
        List<Bar> bars = state.bars();
        if (bars.size() < RECENT_BARS + 1) {
            return pass("Insufficient data for timing check");
        }
        BigDecimal price = state.lastPrice() != null ? state.lastPrice() : signal.entryPrice();

        List<Bar> recent = bars.subList(bars.size() - 1 - RECENT_BARS, bars.size() - 1);
        boolean isLong = signal.direction() == Direction.LONG;
        BigDecimal level = isLong
            ? recent.stream().map(Bar::high).max(BigDecimal::compareTo).orElseThrow()
            : recent.stream().map(Bar::low).min(BigDecimal::compareTo).orElseThrow();

        double beyondPct = signal.direction().favorableMove(level, price).doubleValue() / level.doubleValue() * 100.0;
        if (beyondPct > maxChasePercent) {
            return fail(String.format("Price %.2f is %.2f%% beyond recent %s %.2f, avoid chasing",
                price.doubleValue(), beyondPct, isLong ? "high" : "low", level.doubleValue()));
        }
        return pass(String.format("Entry timing acceptable (%.2f%% from %.2f)", beyondPct, level.doubleValue()));
    }
}
