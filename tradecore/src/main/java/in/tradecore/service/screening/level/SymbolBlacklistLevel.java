package in.tradecore.service.screening.level;

import in.tradecore.domain.screening.LevelResult;
import in.tradecore.domain.screening.LevelSeverity;
import in.tradecore.domain.signal.Signal;
import in.tradecore.domain.trade.Position;
import in.tradecore.service.screening.MarketState;

import java.util.List;
import java.util.Set;

/**
 * Blocks symbols on the configured blacklist. Critical.
 */
public final class SymbolBlacklistLevel extends AbstractScreeningLevel {

    public static final String NAME = "SYMBOL_BLACKLIST";

    private final Set<String> blacklist;

    public SymbolBlacklistLevel(Set<String> blacklist) {
        super(NAME, LevelSeverity.CRITICAL);
        this.blacklist = Set.copyOf(blacklist);
    }

    @Override
    public LevelResult evaluate(Signal signal, MarketState state, List<Position> openPositions) {
        if (blacklist.contains(signal.symbol())) {
            return fail(signal.symbol() + " is blacklisted");
        }
        return pass("Not blacklisted");
    }
}
