package in.tradecore.service.screening.level;

import in.tradecore.config.RiskConfig;
import in.tradecore.domain.screening.LevelResult;
import in.tradecore.domain.screening.LevelSeverity;
import in.tradecore.domain.signal.Signal;
import in.tradecore.domain.trade.Position;
import in.tradecore.service.screening.MarketState;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

/**
 * Portfolio risk limit. Critical.
 *
 * Total risk = open risk of every position (distance to its current stop, zero once at
 * breakeven) + one per-trade risk budget for each committed entry not yet filled + the
 * budget of the new signal, as a percent of capital. Committed entries also count toward
 * the maximum number of open positions.
 */
public final class PortfolioRiskLevel extends AbstractScreeningLevel {

    public static final String NAME = "PORTFOLIO_RISK";

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final RiskConfig config;

    public PortfolioRiskLevel(RiskConfig config) {
        super(NAME, LevelSeverity.CRITICAL);
        this.config = config;
    }

    @Override
    public LevelResult evaluate(Signal signal, MarketState state, List<Position> openPositions) {
        int committed = state.committedEntries();
        int exposure = openPositions.size() + committed;
        if (exposure >= config.maxOpenPositions()) {
            return fail(String.format("Max open positions reached: %d/%d (%d open, %d committed)",
                exposure, config.maxOpenPositions(), openPositions.size(), committed));
        }

        BigDecimal existing = openPositions.stream()
            .map(Position::openRisk)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal newTrade = config.capital()
            .multiply(BigDecimal.valueOf(config.riskPerTradePercent()))
            .divide(HUNDRED, MathContext.DECIMAL64);

        double existingPct = existing.multiply(HUNDRED).divide(config.capital(), MathContext.DECIMAL64).doubleValue()
            + committed * config.riskPerTradePercent();
        double newPct = config.riskPerTradePercent();
        double totalPct = existingPct + newPct;

        if (totalPct > config.maxPortfolioRiskPercent()) {
            return fail(String.format("Portfolio risk limit exceeded: %.2f%% > %.2f%% (existing %.2f%%, new %.2f%% = %s)",
                totalPct, config.maxPortfolioRiskPercent(), existingPct, newPct, newTrade.toPlainString()));
        }
        return pass(String.format("Portfolio risk %.2f%% / %.2f%%", totalPct, config.maxPortfolioRiskPercent()));
    }
}
