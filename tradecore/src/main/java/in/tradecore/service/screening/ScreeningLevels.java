package in.tradecore.service.screening;

import in.tradecore.config.RiskConfig;
import in.tradecore.config.ScreeningConfig;
import in.tradecore.service.indicator.IndicatorLibrary;
import in.tradecore.service.screening.level.EntryTimingLevel;
import in.tradecore.service.screening.level.GapAnalysisLevel;
import in.tradecore.service.screening.level.HeuristicScoreLevel;
import in.tradecore.service.screening.level.MarketBreadthLevel;
import in.tradecore.service.screening.level.PortfolioRiskLevel;
import in.tradecore.service.screening.level.RangeCompressionLevel;
import in.tradecore.service.screening.level.RiskRewardLevel;
import in.tradecore.service.screening.level.SupportResistanceLevel;
import in.tradecore.service.screening.level.SymbolBlacklistLevel;
import in.tradecore.service.screening.level.TrendAlignmentLevel;
import in.tradecore.service.screening.level.VolatilityBandLevel;

import java.util.List;

/**
 * Standard level set in evaluation order.
 */
public final class ScreeningLevels {

    private ScreeningLevels() {}

    public static List<ScreeningLevel> defaultLevels(ScreeningConfig screening, RiskConfig risk,
                                                     IndicatorLibrary indicators) {
        return List.of(
            // Critical
            new SymbolBlacklistLevel(screening.blacklistedSymbols()),
            new PortfolioRiskLevel(risk),
            // Advisory
            new RiskRewardLevel(screening.minRewardToRisk()),
            new TrendAlignmentLevel(indicators, screening.fastEmaPeriod(), screening.slowEmaPeriod()),
            new VolatilityBandLevel(indicators, screening.bollingerPeriod(), screening.squeezeWidthThreshold()),
            new SupportResistanceLevel(screening.srLookback(), screening.srProximityPercent()),
            new GapAnalysisLevel(screening.minGapPercent()),
            new RangeCompressionLevel(screening.nrbLookback(), screening.nrbPercentile()),
            new MarketBreadthLevel(screening.breadthNeutralBand()),
            new HeuristicScoreLevel(indicators, screening.minHeuristicScore()),
            new EntryTimingLevel(screening.maxChasePercent())
        );
    }
}
