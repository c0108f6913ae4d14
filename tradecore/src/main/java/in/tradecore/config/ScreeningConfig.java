package in.tradecore.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Screening pipeline configuration.
 *
 * {@code levels} maps level name to enabled flag; a level missing from the map is enabled.
 */
public record ScreeningConfig(
    @JsonProperty("failOpen")
    boolean failOpen,                   // advisory failures pass with a warning

    @JsonProperty("levels")
    Map<String, Boolean> levels,

    @JsonProperty("blacklist")
    List<String> blacklist,

    @JsonProperty("minRewardToRisk")
    double minRewardToRisk,

    @JsonProperty("fastEmaPeriod")
    int fastEmaPeriod,

    @JsonProperty("slowEmaPeriod")
    int slowEmaPeriod,

    @JsonProperty("bollingerPeriod")
    int bollingerPeriod,

    @JsonProperty("squeezeWidthThreshold")
    double squeezeWidthThreshold,       // band width / middle below this = squeeze (e.g. 0.02)

    @JsonProperty("srLookback")
    int srLookback,

    @JsonProperty("srProximityPercent")
    double srProximityPercent,

    @JsonProperty("minGapPercent")
    double minGapPercent,

    @JsonProperty("nrbLookback")
    int nrbLookback,

    @JsonProperty("nrbPercentile")
    int nrbPercentile,

    @JsonProperty("breadthNeutralBand")
    double breadthNeutralBand,          // |ratio| within band counts as neutral

    @JsonProperty("minHeuristicScore")
    double minHeuristicScore,

    @JsonProperty("maxChasePercent")
    double maxChasePercent              // block entries this far past the breakout level
) {
    public static ScreeningConfig defaults() {
        return new ScreeningConfig(
            true,
            Map.of(),
            List.of(),
            1.5,
            25, 50,
            20, 0.02,
            20, 0.5,
            0.3,
            10, 20,
            0.1,
            60.0,
            1.0
        );
    }

    public boolean isLevelEnabled(String level) {
        return levels == null || levels.getOrDefault(level, Boolean.TRUE);
    }

    public Set<String> blacklistedSymbols() {
        return blacklist == null ? Set.of() : Set.copyOf(blacklist);
    }

    public boolean isValid() {
        return minRewardToRisk >= 0
            && fastEmaPeriod > 1 && slowEmaPeriod > fastEmaPeriod
            && bollingerPeriod > 1 && squeezeWidthThreshold >= 0
            && srLookback > 1 && srProximityPercent >= 0
            && minGapPercent > 0
            && nrbLookback > 2 && nrbPercentile > 0 && nrbPercentile < 100
            && breadthNeutralBand >= 0
            && minHeuristicScore >= 0 && minHeuristicScore <= 100
            && maxChasePercent > 0;
    }
}
