package in.tradecore.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Parameters for the bundled signal generators.
 */
public record StrategyConfig(
    @JsonProperty("bollingerPeriod")
    int bollingerPeriod,

    @JsonProperty("bollingerStdDev")
    double bollingerStdDev,

    @JsonProperty("breakoutLookback")
    int breakoutLookback,

    @JsonProperty("atrPeriod")
    int atrPeriod,

    @JsonProperty("stopAtrMultiple")
    double stopAtrMultiple,

    @JsonProperty("rewardMultiple")
    double rewardMultiple               // target distance as a multiple of stop distance
) {
    public static StrategyConfig defaults() {
        return new StrategyConfig(20, 2.0, 20, 14, 1.5, 3.0);
    }

    public boolean isValid() {
        return bollingerPeriod > 1 && bollingerStdDev > 0
            && breakoutLookback > 1 && atrPeriod > 1
            && stopAtrMultiple > 0 && rewardMultiple > 0;
    }
}
