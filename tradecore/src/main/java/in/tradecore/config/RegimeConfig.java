package in.tradecore.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Regime classification: ADX below threshold is range-bound, at or above is trending.
 */
public record RegimeConfig(
    @JsonProperty("adxPeriod")
    int adxPeriod,

    @JsonProperty("trendThreshold")
    double trendThreshold
) {
    public static RegimeConfig defaults() {
        return new RegimeConfig(14, 25.0);
    }

    public boolean isValid() {
        return adxPeriod > 1 && trendThreshold > 0 && trendThreshold < 100;
    }
}
