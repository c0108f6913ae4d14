package in.tradecore.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Breakout retest parameters.
 */
public record RetestConfig(
    @JsonProperty("tolerancePercent")
    double tolerancePercent,            // pullback band around the breakout level (e.g. 0.3 = 0.3%)

    @JsonProperty("maxWaitMinutes")
    int maxWaitMinutes
) {
    public static RetestConfig defaults() {
        return new RetestConfig(0.3, 30);
    }

    public boolean isValid() {
        return tolerancePercent > 0 && tolerancePercent < 5 && maxWaitMinutes > 0;
    }
}
