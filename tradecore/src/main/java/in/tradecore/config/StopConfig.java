package in.tradecore.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Stop ratchet parameters.
 */
public record StopConfig(
    @JsonProperty("breakevenRiskMultiple")
    double breakevenRiskMultiple,       // favorable excursion (in R) that moves stop to entry

    @JsonProperty("trailFraction")
    double trailFraction                // trailing stop locks this fraction of peak gain
) {
    public static StopConfig defaults() {
        return new StopConfig(1.0, 0.5);
    }

    public boolean isValid() {
        return breakevenRiskMultiple > 0 && trailFraction > 0 && trailFraction < 1;
    }
}
