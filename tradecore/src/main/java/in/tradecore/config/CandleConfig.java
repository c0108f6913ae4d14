package in.tradecore.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Bar building parameters.
 */
public record CandleConfig(
    @JsonProperty("intervalMinutes")
    int intervalMinutes,

    @JsonProperty("tickBufferCapacity")
    int tickBufferCapacity,             // per-symbol ring buffer; oldest ticks dropped when full

    @JsonProperty("minBarsForSignal")
    int minBarsForSignal,

    @JsonProperty("historicalBars")
    int historicalBars,                 // bars requested per symbol at startup

    @JsonProperty("maxBarsPerSymbol")
    int maxBarsPerSymbol
) {
    public static CandleConfig defaults() {
        return new CandleConfig(5, 5_000, 50, 200, 500);
    }

    public boolean isValid() {
        return intervalMinutes > 0
            && tickBufferCapacity > 0
            && minBarsForSignal > 0
            && historicalBars >= 0
            && maxBarsPerSymbol >= minBarsForSignal;
    }
}
