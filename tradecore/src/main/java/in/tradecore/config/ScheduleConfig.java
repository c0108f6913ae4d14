package in.tradecore.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Loop periods for the scheduled engine loops.
 */
public record ScheduleConfig(
    @JsonProperty("positionMonitorMillis")
    long positionMonitorMillis,

    @JsonProperty("candleRebuildMillis")
    long candleRebuildMillis,

    @JsonProperty("strategyMillis")
    long strategyMillis,

    @JsonProperty("reconciliationMillis")
    long reconciliationMillis,

    @JsonProperty("maxConsecutiveStrategyErrors")
    int maxConsecutiveStrategyErrors    // HIGH alert after this many failed strategy cycles in a row
) {
    public static ScheduleConfig defaults() {
        return new ScheduleConfig(500, 1_000, 5_000, 60_000, 10);
    }

    public boolean isValid() {
        return positionMonitorMillis > 0
            && candleRebuildMillis > 0
            && strategyMillis > 0
            && reconciliationMillis > 0
            && maxConsecutiveStrategyErrors > 0;
    }
}
