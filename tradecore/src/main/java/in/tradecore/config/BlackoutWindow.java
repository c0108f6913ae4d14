package in.tradecore.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalTime;

/**
 * Exchange-local time band in which no new signals are generated (e.g. midday low liquidity).
 * Start inclusive, end exclusive.
 */
public record BlackoutWindow(
    @JsonProperty("start")
    LocalTime start,

    @JsonProperty("end")
    LocalTime end
) {
    public boolean contains(LocalTime time) {
        return !time.isBefore(start) && time.isBefore(end);
    }

    public boolean isValid() {
        return start != null && end != null && start.isBefore(end);
    }
}
