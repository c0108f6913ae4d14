package in.tradecore.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;

/**
 * Exchange session boundaries, all in exchange-local time.
 */
public record SessionConfig(
    @JsonProperty("zone")
    String zone,                        // e.g. Asia/Kolkata

    @JsonProperty("open")
    LocalTime open,

    @JsonProperty("close")
    LocalTime close,

    @JsonProperty("flattenMinutesBeforeClose")
    int flattenMinutesBeforeClose,      // auto-flatten this many minutes before close

    @JsonProperty("blackoutWindows")
    List<BlackoutWindow> blackoutWindows
) {
    public static SessionConfig defaults() {
        return new SessionConfig(
            "Asia/Kolkata",
            LocalTime.of(9, 15),
            LocalTime.of(15, 30),
            15,
            List.of(new BlackoutWindow(LocalTime.of(12, 0), LocalTime.of(13, 0)))
        );
    }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    public LocalTime flattenTime() {
        return close.minusMinutes(flattenMinutesBeforeClose);
    }

    public List<BlackoutWindow> blackoutWindowsOrEmpty() {
        return blackoutWindows == null ? List.of() : blackoutWindows;
    }

    public boolean isValid() {
        try {
            ZoneId.of(zone);
        } catch (RuntimeException e) {
            return false;
        }
        return open != null && close != null && open.isBefore(close)
            && flattenMinutesBeforeClose >= 0
            && blackoutWindowsOrEmpty().stream().allMatch(BlackoutWindow::isValid);
    }
}
