package in.tradecore.service.candle;

import in.tradecore.config.BlackoutWindow;
import in.tradecore.config.SessionConfig;

import java.time.*;
import java.time.temporal.ChronoUnit;

/**
 * Session Clock - Manages market session boundaries and bar alignment.
 *
 * All multi-minute bars align from session open in the exchange zone, not from the unix epoch.
 * Every timestamp the engine compares (live ticks, historical bars, deadlines) goes through
 * this class so there is exactly one reference zone.
 */
public final class SessionClock {

    private final ZoneId zone;
    private final LocalTime open;
    private final LocalTime close;
    private final LocalTime flattenTime;
    private final SessionConfig config;
    private final Clock clock;

    public SessionClock(SessionConfig config, Clock clock) {
        this.config = config;
        this.zone = config.zoneId();
        this.open = config.open();
        this.close = config.close();
        this.flattenTime = config.flattenTime();
        this.clock = clock;
    }

    public Instant now() {
        return clock.instant();
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * Trading date of a timestamp in the exchange zone.
     */
    public LocalDate tradingDate(Instant timestamp) {
        return timestamp.atZone(zone).toLocalDate();
    }

    public LocalTime localTime(Instant timestamp) {
        return timestamp.atZone(zone).toLocalTime();
    }

    /**
     * Get session open for a given date.
     */
    public Instant sessionStart(LocalDate date) {
        return ZonedDateTime.of(date, open, zone).toInstant();
    }

    /**
     * Get session close for a given date.
     */
    public Instant sessionEnd(LocalDate date) {
        return ZonedDateTime.of(date, close, zone).toInstant();
    }

    /**
     * Check if given timestamp is within session for its date.
     */
    public boolean isWithinSession(Instant timestamp) {
        LocalDate date = tradingDate(timestamp);
        return !timestamp.isBefore(sessionStart(date)) && !timestamp.isAfter(sessionEnd(date));
    }

    /**
     * True from the flatten time (close minus configured minutes) until the end of the trading day.
     */
    public boolean isFlattenWindow(Instant timestamp) {
        return !localTime(timestamp).isBefore(flattenTime);
    }

    /**
     * True inside any configured blackout window.
     */
    public boolean isInBlackout(Instant timestamp) {
        LocalTime time = localTime(timestamp);
        for (BlackoutWindow window : config.blackoutWindowsOrEmpty()) {
            if (window.contains(time)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Floor timestamp to interval boundary aligned from session open.
     *
     * For 5-minute intervals with open 09:15:
     * Buckets: 09:15-09:20, 09:20-09:25, ...
     * Ticks before open floor to buckets counted backwards from open.
     *
     * @param timestamp The timestamp to floor
     * @param intervalMinutes The interval size in minutes
     * @return Floored timestamp aligned to session open
     */
    public Instant floorToInterval(Instant timestamp, int intervalMinutes) {
        Instant sessionStart = sessionStart(tradingDate(timestamp));
        long elapsedSeconds = ChronoUnit.SECONDS.between(sessionStart, timestamp);
        long intervalSeconds = intervalMinutes * 60L;
        long bucketIndex = Math.floorDiv(elapsedSeconds, intervalSeconds);
        return sessionStart.plusSeconds(bucketIndex * intervalSeconds);
    }

    /**
     * Format timestamp in the exchange zone for logging.
     */
    public String format(Instant timestamp) {
        return timestamp.atZone(zone).toString();
    }
}
