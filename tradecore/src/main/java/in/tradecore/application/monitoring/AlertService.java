package in.tradecore.application.monitoring;

import in.tradecore.domain.monitoring.Alert;
import in.tradecore.domain.monitoring.AlertLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Raises operator alerts.
 *
 * Alerts are stamped from the engine clock and logged to SLF4J at a severity-mapped level;
 * delivery to paging or chat channels hangs off the log appenders.
 */
public class AlertService {
    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private final Clock clock;
    private final Map<AlertLevel, AtomicLong> raised = new EnumMap<>(AlertLevel.class);

    public AlertService(Clock clock) {
        this.clock = clock;
        for (AlertLevel level : AlertLevel.values()) {
            raised.put(level, new AtomicLong());
        }
    }

    public Alert raise(String alertType, AlertLevel level, String message, Map<String, Object> details) {
        Alert alert = new Alert(alertType, level, message, details, clock.instant());
        raised.get(level).incrementAndGet();
        switch (level) {
            case CRITICAL -> log.error("[ALERT-CRITICAL] {} - {}", alertType, message);
            case HIGH -> log.warn("[ALERT-HIGH] {} - {}", alertType, message);
            case MEDIUM -> log.warn("[ALERT-MEDIUM] {} - {}", alertType, message);
            case LOW, INFO -> log.info("[ALERT-INFO] {} - {}", alertType, message);
        }
        if (!alert.details().isEmpty()) {
            log.info("[ALERT-DETAILS] {} {}", alertType, alert.details());
        }
        return alert;
    }

    public void sendCriticalAlert(String alertType, String message) {
        raise(alertType, AlertLevel.CRITICAL, message, Map.of());
    }

    public void sendHighAlert(String alertType, String message) {
        raise(alertType, AlertLevel.HIGH, message, Map.of());
    }

    public void sendMediumAlert(String alertType, String message, Map<String, Object> details) {
        raise(alertType, AlertLevel.MEDIUM, message, details);
    }

    public long raisedCount(AlertLevel level) {
        return raised.get(level).get();
    }
}
