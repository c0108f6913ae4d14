package in.tradecore.domain.monitoring;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Operator-facing alert raised by the engine.
 *
 * @param alertType stable machine-readable code, e.g. EXIT_ORDER_FAILED
 * @param raisedAt engine clock time the alert was raised
 */
public record Alert(
    String alertType,
    AlertLevel level,
    String message,
    Map<String, Object> details,
    Instant raisedAt
) {
    public Alert {
        if (alertType == null || level == null || message == null || raisedAt == null) {
            throw new IllegalArgumentException("alertType, level, message and raisedAt are required");
        }
        details = details == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(details));
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s (%s)", level, alertType, message, raisedAt);
    }
}
