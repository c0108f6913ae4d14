package in.tradecore.domain.common;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured audit record. Payload values must be JSON-serializable.
 */
public record AuditEvent(
    EventType type,
    String symbol,
    Instant timestamp,
    Map<String, Object> payload
) {
    public AuditEvent {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static AuditEvent of(EventType type, String symbol, Instant timestamp, Map<String, Object> payload) {
        return new AuditEvent(type, symbol, timestamp, payload);
    }
}
