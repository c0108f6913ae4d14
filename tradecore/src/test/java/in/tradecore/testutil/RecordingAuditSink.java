package in.tradecore.testutil;

import in.tradecore.application.port.output.AuditSink;
import in.tradecore.domain.common.AuditEvent;
import in.tradecore.domain.common.EventType;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every audit event in memory.
 */
public final class RecordingAuditSink implements AuditSink {

    private final List<AuditEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void write(AuditEvent event) {
        events.add(event);
    }

    public List<AuditEvent> events() {
        return List.copyOf(events);
    }

    public List<AuditEvent> ofType(EventType type) {
        return events.stream().filter(e -> e.type() == type).toList();
    }
}
