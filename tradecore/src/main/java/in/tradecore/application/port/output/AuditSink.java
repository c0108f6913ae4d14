package in.tradecore.application.port.output;

import in.tradecore.domain.common.AuditEvent;

/**
 * Destination for audit events (log, database, message bus).
 *
 * Called from the audit drain thread only, never from an engine loop.
 */
public interface AuditSink {

    void write(AuditEvent event);
}
