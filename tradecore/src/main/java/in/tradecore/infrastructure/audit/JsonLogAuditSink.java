package in.tradecore.infrastructure.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.tradecore.application.port.output.AuditSink;
import in.tradecore.domain.common.AuditEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each audit event as one JSON line to the {@code AUDIT} logger.
 * Routing of that logger (file, console) is set in logback.xml.
 */
public final class JsonLogAuditSink implements AuditSink {
    private static final Logger log = LoggerFactory.getLogger(JsonLogAuditSink.class);
    private static final Logger AUDIT = LoggerFactory.getLogger("AUDIT");

    private final ObjectMapper mapper;

    public JsonLogAuditSink() {
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void write(AuditEvent event) {
        AUDIT.info(toJson(event));
    }

    String toJson(AuditEvent event) {
        try {
            return mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.warn("Audit event {} not serializable: {}", event.type(), e.getMessage());
            return String.format("{\"type\":\"%s\",\"symbol\":\"%s\",\"error\":\"unserializable payload\"}",
                event.type(), event.symbol());
        }
    }
}
