package in.tradecore.config;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AuditConfig(
    @JsonProperty("queueCapacity")
    int queueCapacity
) {
    public static AuditConfig defaults() {
        return new AuditConfig(10_000);
    }

    public boolean isValid() {
        return queueCapacity > 0;
    }
}
