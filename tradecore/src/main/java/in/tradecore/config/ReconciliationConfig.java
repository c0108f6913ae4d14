package in.tradecore.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reconciliation settings.
 */
public record ReconciliationConfig(
    @JsonProperty("gracePeriodSeconds")
    long gracePeriodSeconds             // positions younger than this are not force-removed
) {
    public static ReconciliationConfig defaults() {
        return new ReconciliationConfig(30);
    }

    public boolean isValid() {
        return gracePeriodSeconds >= 0;
    }
}
