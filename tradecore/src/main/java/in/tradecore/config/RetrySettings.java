package in.tradecore.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.tradecore.infrastructure.broker.common.RetryPolicy;

import java.time.Duration;

/**
 * JSON form of a {@link RetryPolicy}. {@code maxAttempts} of 0 means unlimited.
 */
public record RetrySettings(
    @JsonProperty("initialDelayMillis")
    long initialDelayMillis,

    @JsonProperty("maxDelayMillis")
    long maxDelayMillis,

    @JsonProperty("multiplier")
    double multiplier,

    @JsonProperty("jitter")
    double jitter,                      // 0.2 = +/-20% of the computed delay

    @JsonProperty("maxAttempts")
    int maxAttempts
) {
    public RetryPolicy toPolicy() {
        RetryPolicy.Builder builder = RetryPolicy.builder()
            .initialDelay(Duration.ofMillis(initialDelayMillis))
            .maxDelay(Duration.ofMillis(maxDelayMillis))
            .multiplier(multiplier)
            .jitter(jitter);
        if (maxAttempts == 0) {
            builder.unlimitedAttempts();
        } else {
            builder.maxAttempts(maxAttempts);
        }
        return builder.build();
    }

    public boolean isValid() {
        return initialDelayMillis > 0
            && maxDelayMillis >= initialDelayMillis
            && multiplier > 1.0
            && jitter >= 0 && jitter < 1
            && maxAttempts >= 0;
    }
}
