package in.tradecore.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Retry and timeout settings for external calls.
 */
public record RetryConfig(
    @JsonProperty("marketFeed")
    RetrySettings marketFeed,

    @JsonProperty("orderGateway")
    RetrySettings orderGateway,

    @JsonProperty("gatewayTimeoutMillis")
    long gatewayTimeoutMillis,

    @JsonProperty("feedTimeoutMillis")
    long feedTimeoutMillis
) {
    public static RetryConfig defaults() {
        return new RetryConfig(
            new RetrySettings(1_000, 60_000, 2.0, 0.2, 0),
            new RetrySettings(500, 8_000, 2.0, 0.2, 5),
            5_000,
            10_000
        );
    }

    public boolean isValid() {
        return marketFeed != null && marketFeed.isValid() && marketFeed.maxAttempts() == 0
            && orderGateway != null && orderGateway.isValid() && orderGateway.maxAttempts() > 0
            && gatewayTimeoutMillis > 0
            && feedTimeoutMillis > 0;
    }
}
