package in.tradecore.infrastructure.broker.order;

import java.time.Duration;

/**
 * Exception thrown when a gateway call does not complete within its timeout.
 * Treated as transient.
 */
public class GatewayTimeoutException extends RuntimeException {

    private final String gatewayCode;
    private final String operation;

    public GatewayTimeoutException(String gatewayCode, String operation, Duration timeout) {
        super(String.format("[%s] %s timed out after %dms", gatewayCode, operation, timeout.toMillis()));
        this.gatewayCode = gatewayCode;
        this.operation = operation;
    }

    public String getGatewayCode() {
        return gatewayCode;
    }

    public String getOperation() {
        return operation;
    }
}
