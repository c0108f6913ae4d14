package in.tradecore.infrastructure.broker.order;

/**
 * Exception thrown when the venue throttles requests. Treated as transient.
 */
public class GatewayRateLimitException extends RuntimeException {

    private final String gatewayCode;

    public GatewayRateLimitException(String gatewayCode, String message) {
        super(String.format("[%s] %s", gatewayCode, message));
        this.gatewayCode = gatewayCode;
    }

    public String getGatewayCode() {
        return gatewayCode;
    }
}
