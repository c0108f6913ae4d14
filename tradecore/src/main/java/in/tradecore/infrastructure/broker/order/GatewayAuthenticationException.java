package in.tradecore.infrastructure.broker.order;

/**
 * Exception thrown when the venue rejects the session or credentials.
 * Escalated: new entries are suspended until an operator intervenes.
 */
public class GatewayAuthenticationException extends RuntimeException {

    private final String gatewayCode;

    public GatewayAuthenticationException(String gatewayCode, String message) {
        super(String.format("[%s] %s", gatewayCode, message));
        this.gatewayCode = gatewayCode;
    }

    public String getGatewayCode() {
        return gatewayCode;
    }
}
