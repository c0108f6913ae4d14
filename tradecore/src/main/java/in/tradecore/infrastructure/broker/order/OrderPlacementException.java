package in.tradecore.infrastructure.broker.order;

import in.tradecore.domain.order.OrderRequest;

/**
 * Exception thrown when the venue rejects an order. Not retried.
 */
public class OrderPlacementException extends RuntimeException {

    private final String gatewayCode;
    private final OrderRequest orderRequest;

    public OrderPlacementException(String gatewayCode, OrderRequest orderRequest, String message) {
        super(String.format("[%s] Order placement failed for %s: %s",
            gatewayCode, orderRequest.symbol(), message));
        this.gatewayCode = gatewayCode;
        this.orderRequest = orderRequest;
    }

    public String getGatewayCode() {
        return gatewayCode;
    }

    public OrderRequest getOrderRequest() {
        return orderRequest;
    }
}
