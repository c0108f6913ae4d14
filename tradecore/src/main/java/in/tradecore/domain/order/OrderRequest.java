package in.tradecore.domain.order;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Order submission request.
 *
 * {@code correlationId} is generated once by the caller and reused on every retry,
 * so the gateway can drop duplicates of an order it already accepted.
 */
public record OrderRequest(
    String correlationId,
    String symbol,
    OrderSide side,
    int quantity,
    OrderType orderType,
    BigDecimal limitPrice,
    OrderPurpose purpose
) {
    public OrderRequest {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Order quantity must be positive: " + quantity);
        }
        if (orderType == OrderType.LIMIT && limitPrice == null) {
            throw new IllegalArgumentException("Limit order requires limitPrice");
        }
    }

    public static OrderRequest market(String symbol, OrderSide side, int quantity, OrderPurpose purpose) {
        return new OrderRequest(newCorrelationId(), symbol, side, quantity, OrderType.MARKET, null, purpose);
    }

    public static String newCorrelationId() {
        return UUID.randomUUID().toString();
    }
}
