package in.tradecore.domain.order;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Outcome of an order submission as reported by the gateway.
 */
public record OrderResult(
    String orderId,
    String correlationId,
    OrderStatus status,
    int filledQuantity,
    BigDecimal averagePrice,
    String message,
    Instant timestamp
) {
    public boolean isFilled() {
        return status == OrderStatus.FILLED;
    }

    public static OrderResult filled(String orderId, String correlationId, int qty, BigDecimal price, Instant at) {
        return new OrderResult(orderId, correlationId, OrderStatus.FILLED, qty, price, "filled", at);
    }

    public static OrderResult rejected(String correlationId, String message, Instant at) {
        return new OrderResult(null, correlationId, OrderStatus.REJECTED, 0, null, message, at);
    }
}
