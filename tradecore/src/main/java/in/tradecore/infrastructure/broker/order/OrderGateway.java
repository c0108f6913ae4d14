package in.tradecore.infrastructure.broker.order;

import in.tradecore.domain.order.OrderRequest;
import in.tradecore.domain.order.OrderResult;
import in.tradecore.domain.trade.VenuePosition;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Venue order interface.
 *
 * Implementations must treat {@link OrderRequest#correlationId()} as an idempotency key:
 * a retried request with a known correlation id returns the original result instead of
 * placing a second order.
 *
 * Failure modes (through the returned future):
 * - {@link GatewayAuthenticationException} session or credentials rejected
 * - {@link GatewayRateLimitException} throttled, retry later
 * - {@link OrderPlacementException} order rejected by the venue
 */
public interface OrderGateway {

    /**
     * Place an order. For MARKET orders the future completes once the venue reports the fill
     * or a rejection.
     */
    CompletableFuture<OrderResult> placeOrder(OrderRequest request);

    /**
     * Open positions as the venue sees them. Flat symbols may be omitted.
     */
    CompletableFuture<List<VenuePosition>> getOpenPositions();

    String getGatewayCode();
}
