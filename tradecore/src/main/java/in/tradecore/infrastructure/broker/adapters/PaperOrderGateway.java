package in.tradecore.infrastructure.broker.adapters;

import in.tradecore.domain.order.OrderRequest;
import in.tradecore.domain.order.OrderResult;
import in.tradecore.domain.order.OrderSide;
import in.tradecore.domain.order.OrderType;
import in.tradecore.domain.trade.VenuePosition;
import in.tradecore.infrastructure.broker.order.OrderGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Simulated venue for PAPER mode.
 *
 * Market orders fill in full at the latest known price; limit orders fill at their limit.
 * Keeps its own net positions so reconciliation has a real counterpart to diff against.
 * Idempotent on correlation id.
 */
public class PaperOrderGateway implements OrderGateway {
    private static final Logger log = LoggerFactory.getLogger(PaperOrderGateway.class);

    private final Function<String, Optional<BigDecimal>> priceSource;
    private final Clock clock;

    private final Map<String, OrderResult> resultsByCorrelationId = new ConcurrentHashMap<>();
    private final Map<String, Holding> holdings = new TreeMap<>();
    private final AtomicLong orderSeq = new AtomicLong();

    private static final class Holding {
        int netQuantity;
        BigDecimal averagePrice = BigDecimal.ZERO;
    }

    public PaperOrderGateway(Function<String, Optional<BigDecimal>> priceSource, Clock clock) {
        this.priceSource = priceSource;
        this.clock = clock;
    }

    @Override
    public String getGatewayCode() {
        return "PAPER";
    }

    @Override
    public CompletableFuture<OrderResult> placeOrder(OrderRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            OrderResult known = resultsByCorrelationId.get(request.correlationId());
            if (known != null) {
                log.info("[PAPER] Duplicate order {} ignored, returning original result", request.correlationId());
                return known;
            }
            return resultsByCorrelationId.computeIfAbsent(request.correlationId(), id -> execute(request));
        });
    }

    private OrderResult execute(OrderRequest request) {
        BigDecimal price = request.orderType() == OrderType.LIMIT
            ? request.limitPrice()
            : priceSource.apply(request.symbol()).orElse(null);
        if (price == null) {
            log.warn("[PAPER] Rejecting {} {}: no price available", request.side(), request.symbol());
            return OrderResult.rejected(request.correlationId(), "No price for " + request.symbol(), clock.instant());
        }

        String orderId = "PP" + orderSeq.incrementAndGet();
        applyFill(request.symbol(), request.side(), request.quantity(), price);
        log.info("[PAPER] Order filled: {} {} {} x{} @ {} ({})", orderId, request.side(), request.symbol(),
            request.quantity(), price, request.purpose());
        return OrderResult.filled(orderId, request.correlationId(), request.quantity(), price, clock.instant());
    }

    private synchronized void applyFill(String symbol, OrderSide side, int quantity, BigDecimal price) {
        Holding holding = holdings.computeIfAbsent(symbol, s -> new Holding());
        int signed = side == OrderSide.BUY ? quantity : -quantity;
        int before = holding.netQuantity;
        int after = before + signed;

        if (before == 0 || Integer.signum(before) == Integer.signum(signed)) {
            // opening or adding: weighted average
            BigDecimal cost = holding.averagePrice.multiply(BigDecimal.valueOf(Math.abs(before)))
                .add(price.multiply(BigDecimal.valueOf(quantity)));
            holding.averagePrice = cost.divide(BigDecimal.valueOf(Math.abs(after)), 4, RoundingMode.HALF_UP);
        } else if (after != 0 && Integer.signum(after) != Integer.signum(before)) {
            // flipped through zero
            holding.averagePrice = price;
        }
        holding.netQuantity = after;
        if (after == 0) {
            holdings.remove(symbol);
        }
    }

    @Override
    public CompletableFuture<List<VenuePosition>> getOpenPositions() {
        return CompletableFuture.supplyAsync(this::positions);
    }

    private synchronized List<VenuePosition> positions() {
        List<VenuePosition> result = new ArrayList<>();
        holdings.forEach((symbol, h) -> result.add(new VenuePosition(symbol, h.netQuantity, h.averagePrice)));
        return result;
    }

    /**
     * Drop a venue position as if it had been closed outside the engine.
     */
    public synchronized void closeExternally(String symbol) {
        if (holdings.remove(symbol) != null) {
            log.info("[PAPER] Position {} closed outside the engine", symbol);
        }
    }
}
