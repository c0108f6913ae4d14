package in.tradecore.domain.trade;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Breakout waiting for a pullback to the breakout level before a real entry is placed.
 */
public record PendingRetest(
    String symbol,
    BigDecimal breakoutPrice,
    Direction direction,
    BigDecimal stopLoss,
    BigDecimal target,
    int quantity,
    String strategyId,
    Instant createdAt,
    Instant deadline
) {
    public boolean isExpired(Instant now) {
        return now.isAfter(deadline) || now.equals(deadline);
    }
}
