package in.tradecore.domain.signal;

import in.tradecore.domain.trade.Direction;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Candidate trade produced by a signal generator. Immutable once created.
 *
 * {@code requiresRetest} marks breakout entries that must wait for a pullback
 * to {@code entryPrice} before an order is placed.
 */
public record Signal(
    String symbol,
    Direction direction,
    BigDecimal entryPrice,
    BigDecimal stopLoss,
    BigDecimal target,
    String strategyId,
    double confidence,
    String rationale,
    boolean requiresRetest,
    Instant createdAt
) {
    public Signal {
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("Confidence must be within [0, 100]: " + confidence);
        }
        if (entryPrice == null || stopLoss == null) {
            throw new IllegalArgumentException("entryPrice and stopLoss are required");
        }
    }

    /**
     * Entry-to-stop distance per unit.
     */
    public BigDecimal riskPerUnit() {
        return entryPrice.subtract(stopLoss).abs();
    }

    /**
     * Reward-to-risk multiple, or zero when there is no target or no risk.
     */
    public double rewardToRisk() {
        BigDecimal risk = riskPerUnit();
        if (target == null || risk.signum() == 0) return 0.0;
        return target.subtract(entryPrice).abs().doubleValue() / risk.doubleValue();
    }
}
