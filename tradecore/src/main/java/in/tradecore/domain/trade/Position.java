package in.tradecore.domain.trade;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Open position held by the engine.
 *
 * Immutable snapshot. The ledger replaces the stored instance on every change,
 * so readers never observe a half-applied stop move.
 */
public record Position(
    String symbol,
    Direction direction,
    BigDecimal entryPrice,
    int quantity,
    BigDecimal initialStop,
    BigDecimal stopLoss,
    BigDecimal target,
    boolean breakevenMoved,
    BigDecimal peakFavorablePrice,
    String orderId,
    String strategyId,
    Instant openedAt
) {
    public static Position opened(String symbol, Direction direction, BigDecimal entryPrice, int quantity,
                                  BigDecimal stopLoss, BigDecimal target, String orderId,
                                  String strategyId, Instant openedAt) {
        return new Position(symbol, direction, entryPrice, quantity, stopLoss, stopLoss, target,
            false, entryPrice, orderId, strategyId, openedAt);
    }

    /**
     * Entry-to-initial-stop distance per unit.
     */
    public BigDecimal initialRisk() {
        return entryPrice.subtract(initialStop).abs();
    }

    /**
     * Money currently at risk if the stop fills (zero once stop is at or past entry).
     */
    public BigDecimal openRisk() {
        BigDecimal perUnit = direction.favorableMove(stopLoss, entryPrice);
        return perUnit.signum() > 0 ? perUnit.multiply(BigDecimal.valueOf(quantity)) : BigDecimal.ZERO;
    }

    public boolean isStopHit(BigDecimal price) {
        return direction == Direction.LONG
            ? price.compareTo(stopLoss) <= 0
            : price.compareTo(stopLoss) >= 0;
    }

    public boolean isTargetHit(BigDecimal price) {
        if (target == null) return false;
        return direction == Direction.LONG
            ? price.compareTo(target) >= 0
            : price.compareTo(target) <= 0;
    }

    /**
     * True when {@code candidate} would tighten the current stop.
     */
    public boolean tightens(BigDecimal candidate) {
        return direction.isBetter(candidate, stopLoss);
    }

    public Position withStop(BigDecimal newStop, boolean breakeven) {
        return new Position(symbol, direction, entryPrice, quantity, initialStop, newStop, target,
            breakeven, peakFavorablePrice, orderId, strategyId, openedAt);
    }

    public Position withPeak(BigDecimal newPeak) {
        return new Position(symbol, direction, entryPrice, quantity, initialStop, stopLoss, target,
            breakevenMoved, newPeak, orderId, strategyId, openedAt);
    }
}
