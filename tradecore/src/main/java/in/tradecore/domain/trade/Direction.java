package in.tradecore.domain.trade;

import in.tradecore.domain.order.OrderSide;

import java.math.BigDecimal;

/**
 * Position direction.
 */
public enum Direction {
    LONG,
    SHORT;

    /**
     * +1 for long, -1 for short. Multiplying a raw price move by this gives the
     * favorable move.
     */
    public int sign() {
        return this == LONG ? 1 : -1;
    }

    /**
     * Favorable excursion from {@code from} to {@code to} (negative when adverse).
     */
    public BigDecimal favorableMove(BigDecimal from, BigDecimal to) {
        BigDecimal move = to.subtract(from);
        return this == LONG ? move : move.negate();
    }

    /**
     * True when {@code candidate} is strictly more favorable than {@code reference}.
     */
    public boolean isBetter(BigDecimal candidate, BigDecimal reference) {
        int cmp = candidate.compareTo(reference);
        return this == LONG ? cmp > 0 : cmp < 0;
    }

    public OrderSide entrySide() {
        return this == LONG ? OrderSide.BUY : OrderSide.SELL;
    }

    public OrderSide exitSide() {
        return this == LONG ? OrderSide.SELL : OrderSide.BUY;
    }
}
