package in.tradecore.domain.data;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * OHLCV bar covering {@code [start, start + interval)}.
 */
public record Bar(
    String symbol,
    Instant start,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    long volume
) {
    private static final MathContext MC = new MathContext(10, RoundingMode.HALF_UP);

    /**
     * Range as fraction of close.
     * rangePct = (high - low) / close
     */
    public BigDecimal rangePct() {
        if (close.signum() == 0) return BigDecimal.ZERO;
        return high.subtract(low).divide(close, MC);
    }

    public BigDecimal range() {
        return high.subtract(low);
    }

    public boolean isBullish() {
        return close.compareTo(open) > 0;
    }

    public boolean isBearish() {
        return close.compareTo(open) < 0;
    }
}
