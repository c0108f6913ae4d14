package in.tradecore.domain.data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Real-time market tick.
 * Ephemeral: consumed by the candle aggregator, never persisted.
 */
public record Tick(
    String symbol,
    BigDecimal price,
    long size,
    Instant timestamp
) {
    public Tick {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Tick symbol is required");
        }
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Tick price must be positive: " + price);
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("Tick timestamp is required");
        }
        if (size < 0) {
            throw new IllegalArgumentException("Tick size cannot be negative: " + size);
        }
    }
}
