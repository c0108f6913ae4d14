package in.tradecore.domain.data;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * Bar as delivered by a historical data source: the start time is exchange-local
 * wall-clock time with no zone attached.
 */
public record HistoricalBar(
    String symbol,
    LocalDateTime localStart,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    long volume
) {
    /**
     * Normalize to an instant-keyed bar using the exchange zone.
     */
    public Bar toBar(ZoneId exchangeZone) {
        return new Bar(symbol, localStart.atZone(exchangeZone).toInstant(),
            open, high, low, close, volume);
    }
}
