package in.tradecore.domain.trade;

import java.math.BigDecimal;

/**
 * Open position as reported by the venue. {@code netQuantity} is signed: positive long, negative short.
 */
public record VenuePosition(
    String symbol,
    int netQuantity,
    BigDecimal averagePrice
) {
    public boolean isFlat() {
        return netQuantity == 0;
    }

    public Direction direction() {
        return netQuantity >= 0 ? Direction.LONG : Direction.SHORT;
    }
}
