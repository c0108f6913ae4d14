package in.tradecore.service.screening;

import in.tradecore.domain.data.Bar;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Market context a signal is screened against.
 *
 * @param bars Bar history for the signal's symbol
 * @param breadth Universe breadth, null when unavailable
 * @param committedEntries Entries already committed but not yet in the ledger
 *                         (orders in flight and pending retests)
 */
public record MarketState(
    String symbol,
    List<Bar> bars,
    BigDecimal lastPrice,
    BreadthSnapshot breadth,
    Instant asOf,
    int committedEntries
) {
    public MarketState {
        bars = List.copyOf(bars);
        if (committedEntries < 0) {
            throw new IllegalArgumentException("committedEntries must be >= 0");
        }
    }

    public MarketState(String symbol, List<Bar> bars, BigDecimal lastPrice, BreadthSnapshot breadth, Instant asOf) {
        this(symbol, bars, lastPrice, breadth, asOf, 0);
    }

    public MarketState withCommittedEntries(int count) {
        return new MarketState(symbol, bars, lastPrice, breadth, asOf, count);
    }
}
