package in.tradecore.service.screening;

import in.tradecore.domain.data.Bar;
import in.tradecore.service.candle.CandleAggregator;
import in.tradecore.service.candle.SessionClock;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Builds {@link MarketState} from the candle aggregator.
 *
 * Breadth compares each symbol's latest close against the open of its first bar of the
 * current trading date.
 */
public final class MarketStateProvider {

    private final CandleAggregator candles;
    private final SessionClock sessionClock;

    public MarketStateProvider(CandleAggregator candles, SessionClock sessionClock) {
        this.candles = candles;
        this.sessionClock = sessionClock;
    }

    public MarketState stateFor(String symbol) {
        List<Bar> bars = candles.snapshot(symbol);
        BigDecimal lastPrice = candles.latestPrice(symbol)
            .orElseGet(() -> bars.isEmpty() ? null : bars.get(bars.size() - 1).close());
        Instant now = sessionClock.now();
        return new MarketState(symbol, bars, lastPrice, breadth(now), now);
    }

    BreadthSnapshot breadth(Instant now) {
        LocalDate today = sessionClock.tradingDate(now);
        int advancing = 0;
        int declining = 0;
        int unchanged = 0;
        for (String symbol : candles.symbols()) {
            List<Bar> bars = candles.snapshot(symbol);
            Bar firstToday = null;
            for (Bar bar : bars) {
                if (sessionClock.tradingDate(bar.start()).equals(today)) {
                    firstToday = bar;
                    break;
                }
            }
            if (firstToday == null) {
                continue;
            }
            int cmp = bars.get(bars.size() - 1).close().compareTo(firstToday.open());
            if (cmp > 0) advancing++;
            else if (cmp < 0) declining++;
            else unchanged++;
        }
        if (advancing + declining + unchanged == 0) {
            return null;
        }
        return new BreadthSnapshot(advancing, declining, unchanged);
    }
}
