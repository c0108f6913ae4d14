package in.tradecore.infrastructure.broker.data;

import in.tradecore.domain.data.HistoricalBar;

import java.util.List;

/**
 * Source of historical bars fetched once at startup.
 * Bars carry exchange-local start times; callers normalize them.
 */
public interface HistoricalBarSource {

    /**
     * @param symbol Instrument symbol
     * @param intervalMinutes Bar interval
     * @param count Maximum number of most recent bars
     */
    List<HistoricalBar> fetchBars(String symbol, int intervalMinutes, int count);
}
