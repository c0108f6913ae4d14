package in.tradecore.service.strategy;

import in.tradecore.config.RegimeConfig;
import in.tradecore.domain.data.Bar;
import in.tradecore.domain.signal.Regime;
import in.tradecore.infrastructure.broker.data.InsufficientDataException;
import in.tradecore.service.indicator.IndicatorLibrary;
import in.tradecore.service.indicator.IndicatorSpec;

import java.util.List;

/**
 * Trend-strength regime: ADX below threshold is range-bound, at or above is trending.
 */
public final class RegimeClassifier {

    private final IndicatorLibrary indicators;
    private final RegimeConfig config;

    public RegimeClassifier(IndicatorLibrary indicators, RegimeConfig config) {
        this.indicators = indicators;
        this.config = config;
    }

    public Regime classify(String symbol, List<Bar> bars) {
        double adx = indicators.latest(bars, IndicatorSpec.adx(config.adxPeriod()));
        if (!Double.isFinite(adx)) {
            throw new InsufficientDataException(symbol, "ADX(" + config.adxPeriod() + ") unavailable with "
                + bars.size() + " bars");
        }
        return adx < config.trendThreshold() ? Regime.RANGE_BOUND : Regime.TRENDING;
    }
}
