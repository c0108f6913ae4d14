package in.tradecore.service.strategy;

import in.tradecore.config.StrategyConfig;
import in.tradecore.domain.data.Bar;
import in.tradecore.domain.signal.Signal;
import in.tradecore.domain.trade.Direction;
import in.tradecore.infrastructure.broker.data.InsufficientDataException;
import in.tradecore.service.indicator.IndicatorLibrary;
import in.tradecore.service.indicator.IndicatorSpec;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Bollinger band re-entry: previous close outside a band, current close back inside.
 * Long off the lower band, short off the upper band. Enters immediately at the close.
 */
public final class MeanReversionGenerator implements SignalGenerator {

    public static final String STRATEGY_ID = "MEAN_REVERSION";

    private final IndicatorLibrary indicators;
    private final StrategyConfig config;

    public MeanReversionGenerator(IndicatorLibrary indicators, StrategyConfig config) {
        this.indicators = indicators;
        this.config = config;
    }

    @Override
    public Optional<Signal> generate(String symbol, List<Bar> bars, Instant now) {
        int n = bars.size();
        if (n < Math.max(config.bollingerPeriod(), config.atrPeriod()) + 1) {
            throw new InsufficientDataException(symbol, "Not enough bars for Bollinger re-entry: " + n);
        }

        double[] upper = indicators.compute(bars, IndicatorSpec.bollingerUpper(config.bollingerPeriod(), config.bollingerStdDev()));
        double[] lower = indicators.compute(bars, IndicatorSpec.bollingerLower(config.bollingerPeriod(), config.bollingerStdDev()));
        double atr = indicators.latest(bars, IndicatorSpec.atr(config.atrPeriod()));

        double prevClose = bars.get(n - 2).close().doubleValue();
        double close = bars.get(n - 1).close().doubleValue();
        double prevUpper = upper[n - 2];
        double prevLower = lower[n - 2];
        if (!Double.isFinite(prevUpper) || !Double.isFinite(prevLower) || !Double.isFinite(atr)
            || !Double.isFinite(upper[n - 1]) || !Double.isFinite(lower[n - 1]) || atr <= 0) {
            throw new InsufficientDataException(symbol, "Bollinger/ATR values not finite");
        }

        Direction direction;
        double penetration;
        if (prevClose < prevLower && close > lower[n - 1]) {
            direction = Direction.LONG;
            penetration = prevLower - prevClose;
        } else if (prevClose > prevUpper && close < upper[n - 1]) {
            direction = Direction.SHORT;
            penetration = prevClose - prevUpper;
        } else {
            return Optional.empty();
        }

        BigDecimal entry = bars.get(n - 1).close();
        BigDecimal risk = BigDecimal.valueOf(atr * config.stopAtrMultiple()).setScale(2, RoundingMode.HALF_UP);
        if (risk.signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal reward = risk.multiply(BigDecimal.valueOf(config.rewardMultiple())).setScale(2, RoundingMode.HALF_UP);
        BigDecimal stop = direction == Direction.LONG ? entry.subtract(risk) : entry.add(risk);
        BigDecimal target = direction == Direction.LONG ? entry.add(reward) : entry.subtract(reward);

        double confidence = Math.min(100.0, 60.0 + 40.0 * Math.min(1.0, penetration / atr));
        String rationale = String.format("Close re-entered %s Bollinger band (prev %.2f, now %.2f, ATR %.2f)",
            direction == Direction.LONG ? "lower" : "upper", prevClose, close, atr);

        return Optional.of(new Signal(symbol, direction, entry, stop, target, STRATEGY_ID,
            confidence, rationale, false, now));
    }

    @Override
    public String strategyId() {
        return STRATEGY_ID;
    }
}
