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
 * N-bar range breakout. The signal's entry price is the broken level and it always
 * requires a retest: no order is placed until price pulls back to the level.
 */
public final class BreakoutGenerator implements SignalGenerator {

    public static final String STRATEGY_ID = "BREAKOUT";

    private final IndicatorLibrary indicators;
    private final StrategyConfig config;

    public BreakoutGenerator(IndicatorLibrary indicators, StrategyConfig config) {
        this.indicators = indicators;
        this.config = config;
    }

    @Override
    public Optional<Signal> generate(String symbol, List<Bar> bars, Instant now) {
        int n = bars.size();
        int lookback = config.breakoutLookback();
        if (n < Math.max(lookback, config.atrPeriod()) + 1) {
            throw new InsufficientDataException(symbol, "Not enough bars for breakout: " + n);
        }

        double atr = indicators.latest(bars, IndicatorSpec.atr(config.atrPeriod()));
        if (!Double.isFinite(atr) || atr <= 0) {
            throw new InsufficientDataException(symbol, "ATR not finite");
        }

        BigDecimal rangeHigh = bars.get(n - 1 - lookback).high();
        BigDecimal rangeLow = bars.get(n - 1 - lookback).low();
        for (int i = n - lookback; i < n - 1; i++) {
            Bar bar = bars.get(i);
            if (bar.high().compareTo(rangeHigh) > 0) rangeHigh = bar.high();
            if (bar.low().compareTo(rangeLow) < 0) rangeLow = bar.low();
        }

        BigDecimal close = bars.get(n - 1).close();
        Direction direction;
        BigDecimal level;
        if (close.compareTo(rangeHigh) > 0) {
            direction = Direction.LONG;
            level = rangeHigh;
        } else if (close.compareTo(rangeLow) < 0) {
            direction = Direction.SHORT;
            level = rangeLow;
        } else {
            return Optional.empty();
        }

        BigDecimal risk = BigDecimal.valueOf(atr * config.stopAtrMultiple()).setScale(2, RoundingMode.HALF_UP);
        if (risk.signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal reward = risk.multiply(BigDecimal.valueOf(config.rewardMultiple())).setScale(2, RoundingMode.HALF_UP);
        BigDecimal stop = direction == Direction.LONG ? level.subtract(risk) : level.add(risk);
        BigDecimal target = direction == Direction.LONG ? level.add(reward) : level.subtract(reward);

        double thrust = direction.favorableMove(level, close).doubleValue() / atr;
        double confidence = Math.min(100.0, 50.0 + 50.0 * Math.min(1.0, thrust));
        String rationale = String.format("Close %.2f broke %d-bar %s %.2f (ATR %.2f)",
            close.doubleValue(), lookback, direction == Direction.LONG ? "high" : "low", level.doubleValue(), atr);

        return Optional.of(new Signal(symbol, direction, level, stop, target, STRATEGY_ID,
            confidence, rationale, true, now));
    }

    @Override
    public String strategyId() {
        return STRATEGY_ID;
    }
}
