package in.tradecore.service.screening.level;

import in.tradecore.domain.data.Bar;
import in.tradecore.domain.screening.LevelResult;
import in.tradecore.domain.screening.LevelSeverity;
import in.tradecore.domain.signal.Signal;
import in.tradecore.domain.trade.Direction;
import in.tradecore.domain.trade.Position;
import in.tradecore.service.indicator.IndicatorLibrary;
import in.tradecore.service.indicator.IndicatorSpec;
import in.tradecore.service.screening.MarketState;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Multi-factor 0-100 score (trend, momentum, volume, volatility, reward:risk),
 * averaged and compared with the configured minimum.
 * A factor without enough data scores a neutral 50.
 */
public final class HeuristicScoreLevel extends AbstractScreeningLevel {

    public static final String NAME = "HEURISTIC_SCORE";

    private static final double NEUTRAL = 50;

    private final IndicatorLibrary indicators;
    private final double minScore;

    public HeuristicScoreLevel(IndicatorLibrary indicators, double minScore) {
        super(NAME, LevelSeverity.ADVISORY);
        this.indicators = indicators;
        this.minScore = minScore;
    }

    @Override
    public LevelResult evaluate(Signal signal, MarketState state, List<Position> openPositions) {
        Map<String, Double> scores = scores(signal, state.bars());
        double overall = scores.values().stream().mapToDouble(Double::doubleValue).average().orElse(0);
        String detail = String.format("%.1f/100 (trend %.0f, mom %.0f, vol %.0f, atr %.0f, rr %.0f)",
            overall, scores.get("trend"), scores.get("momentum"), scores.get("volume"),
            scores.get("volatility"), scores.get("riskReward"));
        if (overall < minScore) {
            return fail("Score too low: " + detail + ", minimum " + minScore);
        }
        return pass("Score " + detail);
    }

    Map<String, Double> scores(Signal signal, List<Bar> bars) {
        boolean isLong = signal.direction() == Direction.LONG;
        Map<String, Double> scores = new LinkedHashMap<>();
        double price = bars.isEmpty() ? Double.NaN : bars.get(bars.size() - 1).close().doubleValue();

        // Trend: price vs SMA10 vs SMA50
        if (bars.size() >= 50) {
            double sma10 = indicators.latest(bars, IndicatorSpec.sma(10));
            double sma50 = indicators.latest(bars, IndicatorSpec.sma(50));
            if (isLong) {
                scores.put("trend", price > sma10 && sma10 > sma50 ? 100.0 : price > sma10 ? 60.0 : 20.0);
            } else {
                scores.put("trend", price < sma10 && sma10 < sma50 ? 100.0 : price < sma10 ? 60.0 : 20.0);
            }
        } else {
            scores.put("trend", NEUTRAL);
        }

        // Momentum: RSI band suited to the direction
        double rsi = bars.size() > 14 ? indicators.latest(bars, IndicatorSpec.rsi(14)) : Double.NaN;
        if (Double.isFinite(rsi)) {
            scores.put("momentum", isLong ? longMomentum(rsi) : shortMomentum(rsi));
        } else {
            scores.put("momentum", NEUTRAL);
        }

        // Volume: current vs 20-bar average
        if (bars.size() >= 20) {
            double avg = bars.subList(bars.size() - 20, bars.size()).stream()
                .mapToLong(Bar::volume).average().orElse(0);
            double ratio = avg > 0 ? bars.get(bars.size() - 1).volume() / avg : 1.0;
            scores.put("volume", ratio > 2.0 ? 100.0 : ratio > 1.5 ? 80.0 : ratio > 1.0 ? 60.0 : 30.0);
        } else {
            scores.put("volume", NEUTRAL);
        }

        // Volatility: ATR as % of price, moderate is best
        double atr = bars.size() >= 14 ? indicators.latest(bars, IndicatorSpec.atr(14)) : Double.NaN;
        if (Double.isFinite(atr) && price > 0) {
            double atrPct = atr / price * 100.0;
            double score;
            if (atrPct >= 1.0 && atrPct <= 3.0) score = 100;
            else if ((atrPct >= 0.5 && atrPct < 1.0) || (atrPct > 3.0 && atrPct <= 4.0)) score = 70;
            else if (atrPct > 6.0) score = 20;
            else score = 40;
            scores.put("volatility", score);
        } else {
            scores.put("volatility", NEUTRAL);
        }

        // Reward:risk
        double rr = signal.rewardToRisk();
        scores.put("riskReward", rr >= 3.5 ? 100.0 : rr >= 3.0 ? 80.0 : rr >= 2.5 ? 60.0 : 30.0);
        return scores;
    }

    private static double longMomentum(double rsi) {
        if (rsi >= 50 && rsi <= 70) return 100;
        if ((rsi >= 40 && rsi < 50) || (rsi > 70 && rsi <= 75)) return 70;
        if (rsi > 80 || rsi < 30) return 20;
        return 40;
    }

    private static double shortMomentum(double rsi) {
        if (rsi >= 30 && rsi <= 50) return 100;
        if ((rsi >= 25 && rsi < 30) || (rsi > 50 && rsi <= 60)) return 70;
        if (rsi < 20 || rsi > 70) return 20;
        return 40;
    }
}
