package in.tradecore.service.indicator;

/**
 * Which indicator to compute and with what parameters.
 *
 * @param multiplier Standard-deviation multiplier for Bollinger bands, ignored otherwise
 */
public record IndicatorSpec(Indicator indicator, int period, double multiplier) {

    public IndicatorSpec {
        if (period <= 0) {
            throw new IllegalArgumentException("Indicator period must be positive: " + period);
        }
    }

    public static IndicatorSpec sma(int period) {
        return new IndicatorSpec(Indicator.SMA, period, 0);
    }

    public static IndicatorSpec ema(int period) {
        return new IndicatorSpec(Indicator.EMA, period, 0);
    }

    public static IndicatorSpec atr(int period) {
        return new IndicatorSpec(Indicator.ATR, period, 0);
    }

    public static IndicatorSpec adx(int period) {
        return new IndicatorSpec(Indicator.ADX, period, 0);
    }

    public static IndicatorSpec rsi(int period) {
        return new IndicatorSpec(Indicator.RSI, period, 0);
    }

    public static IndicatorSpec bollingerUpper(int period, double stdDev) {
        return new IndicatorSpec(Indicator.BB_UPPER, period, stdDev);
    }

    public static IndicatorSpec bollingerLower(int period, double stdDev) {
        return new IndicatorSpec(Indicator.BB_LOWER, period, stdDev);
    }

    public static IndicatorSpec bollingerWidth(int period, double stdDev) {
        return new IndicatorSpec(Indicator.BB_WIDTH, period, stdDev);
    }
}
