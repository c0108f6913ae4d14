package in.tradecore.service.indicator;

import in.tradecore.domain.data.Bar;

import java.util.Arrays;
import java.util.List;

/**
 * Reference indicator implementations (Wilder smoothing for ATR, RSI and ADX).
 */
public final class BasicIndicatorLibrary implements IndicatorLibrary {

    @Override
    public double[] compute(List<Bar> bars, IndicatorSpec spec) {
        int n = bars.size();
        double[] high = new double[n];
        double[] low = new double[n];
        double[] close = new double[n];
        for (int i = 0; i < n; i++) {
            Bar bar = bars.get(i);
            high[i] = bar.high().doubleValue();
            low[i] = bar.low().doubleValue();
            close[i] = bar.close().doubleValue();
        }

        int p = spec.period();
        return switch (spec.indicator()) {
            case SMA -> sma(close, p);
            case EMA -> ema(close, p);
            case ATR -> atr(high, low, close, p);
            case ADX -> adx(high, low, close, p);
            case RSI -> rsi(close, p);
            case BB_UPPER -> bollinger(close, p, spec.multiplier(), 1);
            case BB_LOWER -> bollinger(close, p, spec.multiplier(), -1);
            case BB_WIDTH -> bollingerWidth(close, p, spec.multiplier());
        };
    }

    static double[] sma(double[] values, int period) {
        double[] out = nans(values.length);
        double sum = 0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i];
            if (i >= period) sum -= values[i - period];
            if (i >= period - 1) out[i] = sum / period;
        }
        return out;
    }

    /**
     * Recursive EMA seeded with the first value (no warm-up gap).
     */
    static double[] ema(double[] values, int period) {
        double[] out = nans(values.length);
        if (values.length == 0) return out;
        double alpha = 2.0 / (period + 1);
        out[0] = values[0];
        for (int i = 1; i < values.length; i++) {
            out[i] = alpha * values[i] + (1 - alpha) * out[i - 1];
        }
        return out;
    }

    static double[] trueRange(double[] high, double[] low, double[] close) {
        double[] tr = new double[high.length];
        for (int i = 0; i < high.length; i++) {
            double hl = high[i] - low[i];
            if (i == 0) {
                tr[i] = hl;
            } else {
                tr[i] = Math.max(hl, Math.max(Math.abs(high[i] - close[i - 1]), Math.abs(low[i] - close[i - 1])));
            }
        }
        return tr;
    }

    static double[] atr(double[] high, double[] low, double[] close, int period) {
        int n = high.length;
        double[] out = nans(n);
        if (n < period) return out;
        double[] tr = trueRange(high, low, close);
        double sum = 0;
        for (int i = 0; i < period; i++) sum += tr[i];
        out[period - 1] = sum / period;
        for (int i = period; i < n; i++) {
            out[i] = (out[i - 1] * (period - 1) + tr[i]) / period;
        }
        return out;
    }

    static double[] rsi(double[] close, int period) {
        int n = close.length;
        double[] out = nans(n);
        if (n <= period) return out;
        double gain = 0;
        double loss = 0;
        for (int i = 1; i <= period; i++) {
            double change = close[i] - close[i - 1];
            if (change > 0) gain += change; else loss -= change;
        }
        double avgGain = gain / period;
        double avgLoss = loss / period;
        out[period] = rsiValue(avgGain, avgLoss);
        for (int i = period + 1; i < n; i++) {
            double change = close[i] - close[i - 1];
            avgGain = (avgGain * (period - 1) + Math.max(change, 0)) / period;
            avgLoss = (avgLoss * (period - 1) + Math.max(-change, 0)) / period;
            out[i] = rsiValue(avgGain, avgLoss);
        }
        return out;
    }

    private static double rsiValue(double avgGain, double avgLoss) {
        if (avgLoss == 0) return avgGain == 0 ? 50.0 : 100.0;
        double rs = avgGain / avgLoss;
        return 100.0 - 100.0 / (1.0 + rs);
    }

    static double[] adx(double[] high, double[] low, double[] close, int period) {
        int n = high.length;
        double[] out = nans(n);
        if (n < 2 * period) return out;

        double[] tr = trueRange(high, low, close);
        double[] plusDm = new double[n];
        double[] minusDm = new double[n];
        for (int i = 1; i < n; i++) {
            double up = high[i] - high[i - 1];
            double down = low[i - 1] - low[i];
            plusDm[i] = (up > down && up > 0) ? up : 0;
            minusDm[i] = (down > up && down > 0) ? down : 0;
        }

        double sTr = 0;
        double sPlus = 0;
        double sMinus = 0;
        for (int i = 1; i <= period; i++) {
            sTr += tr[i];
            sPlus += plusDm[i];
            sMinus += minusDm[i];
        }

        double[] dx = nans(n);
        dx[period] = dxValue(sTr, sPlus, sMinus);
        for (int i = period + 1; i < n; i++) {
            sTr = sTr - sTr / period + tr[i];
            sPlus = sPlus - sPlus / period + plusDm[i];
            sMinus = sMinus - sMinus / period + minusDm[i];
            dx[i] = dxValue(sTr, sPlus, sMinus);
        }

        int first = 2 * period - 1;
        double sum = 0;
        for (int i = period; i <= first; i++) sum += dx[i];
        out[first] = sum / period;
        for (int i = first + 1; i < n; i++) {
            out[i] = (out[i - 1] * (period - 1) + dx[i]) / period;
        }
        return out;
    }

    private static double dxValue(double sTr, double sPlus, double sMinus) {
        if (sTr == 0) return 0;
        double plusDi = 100.0 * sPlus / sTr;
        double minusDi = 100.0 * sMinus / sTr;
        double total = plusDi + minusDi;
        return total == 0 ? 0 : 100.0 * Math.abs(plusDi - minusDi) / total;
    }

    static double[] bollinger(double[] close, int period, double k, int side) {
        double[] mid = sma(close, period);
        double[] sd = stdDev(close, period);
        double[] out = nans(close.length);
        for (int i = period - 1; i < close.length; i++) {
            out[i] = mid[i] + side * k * sd[i];
        }
        return out;
    }

    static double[] bollingerWidth(double[] close, int period, double k) {
        double[] mid = sma(close, period);
        double[] sd = stdDev(close, period);
        double[] out = nans(close.length);
        for (int i = period - 1; i < close.length; i++) {
            out[i] = mid[i] == 0 ? Double.NaN : (2 * k * sd[i]) / mid[i];
        }
        return out;
    }

    /**
     * Population standard deviation over a sliding window.
     */
    static double[] stdDev(double[] values, int period) {
        double[] out = nans(values.length);
        for (int i = period - 1; i < values.length; i++) {
            double mean = 0;
            for (int j = i - period + 1; j <= i; j++) mean += values[j];
            mean /= period;
            double var = 0;
            for (int j = i - period + 1; j <= i; j++) var += (values[j] - mean) * (values[j] - mean);
            out[i] = Math.sqrt(var / period);
        }
        return out;
    }

    private static double[] nans(int n) {
        double[] out = new double[n];
        Arrays.fill(out, Double.NaN);
        return out;
    }
}
