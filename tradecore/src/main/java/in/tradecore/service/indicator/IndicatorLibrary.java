package in.tradecore.service.indicator;

import in.tradecore.domain.data.Bar;

import java.util.List;

/**
 * Pure, stateless technical indicators over a bar sequence.
 *
 * The returned array is aligned with {@code bars}: element i is the indicator value at bar i,
 * {@link Double#NaN} where the indicator has not warmed up yet.
 */
public interface IndicatorLibrary {

    double[] compute(List<Bar> bars, IndicatorSpec spec);

    /**
     * Last value of the computed series, NaN when unavailable.
     */
    default double latest(List<Bar> bars, IndicatorSpec spec) {
        if (bars.isEmpty()) return Double.NaN;
        double[] values = compute(bars, spec);
        return values[values.length - 1];
    }
}
