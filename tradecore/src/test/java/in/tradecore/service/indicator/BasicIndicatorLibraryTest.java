package in.tradecore.service.indicator;

import in.tradecore.domain.data.Bar;
import in.tradecore.testutil.Bars;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BasicIndicatorLibraryTest {

    private static final double EPS = 1e-9;

    private final IndicatorLibrary library = new BasicIndicatorLibrary();

    @Test
    void testSmaWarmsUpAfterPeriod() {
        List<Bar> bars = Bars.fromCloses("INFY", 1, 2, 3, 4, 5);

        double[] sma = library.compute(bars, IndicatorSpec.sma(3));

        assertTrue(Double.isNaN(sma[0]));
        assertTrue(Double.isNaN(sma[1]));
        assertEquals(2.0, sma[2], EPS);
        assertEquals(4.0, sma[4], EPS);
        assertEquals(sma.length, bars.size(), "Output aligned with input");
    }

    @Test
    void testEmaSeededWithFirstValue() {
        double[] ema = library.compute(Bars.fromCloses("INFY", 10, 20), IndicatorSpec.ema(3));

        assertEquals(10.0, ema[0], EPS);
        assertEquals(15.0, ema[1], EPS, "alpha = 2 / (3 + 1)");
    }

    @Test
    void testAtrOfConstantRange() {
        double atr = library.latest(Bars.flat("INFY", 20, 100, 4), IndicatorSpec.atr(14));

        assertEquals(4.0, atr, EPS);
    }

    @Test
    void testRsiExtremes() {
        assertEquals(100.0, library.latest(Bars.trend("INFY", 20, 100, 1), IndicatorSpec.rsi(14)), EPS);
        assertEquals(0.0, library.latest(Bars.trend("INFY", 20, 100, -1), IndicatorSpec.rsi(14)), EPS);
        assertEquals(50.0, library.latest(Bars.flat("INFY", 20, 100, 2), IndicatorSpec.rsi(14)), EPS);
    }

    @Test
    void testRsiNeedsMoreThanPeriodBars() {
        assertTrue(Double.isNaN(library.latest(Bars.trend("INFY", 14, 100, 1), IndicatorSpec.rsi(14))));
    }

    @Test
    void testAdxHighForSteadyTrend() {
        double adx = library.latest(Bars.trend("INFY", 60, 100, 2), IndicatorSpec.adx(14));

        assertTrue(adx > 50, "Steady trend should score a strong ADX, got " + adx);
    }

    @Test
    void testAdxNeedsTwoPeriods() {
        assertTrue(Double.isNaN(library.latest(Bars.trend("INFY", 27, 100, 2), IndicatorSpec.adx(14))));
        assertFalse(Double.isNaN(library.latest(Bars.trend("INFY", 28, 100, 2), IndicatorSpec.adx(14))));
    }

    @Test
    void testBollingerBandsCollapseOnFlatSeries() {
        List<Bar> bars = Bars.flat("INFY", 25, 100, 2);

        assertEquals(100.0, library.latest(bars, IndicatorSpec.bollingerUpper(20, 2.0)), EPS);
        assertEquals(100.0, library.latest(bars, IndicatorSpec.bollingerLower(20, 2.0)), EPS);
        assertEquals(0.0, library.latest(bars, IndicatorSpec.bollingerWidth(20, 2.0)), EPS);
    }

    @Test
    void testBollingerBandsAroundMean() {
        // closes 1,3 alternate: mean 2, population sd 1
        List<Bar> bars = Bars.fromCloses("INFY", 1, 3, 1, 3);

        assertEquals(4.0, library.latest(bars, IndicatorSpec.bollingerUpper(4, 2.0)), EPS);
        assertEquals(0.0, library.latest(bars, IndicatorSpec.bollingerLower(4, 2.0)), EPS);
        assertEquals(2.0, library.latest(bars, IndicatorSpec.bollingerWidth(4, 2.0)), EPS);
    }

    @Test
    void testLatestOnEmptyIsNaN() {
        assertTrue(Double.isNaN(library.latest(List.of(), IndicatorSpec.sma(3))));
    }

    @Test
    void testIndicatorSpecRejectsNonPositivePeriod() {
        assertThrows(IllegalArgumentException.class, () -> IndicatorSpec.sma(0));
    }
}
