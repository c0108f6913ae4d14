package in.tradecore.service.screening.level;

import in.tradecore.domain.data.Bar;
import in.tradecore.domain.screening.LevelOutcome;
import in.tradecore.service.screening.MarketState;
import in.tradecore.testutil.Bars;
import in.tradecore.testutil.Signals;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GapAnalysisLevelTest {

    private final GapAnalysisLevel level = new GapAnalysisLevel(0.3);

    private static MarketState state(List<Bar> bars) {
        return new MarketState("INFY", bars, null, null, Instant.EPOCH);
    }

    @Test
    void testUnfilledGapDownJustAboveLongEntryFails() {
        List<Bar> bars = List.of(
            Bars.bar("INFY", 0, 100, 101, 99, 100, 1000),
            Bars.bar("INFY", 1, 97, 97.5, 96, 97, 1000),
            Bars.bar("INFY", 2, 97, 98, 96.5, 97.5, 1000));

        var result = level.evaluate(Signals.longSignal("98", "96", "104"), state(bars), List.of());

        assertEquals(LevelOutcome.FAILED, result.outcome());
        assertTrue(result.reason().contains("gap-down"));
    }

    @Test
    void testFilledGapPasses() {
        List<Bar> bars = List.of(
            Bars.bar("INFY", 0, 100, 101, 99, 100, 1000),
            Bars.bar("INFY", 1, 97, 97.5, 96, 97, 1000),
            Bars.bar("INFY", 2, 97, 100.5, 96.5, 98, 1000));

        assertEquals(LevelOutcome.PASSED,
            level.evaluate(Signals.longSignal("98", "96", "104"), state(bars), List.of()).outcome());
    }

    @Test
    void testUnfilledGapUpJustBelowShortEntryFails() {
        List<Bar> bars = List.of(
            Bars.bar("INFY", 0, 100, 101, 99, 100, 1000),
            Bars.bar("INFY", 1, 103, 104, 102.5, 103, 1000),
            Bars.bar("INFY", 2, 103, 103.5, 102, 102.5, 1000));

        assertEquals(LevelOutcome.FAILED,
            level.evaluate(Signals.shortSignal("102", "104", "96"), state(bars), List.of()).outcome());
    }

    @Test
    void testNoGapPasses() {
        assertEquals(LevelOutcome.PASSED,
            level.evaluate(Signals.longSignal("100", "98", "106"), state(Bars.flat("INFY", 10, 100, 2)), List.of())
                .outcome());
    }
}
