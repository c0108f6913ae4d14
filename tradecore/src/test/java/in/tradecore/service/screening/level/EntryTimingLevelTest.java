package in.tradecore.service.screening.level;

import in.tradecore.domain.data.Bar;
import in.tradecore.domain.screening.LevelOutcome;
import in.tradecore.domain.trade.Direction;
import in.tradecore.service.screening.MarketState;
import in.tradecore.testutil.Bars;
import in.tradecore.testutil.Signals;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EntryTimingLevelTest {

    private static final Instant NOW = Instant.parse("2026-03-02T04:30:00Z");

    private final EntryTimingLevel level = new EntryTimingLevel(1.0);
    // recent highs 101, lows 99
    private final List<Bar> bars = Bars.flat("INFY", 10, 100, 2);

    private MarketState at(String price) {
        return new MarketState("INFY", bars, new BigDecimal(price), null, NOW);
    }

    @Test
    void testCloseToSwingHighPasses() {
        assertEquals(LevelOutcome.PASSED,
            level.evaluate(Signals.longSignal("101.5", "99", "108"), at("101.5"), List.of()).outcome());
    }

    @Test
    void testChasingLongFails() {
        var result = level.evaluate(Signals.longSignal("103", "100", "112"), at("103"), List.of());

        assertEquals(LevelOutcome.FAILED, result.outcome());
        assertTrue(result.reason().contains("avoid chasing"));
    }

    @Test
    void testChasingShortFails() {
        assertEquals(LevelOutcome.FAILED,
            level.evaluate(Signals.shortSignal("97", "100", "88"), at("97"), List.of()).outcome());
    }

    @Test
    void testRetestSignalsAlwaysPass() {
        assertEquals(LevelOutcome.PASSED, level.evaluate(
            Signals.breakout("INFY", Direction.LONG, "101", "98", "110"), at("105"), List.of()).outcome());
    }

    @Test
    void testShortHistoryPasses() {
        MarketState state = new MarketState("INFY", Bars.flat("INFY", 5, 100, 2), new BigDecimal("110"), null, NOW);

        assertEquals(LevelOutcome.PASSED,
            level.evaluate(Signals.longSignal("110", "105", "125"), state, List.of()).outcome());
    }
}
