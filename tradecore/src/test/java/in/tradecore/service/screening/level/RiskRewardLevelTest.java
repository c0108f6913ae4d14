package in.tradecore.service.screening.level;

import in.tradecore.domain.screening.LevelOutcome;
import in.tradecore.service.screening.MarketState;
import in.tradecore.testutil.Signals;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RiskRewardLevelTest {

    private final RiskRewardLevel level = new RiskRewardLevel(1.5);
    private final MarketState state = new MarketState("INFY", List.of(), null, null, Instant.EPOCH);

    @Test
    void testSufficientRewardPasses() {
        assertEquals(LevelOutcome.PASSED,
            level.evaluate(Signals.longSignal("100", "98", "106"), state, List.of()).outcome());
    }

    @Test
    void testPoorRewardFails() {
        var result = level.evaluate(Signals.shortSignal("100", "102", "99"), state, List.of());

        assertEquals(LevelOutcome.FAILED, result.outcome());
        assertTrue(result.reason().contains("below minimum"));
    }

    @Test
    void testMissingTargetFails() {
        assertEquals(LevelOutcome.FAILED,
            level.evaluate(Signals.longSignal("100", "98", null), state, List.of()).outcome());
    }
}
