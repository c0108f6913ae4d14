package in.tradecore.service.execution;

import in.tradecore.config.RiskConfig;
import in.tradecore.infrastructure.broker.data.InsufficientDataException;
import in.tradecore.testutil.Signals;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class PositionSizerTest {

    private final PositionSizer sizer = new PositionSizer(RiskConfig.defaults());

    @Test
    void testFixedFractionalSize() {
        // 1% of 1,000,000 = 10,000 risk budget / 2.00 per unit
        assertEquals(5000, sizer.size(Signals.longSignal("100", "98", "106")));
    }

    @Test
    void testFloorsFractionalQuantity() {
        // 10,000 / 3 = 3333.33
        assertEquals(3333, sizer.size(Signals.shortSignal("100", "103", "91")));
    }

    @Test
    void testAtLeastOneUnit() {
        PositionSizer tiny = new PositionSizer(new RiskConfig(new BigDecimal("1000"), 1.0, 5, 15.0, 20.0, 20, 300, 2.0));

        assertEquals(1, tiny.size(Signals.longSignal("5000", "4900", "5300")));
    }

    @Test
    void testZeroRiskRejected() {
        assertThrows(InsufficientDataException.class, () -> sizer.size(Signals.longSignal("100", "100", "106")));
    }
}
