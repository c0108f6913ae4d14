package in.tradecore.infrastructure.broker.metrics;

import in.tradecore.domain.order.OrderPurpose;
import in.tradecore.domain.trade.ExitReason;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PrometheusEngineMetricsTest {

    private CollectorRegistry registry;
    private PrometheusEngineMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new CollectorRegistry();
        metrics = new PrometheusEngineMetrics(registry);
    }

    @Test
    void testLabelledCounters() {
        metrics.recordOrder(OrderPurpose.ENTRY, "FILLED");
        metrics.recordOrder(OrderPurpose.ENTRY, "FILLED");
        metrics.recordOrder(OrderPurpose.EXIT, "FAILED");
        metrics.recordPositionClosed(ExitReason.TARGET);
        metrics.recordScreeningVerdict(false, "RISK_REWARD");
        metrics.recordScreeningVerdict(true, null);

        assertEquals(2.0, registry.getSampleValue("engine_orders_total",
            new String[]{"purpose", "outcome"}, new String[]{"ENTRY", "FILLED"}));
        assertEquals(1.0, registry.getSampleValue("engine_orders_total",
            new String[]{"purpose", "outcome"}, new String[]{"EXIT", "FAILED"}));
        assertEquals(1.0, registry.getSampleValue("engine_positions_closed_total",
            new String[]{"reason"}, new String[]{"TARGET"}));
        assertEquals(1.0, registry.getSampleValue("engine_screening_verdicts_total",
            new String[]{"outcome", "level"}, new String[]{"blocked", "RISK_REWARD"}));
        assertEquals(1.0, registry.getSampleValue("engine_screening_verdicts_total",
            new String[]{"outcome", "level"}, new String[]{"passed", "none"}));
    }

    @Test
    void testGaugesAndZeroDropsIgnored() {
        metrics.setOpenPositions(3);
        metrics.setFeedConnected(true);
        metrics.recordTicksDropped("INFY", 0);
        metrics.recordTicksDropped("INFY", 4);

        assertEquals(3.0, registry.getSampleValue("engine_open_positions"));
        assertEquals(1.0, registry.getSampleValue("engine_feed_connected"));
        assertEquals(4.0, registry.getSampleValue("engine_ticks_dropped_total",
            new String[]{"symbol"}, new String[]{"INFY"}));
    }

    @Test
    void testScrapeContainsLoopHistogram() {
        metrics.recordLoopRun("monitor", Duration.ofMillis(12));

        assertEquals(1.0, registry.getSampleValue("engine_loop_duration_seconds_count",
            new String[]{"loop"}, new String[]{"monitor"}));
        String text = metrics.scrape();
        assertTrue(text.contains("engine_loop_duration_seconds_bucket"));
    }
}
