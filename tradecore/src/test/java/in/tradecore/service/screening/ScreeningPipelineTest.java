package in.tradecore.service.screening;

import in.tradecore.config.ScreeningConfig;
import in.tradecore.domain.common.EventType;
import in.tradecore.domain.screening.LevelOutcome;
import in.tradecore.domain.screening.LevelResult;
import in.tradecore.domain.screening.LevelSeverity;
import in.tradecore.domain.screening.ScreeningVerdict;
import in.tradecore.domain.signal.Signal;
import in.tradecore.domain.trade.Direction;
import in.tradecore.domain.trade.Position;
import in.tradecore.infrastructure.broker.metrics.PrometheusEngineMetrics;
import in.tradecore.service.core.AuditEventBus;
import in.tradecore.testutil.RecordingAuditSink;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ScreeningPipeline.
 *
 * Tests:
 * - Critical failures block regardless of fail-open
 * - Advisory failures pass with a warning under fail-open, block otherwise
 * - Exceptions become ERROR results
 * - Levels after the blocking one are skipped
 * - Runtime enable/disable
 */
class ScreeningPipelineTest {

    private static final Instant NOW = Instant.parse("2026-03-02T04:30:00Z");

    private CollectorRegistry registry;
    private PrometheusEngineMetrics metrics;
    private AuditEventBus audit;
    private RecordingAuditSink sink;
    private Signal signal;
    private MarketState state;

    @BeforeEach
    void setUp() {
        registry = new CollectorRegistry();
        metrics = new PrometheusEngineMetrics(registry);
        sink = new RecordingAuditSink();
        audit = new AuditEventBus(sink, 100, Clock.fixed(NOW, ZoneOffset.UTC), metrics);
        signal = new Signal("INFY", Direction.LONG, new BigDecimal("100"), new BigDecimal("98"),
            new BigDecimal("106"), "MEAN_REVERSION", 70, "test", false, NOW);
        state = new MarketState("INFY", List.of(), new BigDecimal("100"), null, NOW);
    }

    private static ScreeningConfig config(boolean failOpen, Map<String, Boolean> levels) {
        ScreeningConfig d = ScreeningConfig.defaults();
        return new ScreeningConfig(failOpen, levels, d.blacklist(), d.minRewardToRisk(),
            d.fastEmaPeriod(), d.slowEmaPeriod(), d.bollingerPeriod(), d.squeezeWidthThreshold(),
            d.srLookback(), d.srProximityPercent(), d.minGapPercent(), d.nrbLookback(), d.nrbPercentile(),
            d.breadthNeutralBand(), d.minHeuristicScore(), d.maxChasePercent());
    }

    private ScreeningPipeline pipeline(boolean failOpen, ScreeningLevel... levels) {
        return new ScreeningPipeline(List.of(levels), config(failOpen, Map.of()), audit, metrics);
    }

    @Test
    @DisplayName("All passing levels produce a pass verdict")
    void testAllPass() {
        ScreeningVerdict verdict = pipeline(true,
            FixedLevel.passing("A", LevelSeverity.CRITICAL),
            FixedLevel.passing("B", LevelSeverity.ADVISORY)).screen(signal, state, List.of());

        assertTrue(verdict.passed());
        assertNull(verdict.blockingLevel());
        assertEquals("All 2 levels passed", verdict.reason());
    }

    @Test
    @DisplayName("Critical failure blocks even when fail-open")
    void testCriticalFailureBlocksUnderFailOpen() {
        FixedLevel advisory = FixedLevel.passing("ADV", LevelSeverity.ADVISORY);
        ScreeningVerdict verdict = pipeline(true,
            FixedLevel.failing("RISK", LevelSeverity.CRITICAL, "exposure limit"),
            advisory).screen(signal, state, List.of());

        assertFalse(verdict.passed());
        assertTrue(verdict.isCritical());
        assertEquals("RISK", verdict.blockingLevel());
        assertEquals("exposure limit", verdict.reason());
        assertEquals(LevelOutcome.SKIPPED, verdict.levelResults().get(1).outcome());
        assertEquals(0, advisory.calls.get(), "Levels after the block are not evaluated");
    }

    @Test
    @DisplayName("Advisory-only failure passes under fail-open")
    void testAdvisoryFailurePassesUnderFailOpen() {
        ScreeningVerdict verdict = pipeline(true,
            FixedLevel.passing("RISK", LevelSeverity.CRITICAL),
            FixedLevel.failing("TREND", LevelSeverity.ADVISORY, "against trend")).screen(signal, state, List.of());

        assertTrue(verdict.passed());
        assertEquals(LevelOutcome.PASSED_FAIL_OPEN, verdict.levelResults().get(1).outcome());
        assertEquals("Passed with 1 advisory warning(s)", verdict.reason());
    }

    @Test
    @DisplayName("Advisory failure blocks when fail-closed")
    void testAdvisoryFailureBlocksWhenFailClosed() {
        ScreeningVerdict verdict = pipeline(false,
            FixedLevel.failing("TREND", LevelSeverity.ADVISORY, "against trend"),
            FixedLevel.passing("GAP", LevelSeverity.ADVISORY)).screen(signal, state, List.of());

        assertFalse(verdict.passed());
        assertFalse(verdict.isCritical());
        assertEquals("TREND", verdict.blockingLevel());
        assertEquals(LevelOutcome.SKIPPED, verdict.levelResults().get(1).outcome());
    }

    @Test
    void testCriticalLevelsRunBeforeAdvisory() {
        ScreeningVerdict verdict = pipeline(true,
            FixedLevel.passing("ADV", LevelSeverity.ADVISORY),
            FixedLevel.passing("CRIT", LevelSeverity.CRITICAL)).screen(signal, state, List.of());

        assertEquals("CRIT", verdict.levelResults().get(0).level());
        assertEquals("ADV", verdict.levelResults().get(1).level());
    }

    @Test
    void testExceptionInCriticalLevelBlocksAsError() {
        ScreeningVerdict verdict = pipeline(true,
            FixedLevel.throwing("RISK", LevelSeverity.CRITICAL)).screen(signal, state, List.of());

        assertFalse(verdict.passed());
        assertEquals(LevelOutcome.ERROR, verdict.levelResults().get(0).outcome());
        assertTrue(verdict.reason().contains("IllegalStateException"));
    }

    @Test
    void testExceptionInAdvisoryLevelFailsOpen() {
        ScreeningVerdict verdict = pipeline(true,
            FixedLevel.throwing("TREND", LevelSeverity.ADVISORY)).screen(signal, state, List.of());

        assertTrue(verdict.passed());
        assertEquals(LevelOutcome.PASSED_FAIL_OPEN, verdict.levelResults().get(0).outcome());
    }

    @Test
    void testNullResultIsError() {
        ScreeningLevel broken = new FixedLevel("NULL", LevelSeverity.CRITICAL, null, false);

        ScreeningVerdict verdict = pipeline(true, broken).screen(signal, state, List.of());

        assertFalse(verdict.passed());
        assertEquals(LevelOutcome.ERROR, verdict.levelResults().get(0).outcome());
    }

    @Test
    void testDisabledLevelNotEvaluated() {
        FixedLevel disabled = FixedLevel.failing("GAP", LevelSeverity.CRITICAL, "gap");
        ScreeningPipeline pipeline = new ScreeningPipeline(List.of(disabled),
            config(false, Map.of("GAP", false)), audit, metrics);

        ScreeningVerdict verdict = pipeline.screen(signal, state, List.of());

        assertTrue(verdict.passed());
        assertTrue(verdict.levelResults().isEmpty());
        assertEquals(0, disabled.calls.get());
        assertTrue(pipeline.enabledLevels().isEmpty());
    }

    @Test
    void testRuntimeToggle() {
        ScreeningPipeline pipeline = pipeline(false, FixedLevel.failing("GAP", LevelSeverity.ADVISORY, "gap"));
        assertFalse(pipeline.screen(signal, state, List.of()).passed());

        pipeline.setLevelEnabled("GAP", false);
        assertTrue(pipeline.screen(signal, state, List.of()).passed());

        assertThrows(IllegalArgumentException.class, () -> pipeline.setLevelEnabled("NOPE", true));
    }

    @Test
    void testVerdictsCountedMeasuredAndAudited() {
        ScreeningPipeline pipeline = pipeline(false, FixedLevel.failing("GAP", LevelSeverity.ADVISORY, "gap"));
        audit.start();

        pipeline.screen(signal, state, List.of());
        pipeline.screen(signal, state, List.of());
        audit.stop();

        assertEquals(2, pipeline.getScreenedCount());
        assertEquals(2, pipeline.getBlockedCount());
        assertEquals(Map.of("GAP", 2L), pipeline.getBlockedByLevel());
        assertEquals(2.0, registry.getSampleValue("engine_screening_verdicts_total",
            new String[]{"outcome", "level"}, new String[]{"blocked", "GAP"}));
        assertEquals(2, sink.ofType(EventType.SCREENING_VERDICT).size());
        assertEquals(false, sink.events().get(0).payload().get("passed"));
    }

    private static final class FixedLevel implements ScreeningLevel {
        private final String name;
        private final LevelSeverity severity;
        private final LevelResult result;
        private final boolean throwing;
        final AtomicInteger calls = new AtomicInteger();

        FixedLevel(String name, LevelSeverity severity, LevelResult result, boolean throwing) {
            this.name = name;
            this.severity = severity;
            this.result = result;
            this.throwing = throwing;
        }

        static FixedLevel passing(String name, LevelSeverity severity) {
            return new FixedLevel(name, severity, LevelResult.pass(name, severity, "ok"), false);
        }

        static FixedLevel failing(String name, LevelSeverity severity, String reason) {
            return new FixedLevel(name, severity, LevelResult.fail(name, severity, reason), false);
        }

        static FixedLevel throwing(String name, LevelSeverity severity) {
            return new FixedLevel(name, severity, null, true);
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public LevelSeverity severity() {
            return severity;
        }

        @Override
        public LevelResult evaluate(Signal signal, MarketState state, List<Position> openPositions) {
            calls.incrementAndGet();
            if (throwing) {
                throw new IllegalStateException("indicator blew up");
            }
            return result;
        }
    }
}
