package in.tradecore.service.strategy;

import in.tradecore.config.SessionConfig;
import in.tradecore.domain.signal.Regime;
import in.tradecore.domain.signal.Signal;
import in.tradecore.domain.trade.Direction;
import in.tradecore.infrastructure.broker.data.InsufficientDataException;
import in.tradecore.infrastructure.broker.metrics.PrometheusEngineMetrics;
import in.tradecore.service.candle.CandleAggregator;
import in.tradecore.service.candle.SessionClock;
import in.tradecore.service.execution.SlotState;
import in.tradecore.service.execution.SymbolSlotRegistry;
import in.tradecore.testutil.Bars;
import in.tradecore.testutil.MutableClock;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for StrategyRouter.
 *
 * Tests:
 * - Regime picks exactly one generator
 * - Blackout window suppresses generation
 * - Occupied slots and short history are skipped
 * - Ranking by confidence
 */
@ExtendWith(MockitoExtension.class)
class StrategyRouterTest {

    // 10:00 IST
    private static final Instant MORNING = Instant.parse("2026-03-02T04:30:00Z");
    // 12:30 IST, inside the default blackout
    private static final Instant MIDDAY = Instant.parse("2026-03-02T07:00:00Z");

    @Mock
    private RegimeClassifier classifier;

    @Mock
    private SignalGenerator meanReversion;

    @Mock
    private SignalGenerator breakout;

    private MutableClock clock;
    private CandleAggregator candles;
    private SymbolSlotRegistry slots;
    private CollectorRegistry registry;
    private StrategyRouter router;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(MORNING);
        registry = new CollectorRegistry();
        PrometheusEngineMetrics metrics = new PrometheusEngineMetrics(registry);
        SessionClock sessionClock = new SessionClock(SessionConfig.defaults(), clock);
        candles = new CandleAggregator(sessionClock, 5, 100, 500, metrics);
        slots = new SymbolSlotRegistry();
        router = new StrategyRouter(candles, classifier,
            Map.of(StrategyVariant.MEAN_REVERSION, meanReversion, StrategyVariant.BREAKOUT, breakout),
            slots, sessionClock, 5, metrics);
    }

    private void history(String symbol, int count) {
        candles.mergeHistorical(symbol, Bars.flat(symbol, count, 100, 2));
    }

    private static Signal signal(String symbol, double confidence, String strategyId) {
        return new Signal(symbol, Direction.LONG, new BigDecimal("100"), new BigDecimal("98"),
            new BigDecimal("106"), strategyId, confidence, "test", false, MORNING);
    }

    @Test
    void testTrendingRegimeRunsBreakoutOnly() {
        history("INFY", 10);
        when(classifier.classify(eq("INFY"), anyList())).thenReturn(Regime.TRENDING);
        when(breakout.generate(eq("INFY"), anyList(), eq(MORNING)))
            .thenReturn(Optional.of(signal("INFY", 80, "BREAKOUT")));

        List<Signal> signals = router.route(List.of("INFY"));

        assertEquals(1, signals.size());
        verifyNoInteractions(meanReversion);
        assertEquals(1.0, registry.getSampleValue("engine_signals_total",
            new String[]{"strategy"}, new String[]{"BREAKOUT"}));
    }

    @Test
    void testRangeBoundRegimeRunsMeanReversionOnly() {
        history("INFY", 10);
        when(classifier.classify(eq("INFY"), anyList())).thenReturn(Regime.RANGE_BOUND);
        when(meanReversion.generate(eq("INFY"), anyList(), any())).thenReturn(Optional.empty());

        assertTrue(router.route(List.of("INFY")).isEmpty());
        verifyNoInteractions(breakout);
    }

    @Test
    void testBlackoutSuppressesGeneration() {
        history("INFY", 10);
        clock.set(MIDDAY);

        assertTrue(router.route(List.of("INFY")).isEmpty());
        verifyNoInteractions(classifier, meanReversion, breakout);
    }

    @Test
    void testOccupiedSlotSkipped() {
        history("INFY", 10);
        slots.tryReserve("INFY", SlotState.POSITION_OPEN);

        assertTrue(router.route(List.of("INFY")).isEmpty());
        verifyNoInteractions(classifier);
    }

    @Test
    void testShortHistorySkipped() {
        history("INFY", 4);

        assertTrue(router.route(List.of("INFY")).isEmpty());
        verifyNoInteractions(classifier);
    }

    @Test
    void testDataProblemSkipsOnlyThatSymbol() {
        history("INFY", 10);
        history("TCS", 10);
        when(classifier.classify(eq("INFY"), anyList()))
            .thenThrow(new InsufficientDataException("INFY", "ADX unavailable"));
        when(classifier.classify(eq("TCS"), anyList())).thenReturn(Regime.RANGE_BOUND);
        when(meanReversion.generate(eq("TCS"), anyList(), any()))
            .thenReturn(Optional.of(signal("TCS", 70, "MEAN_REVERSION")));

        List<Signal> signals = router.route(List.of("INFY", "TCS"));

        assertEquals(1, signals.size());
        assertEquals("TCS", signals.get(0).symbol());
    }

    @Test
    void testSignalsRankedByConfidence() {
        history("INFY", 10);
        history("TCS", 10);
        when(classifier.classify(anyString(), anyList())).thenReturn(Regime.RANGE_BOUND);
        when(meanReversion.generate(eq("INFY"), anyList(), any()))
            .thenReturn(Optional.of(signal("INFY", 65, "MEAN_REVERSION")));
        when(meanReversion.generate(eq("TCS"), anyList(), any()))
            .thenReturn(Optional.of(signal("TCS", 90, "MEAN_REVERSION")));

        List<Signal> signals = router.route(List.of("INFY", "TCS"));

        assertEquals(List.of("TCS", "INFY"), signals.stream().map(Signal::symbol).toList());
    }

    @Test
    void testMissingGeneratorRejected() {
        assertThrows(IllegalArgumentException.class, () -> new StrategyRouter(candles, classifier,
            Map.of(StrategyVariant.BREAKOUT, breakout), slots,
            new SessionClock(SessionConfig.defaults(), clock), 5, new PrometheusEngineMetrics(new CollectorRegistry())));
    }
}
