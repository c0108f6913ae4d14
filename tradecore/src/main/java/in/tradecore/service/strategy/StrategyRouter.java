package in.tradecore.service.strategy;

import in.tradecore.domain.data.Bar;
import in.tradecore.domain.signal.Regime;
import in.tradecore.domain.signal.Signal;
import in.tradecore.infrastructure.broker.data.InsufficientDataException;
import in.tradecore.infrastructure.broker.metrics.EngineMetrics;
import in.tradecore.service.candle.CandleAggregator;
import in.tradecore.service.candle.SessionClock;
import in.tradecore.service.execution.SymbolSlotRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-symbol regime classification and dispatch to exactly one signal generator.
 *
 * Per cycle:
 * 1. Blackout window: no generator runs at all
 * 2. Skip symbols holding a position, pending retest or in-flight entry
 * 3. Skip symbols with too little bar history
 * 4. Classify regime, run the matching variant
 *
 * A data problem for one symbol skips that symbol only.
 * Signals come back highest confidence first.
 */
public final class StrategyRouter {
    private static final Logger log = LoggerFactory.getLogger(StrategyRouter.class);

    private final CandleAggregator candles;
    private final RegimeClassifier classifier;
    private final Map<StrategyVariant, SignalGenerator> generators;
    private final SymbolSlotRegistry slots;
    private final SessionClock sessionClock;
    private final int minBars;
    private final EngineMetrics metrics;

    public StrategyRouter(CandleAggregator candles, RegimeClassifier classifier,
                          Map<StrategyVariant, SignalGenerator> generators, SymbolSlotRegistry slots,
                          SessionClock sessionClock, int minBars, EngineMetrics metrics) {
        for (StrategyVariant variant : StrategyVariant.values()) {
            if (!generators.containsKey(variant)) {
                throw new IllegalArgumentException("No generator registered for " + variant);
            }
        }
        this.candles = candles;
        this.classifier = classifier;
        this.generators = new EnumMap<>(generators);
        this.slots = slots;
        this.sessionClock = sessionClock;
        this.minBars = minBars;
        this.metrics = metrics;
    }

    /**
     * Run one routing cycle.
     *
     * @return Signals ranked by confidence, highest first
     */
    public List<Signal> route(Collection<String> symbols) {
        Instant now = sessionClock.now();
        if (sessionClock.isInBlackout(now)) {
            log.debug("Blackout window at {}, no signal generation", sessionClock.format(now));
            return List.of();
        }

        List<Signal> signals = new ArrayList<>();
        for (String symbol : symbols) {
            routeSymbol(symbol, now).ifPresent(signals::add);
        }
        signals.sort(Comparator.comparingDouble(Signal::confidence).reversed());
        return signals;
    }

    Optional<Signal> routeSymbol(String symbol, Instant now) {
        if (slots.isOccupied(symbol)) {
            log.trace("[{}] Slot occupied, skipping", symbol);
            return Optional.empty();
        }

        List<Bar> bars = candles.snapshot(symbol);
        if (bars.size() < minBars) {
            log.debug("[{}] Insufficient history: {} < {} bars", symbol, bars.size(), minBars);
            return Optional.empty();
        }

        try {
            Regime regime = classifier.classify(symbol, bars);
            StrategyVariant variant = StrategyVariant.forRegime(regime);
            Optional<Signal> signal = generators.get(variant).generate(symbol, bars, now);
            signal.ifPresent(s -> {
                metrics.recordSignal(s.strategyId());
                log.info("[{}] {} signal {} @ {} (stop {}, target {}, confidence {}) - {}",
                    symbol, variant, s.direction(), s.entryPrice(), s.stopLoss(), s.target(),
                    String.format("%.1f", s.confidence()), s.rationale());
            });
            return signal;
        } catch (InsufficientDataException | ArithmeticException e) {
            log.debug("[{}] Skipped this cycle: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }
}
