package in.tradecore.service.screening;

import in.tradecore.config.ScreeningConfig;
import in.tradecore.domain.common.EventType;
import in.tradecore.domain.screening.LevelOutcome;
import in.tradecore.domain.screening.LevelResult;
import in.tradecore.domain.screening.LevelSeverity;
import in.tradecore.domain.screening.ScreeningVerdict;
import in.tradecore.domain.signal.Signal;
import in.tradecore.domain.trade.Position;
import in.tradecore.infrastructure.broker.metrics.EngineMetrics;
import in.tradecore.service.core.AuditEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs a signal through the enabled screening levels and produces one verdict.
 *
 * Order of evaluation:
 * 1. Every enabled CRITICAL level. A failure or an exception blocks, whatever the
 *    fail-open setting.
 * 2. Enabled ADVISORY levels in configured order. With fail-open, a failure or an
 *    exception is recorded as PASSED_FAIL_OPEN and logged; otherwise it blocks.
 *
 * Levels after the first blocking one are recorded as SKIPPED. Every verdict is
 * audited with all level results.
 */
public final class ScreeningPipeline {
    private static final Logger log = LoggerFactory.getLogger(ScreeningPipeline.class);

    private final List<ScreeningLevel> levels;
    private final boolean failOpen;
    private final Map<String, Boolean> enabled = new ConcurrentHashMap<>();
    private final AuditEventBus audit;
    private final EngineMetrics metrics;

    private final AtomicLong screened = new AtomicLong();
    private final AtomicLong blocked = new AtomicLong();
    private final Map<String, AtomicLong> blockedByLevel = new ConcurrentHashMap<>();

    public ScreeningPipeline(List<ScreeningLevel> levels, ScreeningConfig config,
                             AuditEventBus audit, EngineMetrics metrics) {
        this.levels = List.copyOf(levels);
        this.failOpen = config.failOpen();
        this.audit = audit;
        this.metrics = metrics;
        for (ScreeningLevel level : this.levels) {
            enabled.put(level.name(), config.isLevelEnabled(level.name()));
        }
        log.info("Screening pipeline ready: {} levels enabled, failOpen={}", enabledLevels().size(), failOpen);
    }

    public ScreeningVerdict screen(Signal signal, MarketState state, List<Position> openPositions) {
        List<LevelResult> results = new ArrayList<>();
        LevelResult blocking = null;

        // ═══ Critical levels ═══
        for (ScreeningLevel level : levels) {
            if (level.severity() != LevelSeverity.CRITICAL || !isEnabled(level.name())) {
                continue;
            }
            if (blocking != null) {
                results.add(skipped(level));
                continue;
            }
            LevelResult result = run(level, signal, state, openPositions);
            results.add(result);
            if (result.blocks()) {
                blocking = result;
            }
        }

        // ═══ Advisory levels ═══
        for (ScreeningLevel level : levels) {
            if (level.severity() != LevelSeverity.ADVISORY || !isEnabled(level.name())) {
                continue;
            }
            if (blocking != null) {
                results.add(skipped(level));
                continue;
            }
            LevelResult result = run(level, signal, state, openPositions);
            if (result.blocks() && failOpen) {
                log.warn("[{}] {} {} ignored (fail-open): {}",
                    signal.symbol(), level.name(), result.outcome(), result.reason());
                result = new LevelResult(result.level(), result.severity(),
                    LevelOutcome.PASSED_FAIL_OPEN, result.reason());
            }
            results.add(result);
            if (result.blocks()) {
                blocking = result;
            }
        }

        ScreeningVerdict verdict = blocking == null
            ? ScreeningVerdict.pass(passReason(results), results)
            : ScreeningVerdict.blocked(blocking, results);
        record(signal, verdict);
        return verdict;
    }

    private LevelResult run(ScreeningLevel level, Signal signal, MarketState state, List<Position> openPositions) {
        try {
            LevelResult result = level.evaluate(signal, state, openPositions);
            if (result == null) {
                return new LevelResult(level.name(), level.severity(), LevelOutcome.ERROR, "Level returned no result");
            }
            return result;
        } catch (RuntimeException e) {
            log.error("[{}] Screening level {} failed: {}", signal.symbol(), level.name(), e.getMessage(), e);
            return new LevelResult(level.name(), level.severity(), LevelOutcome.ERROR,
                "Level error: " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static LevelResult skipped(ScreeningLevel level) {
        return new LevelResult(level.name(), level.severity(), LevelOutcome.SKIPPED, "Not evaluated");
    }

    private static String passReason(List<LevelResult> results) {
        long warnings = results.stream().filter(r -> r.outcome() == LevelOutcome.PASSED_FAIL_OPEN).count();
        return warnings == 0
            ? "All " + results.size() + " levels passed"
            : "Passed with " + warnings + " advisory warning(s)";
    }

    private void record(Signal signal, ScreeningVerdict verdict) {
        screened.incrementAndGet();
        if (!verdict.passed()) {
            blocked.incrementAndGet();
            blockedByLevel.computeIfAbsent(verdict.blockingLevel(), k -> new AtomicLong()).incrementAndGet();
            log.info("[{}] {} signal BLOCKED by {}{}: {}", signal.symbol(), signal.strategyId(),
                verdict.blockingLevel(), verdict.isCritical() ? " (critical)" : "", verdict.reason());
        } else {
            log.info("[{}] {} signal passed screening: {}", signal.symbol(), signal.strategyId(), verdict.reason());
        }
        metrics.recordScreeningVerdict(verdict.passed(), verdict.blockingLevel());

        Map<String, Object> levelOutcomes = new LinkedHashMap<>();
        for (LevelResult r : verdict.levelResults()) {
            levelOutcomes.put(r.level(), r.outcome().name() + ": " + r.reason());
        }
        Map<String, Object> payload = new HashMap<>();
        payload.put("strategy", signal.strategyId());
        payload.put("direction", signal.direction().name());
        payload.put("passed", verdict.passed());
        payload.put("blockingLevel", verdict.blockingLevel() == null ? "" : verdict.blockingLevel());
        payload.put("critical", verdict.isCritical());
        payload.put("reason", verdict.reason());
        payload.put("levels", levelOutcomes);
        audit.emit(EventType.SCREENING_VERDICT, signal.symbol(), payload);
    }

    // ═══ Runtime control ═══

    public boolean isEnabled(String levelName) {
        return enabled.getOrDefault(levelName, Boolean.FALSE);
    }

    /**
     * Enable or disable a level at runtime.
     *
     * @throws IllegalArgumentException for an unknown level name
     */
    public void setLevelEnabled(String levelName, boolean on) {
        if (!enabled.containsKey(levelName)) {
            throw new IllegalArgumentException("Unknown screening level: " + levelName);
        }
        enabled.put(levelName, on);
        log.info("Screening level {} {}", levelName, on ? "enabled" : "disabled");
    }

    public List<String> enabledLevels() {
        return levels.stream().map(ScreeningLevel::name).filter(this::isEnabled).toList();
    }

    public boolean isFailOpen() {
        return failOpen;
    }

    public long getScreenedCount() {
        return screened.get();
    }

    public long getBlockedCount() {
        return blocked.get();
    }

    public Map<String, Long> getBlockedByLevel() {
        Map<String, Long> copy = new LinkedHashMap<>();
        blockedByLevel.forEach((k, v) -> copy.put(k, v.get()));
        return copy;
    }
}
