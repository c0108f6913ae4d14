package in.tradecore.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Root engine configuration, bound from {@code engine-config.json}.
 */
public record EngineConfig(
    @JsonProperty("symbols")
    List<String> symbols,

    @JsonProperty("tradingMode")
    TradingMode tradingMode,

    @JsonProperty("session")
    SessionConfig session,

    @JsonProperty("schedule")
    ScheduleConfig schedule,

    @JsonProperty("candles")
    CandleConfig candles,

    @JsonProperty("regime")
    RegimeConfig regime,

    @JsonProperty("strategy")
    StrategyConfig strategy,

    @JsonProperty("screening")
    ScreeningConfig screening,

    @JsonProperty("retest")
    RetestConfig retest,

    @JsonProperty("stops")
    StopConfig stops,

    @JsonProperty("risk")
    RiskConfig risk,

    @JsonProperty("retry")
    RetryConfig retry,

    @JsonProperty("reconciliation")
    ReconciliationConfig reconciliation,

    @JsonProperty("audit")
    AuditConfig audit
) {
    public static EngineConfig defaults(List<String> symbols) {
        return new EngineConfig(
            symbols,
            TradingMode.PAPER,
            SessionConfig.defaults(),
            ScheduleConfig.defaults(),
            CandleConfig.defaults(),
            RegimeConfig.defaults(),
            StrategyConfig.defaults(),
            ScreeningConfig.defaults(),
            RetestConfig.defaults(),
            StopConfig.defaults(),
            RiskConfig.defaults(),
            RetryConfig.defaults(),
            ReconciliationConfig.defaults(),
            AuditConfig.defaults()
        );
    }

    public EngineConfig withTradingMode(TradingMode mode) {
        return new EngineConfig(symbols, mode, session, schedule, candles, regime, strategy,
            screening, retest, stops, risk, retry, reconciliation, audit);
    }

    public EngineConfig withScreening(ScreeningConfig newScreening) {
        return new EngineConfig(symbols, tradingMode, session, schedule, candles, regime, strategy,
            newScreening, retest, stops, risk, retry, reconciliation, audit);
    }

    /**
     * Validate every section.
     *
     * @return list of problems, empty when the configuration is usable
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (symbols == null || symbols.isEmpty()) errors.add("symbols: at least one instrument is required");
        if (tradingMode == null) errors.add("tradingMode: required (PAPER or LIVE)");
        check(errors, "session", session != null && session.isValid());
        check(errors, "schedule", schedule != null && schedule.isValid());
        check(errors, "candles", candles != null && candles.isValid());
        check(errors, "regime", regime != null && regime.isValid());
        check(errors, "strategy", strategy != null && strategy.isValid());
        check(errors, "screening", screening != null && screening.isValid());
        check(errors, "retest", retest != null && retest.isValid());
        check(errors, "stops", stops != null && stops.isValid());
        check(errors, "risk", risk != null && risk.isValid());
        check(errors, "retry", retry != null && retry.isValid());
        check(errors, "reconciliation", reconciliation != null && reconciliation.isValid());
        check(errors, "audit", audit != null && audit.isValid());
        return errors;
    }

    private static void check(List<String> errors, String section, boolean valid) {
        if (!valid) {
            errors.add(section + ": missing or invalid values");
        }
    }
}
