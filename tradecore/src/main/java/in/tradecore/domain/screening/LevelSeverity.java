package in.tradecore.domain.screening;

/**
 * CRITICAL levels block unconditionally. ADVISORY levels honor the fail-open setting.
 */
public enum LevelSeverity {
    CRITICAL,
    ADVISORY
}
