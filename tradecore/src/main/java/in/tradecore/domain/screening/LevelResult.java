package in.tradecore.domain.screening;

/**
 * Result of one screening level for one signal.
 */
public record LevelResult(
    String level,
    LevelSeverity severity,
    LevelOutcome outcome,
    String reason
) {
    public static LevelResult pass(String level, LevelSeverity severity, String reason) {
        return new LevelResult(level, severity, LevelOutcome.PASSED, reason);
    }

    public static LevelResult fail(String level, LevelSeverity severity, String reason) {
        return new LevelResult(level, severity, LevelOutcome.FAILED, reason);
    }

    public boolean blocks() {
        return outcome == LevelOutcome.FAILED || outcome == LevelOutcome.ERROR;
    }
}
