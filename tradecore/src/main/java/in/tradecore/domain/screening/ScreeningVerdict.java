package in.tradecore.domain.screening;

import java.util.List;

/**
 * Overall screening decision for a signal, with every level's result kept for audit.
 */
public record ScreeningVerdict(
    boolean passed,
    String blockingLevel,
    String reason,
    boolean isCritical,
    List<LevelResult> levelResults
) {
    public ScreeningVerdict {
        levelResults = List.copyOf(levelResults);
    }

    public static ScreeningVerdict pass(String reason, List<LevelResult> results) {
        return new ScreeningVerdict(true, null, reason, false, results);
    }

    public static ScreeningVerdict blocked(LevelResult blocking, List<LevelResult> results) {
        return new ScreeningVerdict(false, blocking.level(), blocking.reason(),
            blocking.severity() == LevelSeverity.CRITICAL, results);
    }
}
