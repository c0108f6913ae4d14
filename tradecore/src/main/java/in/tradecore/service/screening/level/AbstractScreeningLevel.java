package in.tradecore.service.screening.level;

import in.tradecore.domain.screening.LevelResult;
import in.tradecore.domain.screening.LevelSeverity;
import in.tradecore.service.screening.ScreeningLevel;

/**
 * Base class carrying the level's name and severity.
 */
public abstract class AbstractScreeningLevel implements ScreeningLevel {

    private final String name;
    private final LevelSeverity severity;

    protected AbstractScreeningLevel(String name, LevelSeverity severity) {
        this.name = name;
        this.severity = severity;
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final LevelSeverity severity() {
        return severity;
    }

    protected LevelResult pass(String reason) {
        return LevelResult.pass(name, severity, reason);
    }

    protected LevelResult fail(String reason) {
        return LevelResult.fail(name, severity, reason);
    }
}
