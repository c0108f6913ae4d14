package in.tradecore.domain.screening;

public enum LevelOutcome {
    PASSED,
    FAILED,
    /** Level threw while evaluating. */
    ERROR,
    /** Advisory failure or error let through because the pipeline is fail-open. */
    PASSED_FAIL_OPEN,
    /** Not evaluated because an earlier advisory level already blocked. */
    SKIPPED
}
