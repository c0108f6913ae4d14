package in.tradecore.domain.trade;

/**
 * Why a position was closed.
 */
public enum ExitReason {
    STOP_LOSS("Stop-loss breached"),
    TARGET("Target reached"),
    SESSION_END("End-of-session flatten"),
    RECONCILIATION("No matching venue position");

    private final String description;

    ExitReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
