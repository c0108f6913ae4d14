package in.tradecore.service.execution;

/**
 * What currently occupies a symbol's single trade slot.
 */
public enum SlotState {
    /** Signal is being screened and sized. */
    SCREENING,
    /** Breakout waiting for its retest. */
    PENDING_RETEST,
    /** Entry order submitted, fill not yet confirmed. */
    ENTRY_IN_FLIGHT,
    /** Position open in the ledger. */
    POSITION_OPEN,
    /** Closing order in flight; the position stays in the ledger until it fills. */
    EXITING
}
