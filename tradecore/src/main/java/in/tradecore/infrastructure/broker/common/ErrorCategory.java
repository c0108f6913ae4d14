package in.tradecore.infrastructure.broker.common;

/**
 * Error taxonomy driving retry and escalation.
 */
public enum ErrorCategory {
    /** Network timeout, rate limit, dropped connection. Retried with backoff. */
    TRANSIENT,
    /** Missing or insufficient bars, non-finite indicator. Symbol skipped this cycle. */
    DATA,
    /** Order or signal rejected on its merits. Not retried. */
    VALIDATION,
    /** Authentication failure. Escalated, new entries suspended. */
    CRITICAL,
    /** Unrecoverable startup failure. */
    FATAL;

    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
