package in.tradecore.domain.monitoring;

/**
 * Alert severity levels
 */
public enum AlertLevel {
    CRITICAL,  // Exposure at risk, operator action needed now
    HIGH,      // Engine degraded, investigate soon
    MEDIUM,    // Discrepancy worth reviewing
    LOW,       // Informational warning
    INFO       // Informational only
}
