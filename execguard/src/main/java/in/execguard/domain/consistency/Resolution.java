package in.execguard.domain.consistency;

/**
 * How a discrepancy is resolved when auto-correction is enabled.
 */
public enum Resolution {
    BRIDGE_WINS,    // Local ledger adopts the bridge value
    LOCAL_WINS,     // Local ledger keeps its value
    KEEP_EARLIEST,  // Earliest recorded entry kept, later copies removed
    REPORT_ONLY     // Never corrected automatically
}
