package in.execguard.domain.consistency;

/**
 * Kinds of divergence between the bridge view and the local ledger.
 *
 * Each type carries the severity and resolution applied when it is detected.
 */
public enum DiscrepancyType {
    // Field drift found by the synchronizer
    PNL_MISMATCH(Severity.HIGH, Resolution.BRIDGE_WINS),
    TRADE_COUNT_MISMATCH(Severity.MEDIUM, Resolution.BRIDGE_WINS),
    PARAMETER_DRIFT(Severity.MEDIUM, Resolution.BRIDGE_WINS),
    TIMESTAMP_SKEW(Severity.LOW, Resolution.BRIDGE_WINS),

    // Structural problems found by the consistency sweep
    DUPLICATE_TRADE(Severity.HIGH, Resolution.KEEP_EARLIEST),
    POSITION_SIGN_MISMATCH(Severity.HIGH, Resolution.BRIDGE_WINS),
    ORPHANED_ORDER(Severity.MEDIUM, Resolution.LOCAL_WINS),
    INVALID_FILL_RATE(Severity.MEDIUM, Resolution.REPORT_ONLY),
    TRADE_COUNT_LOGIC_ERROR(Severity.HIGH, Resolution.REPORT_ONLY),
    END_BEFORE_START(Severity.MEDIUM, Resolution.REPORT_ONLY);

    private final Severity severity;
    private final Resolution resolution;

    DiscrepancyType(Severity severity, Resolution resolution) {
        this.severity = severity;
        this.resolution = resolution;
    }

    public Severity severity() {
        return severity;
    }

    public Resolution resolution() {
        return resolution;
    }
}
