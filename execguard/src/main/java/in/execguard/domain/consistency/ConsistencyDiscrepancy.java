package in.execguard.domain.consistency;

import java.time.Instant;

/**
 * One detected divergence between the bridge and the local ledger.
 *
 * Subject is the field name, symbol or order id the discrepancy is about.
 * Magnitude is the absolute difference for numeric fields and 1.0 otherwise.
 */
public record ConsistencyDiscrepancy(
    DiscrepancyType type,
    String strategyId,
    String subject,
    double magnitude,
    Object bridgeValue,
    Object localValue,
    Severity severity,
    Instant detectedAt,
    Resolution resolution,
    boolean correctionApplied
) {
    public ConsistencyDiscrepancy {
        if (type == null) {
            throw new IllegalArgumentException("Discrepancy type cannot be null");
        }
        if (severity == null) severity = type.severity();
        if (resolution == null) resolution = type.resolution();
        if (detectedAt == null) detectedAt = Instant.now();
    }

    public static ConsistencyDiscrepancy of(DiscrepancyType type, String strategyId, String subject,
                                            double magnitude, Object bridgeValue, Object localValue) {
        return new ConsistencyDiscrepancy(type, strategyId, subject, magnitude, bridgeValue, localValue,
            type.severity(), Instant.now(), type.resolution(), false);
    }

    public ConsistencyDiscrepancy corrected() {
        return new ConsistencyDiscrepancy(type, strategyId, subject, magnitude, bridgeValue, localValue,
            severity, detectedAt, resolution, true);
    }

    /**
     * Key identifying the same discrepancy across passes.
     */
    public String key() {
        return type + ":" + strategyId + ":" + subject;
    }
}
