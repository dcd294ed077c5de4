package in.execguard.domain.event;

/**
 * Event kinds produced by the resilience components.
 */
public enum ResilienceEventType {
    RECOVERY_STARTED("recovery-started"),
    RECOVERY_SUCCESSFUL("recovery-successful"),
    RECOVERY_FAILED("recovery-failed"),
    RECOVERY_STOPPED("recovery-stopped"),
    POST_RECOVERY_VALIDATION_SUCCESSFUL("post-recovery-validation-successful"),
    POST_RECOVERY_VALIDATION_FAILED("post-recovery-validation-failed"),
    FAILOVER("failover"),
    RECOVERY_COMPLETED("recovery-completed"),
    SYNCHRONIZATION_COMPLETED("synchronization-completed"),
    SYNCHRONIZATION_FAILED("synchronization-failed"),
    DISCREPANCY_DETECTED("discrepancy-detected"),
    CORRECTION_APPLIED("correction-applied"),
    CONSISTENCY_CHECK_COMPLETED("consistency-check-completed");

    private final String eventName;

    ResilienceEventType(String eventName) {
        this.eventName = eventName;
    }

    /**
     * Wire name used in audit records.
     */
    public String eventName() {
        return eventName;
    }
}
