package in.execguard.domain.event;

import in.execguard.domain.connection.ConnectionDescriptor;
import in.execguard.domain.consistency.ConsistencyDiscrepancy;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Event emitted by a resilience component.
 *
 * Subject id is the bridge instance id for recovery and failover events and
 * the strategy id for synchronization and consistency events. The payload map
 * holds strings, numbers and booleans only, ready for the audit sink.
 */
public interface ResilienceEvent {

    ResilienceEventType type();

    String subjectId();

    Instant timestamp();

    Map<String, Object> payload();

    record RecoveryStarted(String subjectId, int maxAttempts, Instant timestamp) implements ResilienceEvent {
        public ResilienceEventType type() { return ResilienceEventType.RECOVERY_STARTED; }

        public Map<String, Object> payload() {
            return Map.of("maxAttempts", maxAttempts);
        }
    }

    record RecoverySuccessful(String subjectId, int attempts, Duration elapsed,
                              ConnectionDescriptor connection, Instant timestamp) implements ResilienceEvent {
        public ResilienceEventType type() { return ResilienceEventType.RECOVERY_SUCCESSFUL; }

        public Map<String, Object> payload() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("attempts", attempts);
            map.put("elapsedMs", elapsed.toMillis());
            if (connection != null) {
                map.put("status", connection.status().name());
                map.put("apiVersion", String.valueOf(connection.apiVersion()));
            }
            return map;
        }
    }

    record RecoveryFailed(String subjectId, int attempts, Duration elapsed, String lastError,
                          Instant timestamp) implements ResilienceEvent {
        public ResilienceEventType type() { return ResilienceEventType.RECOVERY_FAILED; }

        public Map<String, Object> payload() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("attempts", attempts);
            map.put("elapsedMs", elapsed.toMillis());
            map.put("lastError", String.valueOf(lastError));
            return map;
        }
    }

    record RecoveryStopped(String subjectId, int attempts, Instant timestamp) implements ResilienceEvent {
        public ResilienceEventType type() { return ResilienceEventType.RECOVERY_STOPPED; }

        public Map<String, Object> payload() {
            return Map.of("attempts", attempts);
        }
    }

    record PostRecoveryValidation(String subjectId, boolean healthy, List<String> issues,
                                  Instant timestamp) implements ResilienceEvent {
        public PostRecoveryValidation {
            issues = issues == null ? List.of() : List.copyOf(issues);
        }

        public ResilienceEventType type() {
            return healthy
                ? ResilienceEventType.POST_RECOVERY_VALIDATION_SUCCESSFUL
                : ResilienceEventType.POST_RECOVERY_VALIDATION_FAILED;
        }

        public Map<String, Object> payload() {
            return Map.of("healthy", healthy, "issues", String.join("; ", issues));
        }
    }

    record Failover(String subjectId, String cause, String signalId, int failoverCount,
                    Instant timestamp) implements ResilienceEvent {
        public ResilienceEventType type() { return ResilienceEventType.FAILOVER; }

        public Map<String, Object> payload() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("cause", String.valueOf(cause));
            if (signalId != null) {
                map.put("signalId", signalId);
            }
            map.put("failoverCount", failoverCount);
            return map;
        }
    }

    record RecoveryCompleted(String subjectId, int recoveryCount, Instant timestamp) implements ResilienceEvent {
        public ResilienceEventType type() { return ResilienceEventType.RECOVERY_COMPLETED; }

        public Map<String, Object> payload() {
            return Map.of("recoveryCount", recoveryCount);
        }
    }

    record SynchronizationCompleted(String subjectId, int discrepancies, Duration elapsed,
                                    Instant timestamp) implements ResilienceEvent {
        public ResilienceEventType type() { return ResilienceEventType.SYNCHRONIZATION_COMPLETED; }

        public Map<String, Object> payload() {
            return Map.of("discrepancies", discrepancies, "elapsedMs", elapsed.toMillis());
        }
    }

    record SynchronizationFailed(String subjectId, String error, Instant timestamp) implements ResilienceEvent {
        public ResilienceEventType type() { return ResilienceEventType.SYNCHRONIZATION_FAILED; }

        public Map<String, Object> payload() {
            return Map.of("error", String.valueOf(error));
        }
    }

    record DiscrepancyDetected(ConsistencyDiscrepancy discrepancy, Instant timestamp) implements ResilienceEvent {
        public ResilienceEventType type() { return ResilienceEventType.DISCREPANCY_DETECTED; }

        public String subjectId() { return discrepancy.strategyId(); }

        public Map<String, Object> payload() {
            return discrepancyPayload(discrepancy);
        }
    }

    record CorrectionApplied(ConsistencyDiscrepancy discrepancy, Instant timestamp) implements ResilienceEvent {
        public ResilienceEventType type() { return ResilienceEventType.CORRECTION_APPLIED; }

        public String subjectId() { return discrepancy.strategyId(); }

        public Map<String, Object> payload() {
            return discrepancyPayload(discrepancy);
        }
    }

    record ConsistencyCheckCompleted(String subjectId, int detected, int corrected, Duration elapsed,
                                     Instant timestamp) implements ResilienceEvent {
        public ResilienceEventType type() { return ResilienceEventType.CONSISTENCY_CHECK_COMPLETED; }

        public Map<String, Object> payload() {
            return Map.of("detected", detected, "corrected", corrected, "elapsedMs", elapsed.toMillis());
        }
    }

    private static Map<String, Object> discrepancyPayload(ConsistencyDiscrepancy d) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("discrepancyType", d.type().name());
        map.put("subject", String.valueOf(d.subject()));
        map.put("magnitude", d.magnitude());
        map.put("bridgeValue", String.valueOf(d.bridgeValue()));
        map.put("localValue", String.valueOf(d.localValue()));
        map.put("severity", d.severity().name());
        map.put("resolution", d.resolution().name());
        map.put("correctionApplied", d.correctionApplied());
        return map;
    }
}
