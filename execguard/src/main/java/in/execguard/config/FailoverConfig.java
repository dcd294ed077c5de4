package in.execguard.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Failover orchestration settings.
 */
public record FailoverConfig(
    @JsonProperty("bridgeInstanceId")
    String bridgeInstanceId,        // Instance recovered after a failover

    @JsonProperty("executionTimeoutMs")
    long executionTimeoutMs,        // Bound on one bridge execute() call

    @JsonProperty("directTimeoutMs")
    long directTimeoutMs,           // Bound on one direct execute() call

    @JsonProperty("healthCheckIntervalMs")
    long healthCheckIntervalMs      // Bridge connection polling, 0 disables
) {
    public static FailoverConfig defaults() {
        return new FailoverConfig("bridge-primary", 5_000, 10_000, 30_000);
    }

    List<String> validate() {
        List<String> issues = new ArrayList<>();
        if (bridgeInstanceId == null || bridgeInstanceId.isBlank()) {
            issues.add("failover.bridgeInstanceId must be set");
        }
        if (executionTimeoutMs <= 0) issues.add("failover.executionTimeoutMs must be positive");
        if (directTimeoutMs <= 0) issues.add("failover.directTimeoutMs must be positive");
        if (healthCheckIntervalMs < 0) issues.add("failover.healthCheckIntervalMs must not be negative");
        return issues;
    }
}
