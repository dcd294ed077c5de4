package in.execguard.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration of the resilience subsystem.
 *
 * Loaded by {@link ResilienceConfigLoader}; use {@link #defaults()} in tests.
 */
public record ResilienceConfig(
    @JsonProperty("recovery")
    RecoveryConfig recovery,

    @JsonProperty("failover")
    FailoverConfig failover,

    @JsonProperty("sync")
    SyncConfig sync,

    @JsonProperty("consistency")
    ConsistencyConfig consistency,

    @JsonProperty("status")
    StatusConfig status
) {
    public ResilienceConfig {
        if (recovery == null) recovery = RecoveryConfig.defaults();
        if (failover == null) failover = FailoverConfig.defaults();
        if (sync == null) sync = SyncConfig.defaults();
        if (consistency == null) consistency = ConsistencyConfig.defaults();
        if (status == null) status = StatusConfig.defaults();
    }

    public static ResilienceConfig defaults() {
        return new ResilienceConfig(
            RecoveryConfig.defaults(),
            FailoverConfig.defaults(),
            SyncConfig.defaults(),
            ConsistencyConfig.defaults(),
            StatusConfig.defaults()
        );
    }

    /**
     * Collect every configuration problem.
     *
     * @return list of issues, empty if the configuration is usable
     */
    public List<String> validate() {
        List<String> issues = new ArrayList<>();
        issues.addAll(recovery.validate());
        issues.addAll(failover.validate());
        issues.addAll(sync.validate());
        issues.addAll(consistency.validate());
        issues.addAll(status.validate());
        if (consistency.checkIntervalMs() < sync.syncIntervalMs()) {
            issues.add("consistency.checkIntervalMs must not be shorter than sync.syncIntervalMs");
        }
        return issues;
    }

    /**
     * @throws IllegalStateException listing every issue if the configuration is invalid
     */
    public ResilienceConfig requireValid() {
        List<String> issues = validate();
        if (!issues.isEmpty()) {
            throw new IllegalStateException("Invalid resilience configuration: " + String.join(", ", issues));
        }
        return this;
    }
}
