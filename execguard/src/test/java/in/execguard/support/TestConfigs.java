package in.execguard.support;

import in.execguard.config.ConsistencyConfig;
import in.execguard.config.FailoverConfig;
import in.execguard.config.RecoveryConfig;
import in.execguard.config.ResilienceConfig;
import in.execguard.config.StatusConfig;
import in.execguard.config.SyncConfig;
import in.execguard.config.ValidationPolicy;

import java.util.List;

/**
 * Configurations with millisecond timings for subsystem tests.
 */
public final class TestConfigs {

    public static final String INSTANCE = "bridge-primary";

    public static ResilienceConfig fast(int maxRetryAttempts, long executionTimeoutMs) {
        return withStatus(maxRetryAttempts, executionTimeoutMs, StatusConfig.defaults());
    }

    public static ResilienceConfig withStatus(int maxRetryAttempts, long executionTimeoutMs, StatusConfig status) {
        return new ResilienceConfig(
            new RecoveryConfig(20, 40, 2.0, maxRetryAttempts, 500, 0, 60_000, List.of(), ValidationPolicy.ADVISORY),
            new FailoverConfig(INSTANCE, executionTimeoutMs, 1_000, 0),
            new SyncConfig(60_000, 1_000, 0.01, 0, 1_000, 0.001),
            new ConsistencyConfig(60_000, true),
            status
        );
    }

    private TestConfigs() {}
}
