package in.execguard.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * State synchronization settings and per-field tolerances.
 */
public record SyncConfig(
    @JsonProperty("syncIntervalMs")
    long syncIntervalMs,

    @JsonProperty("stateTimeoutMs")
    long stateTimeoutMs,            // Bound on one getStrategyState() call

    @JsonProperty("pnlTolerance")
    double pnlTolerance,            // Absolute, in account currency

    @JsonProperty("tradeCountTolerance")
    int tradeCountTolerance,

    @JsonProperty("timestampToleranceMs")
    long timestampToleranceMs,

    @JsonProperty("parameterTolerance")
    double parameterTolerance       // Relative, e.g. 0.001 = 0.1%
) {
    public static SyncConfig defaults() {
        return new SyncConfig(30_000, 5_000, 0.01, 0, 1_000, 0.001);
    }

    List<String> validate() {
        List<String> issues = new ArrayList<>();
        if (syncIntervalMs <= 0) issues.add("sync.syncIntervalMs must be positive");
        if (stateTimeoutMs <= 0) issues.add("sync.stateTimeoutMs must be positive");
        if (pnlTolerance < 0) issues.add("sync.pnlTolerance must not be negative");
        if (tradeCountTolerance < 0) issues.add("sync.tradeCountTolerance must not be negative");
        if (timestampToleranceMs < 0) issues.add("sync.timestampToleranceMs must not be negative");
        if (parameterTolerance < 0) issues.add("sync.parameterTolerance must not be negative");
        return issues;
    }
}
