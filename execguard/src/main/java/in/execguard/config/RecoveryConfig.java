package in.execguard.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Connection recovery settings. All durations are in milliseconds.
 */
public record RecoveryConfig(
    @JsonProperty("initialBackoffMs")
    long initialBackoffMs,          // Delay before the first attempt

    @JsonProperty("maxBackoffMs")
    long maxBackoffMs,              // Cap on the exponential part of the delay

    @JsonProperty("backoffMultiplier")
    double backoffMultiplier,       // Growth factor per attempt (>= 1.0)

    @JsonProperty("maxRetryAttempts")
    int maxRetryAttempts,           // Attempts per episode before giving up

    @JsonProperty("connectionTimeoutMs")
    long connectionTimeoutMs,       // Bound on one connect() call

    @JsonProperty("jitterMs")
    long jitterMs,                  // Uniform random extra delay in [0, jitter)

    @JsonProperty("maxPingAgeMs")
    long maxPingAgeMs,              // Oldest acceptable heartbeat after recovery

    @JsonProperty("supportedApiVersions")
    List<String> supportedApiVersions,  // Empty accepts any non-blank version

    @JsonProperty("validationPolicy")
    ValidationPolicy validationPolicy
) {
    public RecoveryConfig {
        supportedApiVersions = supportedApiVersions == null ? List.of() : List.copyOf(supportedApiVersions);
        validationPolicy = validationPolicy == null ? ValidationPolicy.ADVISORY : validationPolicy;
    }

    public static RecoveryConfig defaults() {
        return new RecoveryConfig(
            1_000,      // 1s initial backoff
            30_000,     // 30s cap
            2.0,
            5,
            10_000,     // 10s per connect
            1_000,      // up to 1s jitter
            60_000,     // heartbeat no older than 1 min
            List.of(),
            ValidationPolicy.ADVISORY
        );
    }

    List<String> validate() {
        List<String> issues = new ArrayList<>();
        if (initialBackoffMs <= 0) issues.add("recovery.initialBackoffMs must be positive");
        if (maxBackoffMs < initialBackoffMs) issues.add("recovery.maxBackoffMs must be >= initialBackoffMs");
        if (backoffMultiplier < 1.0) issues.add("recovery.backoffMultiplier must be >= 1.0");
        if (maxRetryAttempts <= 0) issues.add("recovery.maxRetryAttempts must be positive");
        if (connectionTimeoutMs <= 0) issues.add("recovery.connectionTimeoutMs must be positive");
        if (jitterMs < 0) issues.add("recovery.jitterMs must not be negative");
        if (maxPingAgeMs <= 0) issues.add("recovery.maxPingAgeMs must be positive");
        return issues;
    }
}
