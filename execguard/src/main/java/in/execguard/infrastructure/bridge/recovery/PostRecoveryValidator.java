package in.execguard.infrastructure.bridge.recovery;

import in.execguard.domain.connection.ConnectionDescriptor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Health check run against a freshly recovered bridge connection.
 *
 * A connection is healthy when it reports CONNECTED, its last heartbeat is
 * younger than the max ping age and its API version is supported. An empty
 * supported-version set accepts any non-blank version.
 */
public class PostRecoveryValidator {

    private final Duration maxPingAge;
    private final Set<String> supportedApiVersions;

    public PostRecoveryValidator(Duration maxPingAge, Set<String> supportedApiVersions) {
        if (maxPingAge == null || maxPingAge.isNegative() || maxPingAge.isZero()) {
            throw new IllegalArgumentException("Max ping age must be positive");
        }
        this.maxPingAge = maxPingAge;
        this.supportedApiVersions = supportedApiVersions == null ? Set.of() : Set.copyOf(supportedApiVersions);
    }

    /**
     * @return issues found, empty if the connection is healthy
     */
    public List<String> validate(ConnectionDescriptor connection, Instant now) {
        List<String> issues = new ArrayList<>();
        if (connection == null) {
            issues.add("No connection");
            return issues;
        }

        if (!connection.isConnected()) {
            issues.add("Connection status is " + connection.status());
        }

        Duration age = connection.heartbeatAge(now);
        if (age == null) {
            issues.add("No heartbeat received");
        } else if (age.compareTo(maxPingAge) > 0) {
            issues.add("Last heartbeat " + age.toMillis() + "ms ago exceeds " + maxPingAge.toMillis() + "ms");
        }

        String version = connection.apiVersion();
        if (version == null || version.isBlank()) {
            issues.add("API version missing");
        } else if (!supportedApiVersions.isEmpty() && !supportedApiVersions.contains(version)) {
            issues.add("API version " + version + " not supported");
        }

        return issues;
    }
}
