package in.execguard.domain.connection;

import java.time.Duration;
import java.time.Instant;

/**
 * Snapshot of a running recovery episode.
 */
public record RecoveryAttempt(
    String instanceId,
    Instant startTime,
    int attemptCount,
    int maxAttempts,
    Duration currentBackoff,
    String lastError
) {}
