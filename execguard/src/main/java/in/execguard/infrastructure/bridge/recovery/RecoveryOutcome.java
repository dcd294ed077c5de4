package in.execguard.infrastructure.bridge.recovery;

import in.execguard.domain.connection.ConnectionDescriptor;

import java.time.Duration;

/**
 * Final result of one recovery episode.
 */
public record RecoveryOutcome(
    String instanceId,
    Result result,
    int attempts,
    Duration elapsed,
    ConnectionDescriptor connection,
    String lastError
) {
    public enum Result {
        RECOVERED,
        EXHAUSTED,
        STOPPED
    }

    public boolean recovered() {
        return result == Result.RECOVERED;
    }
}
