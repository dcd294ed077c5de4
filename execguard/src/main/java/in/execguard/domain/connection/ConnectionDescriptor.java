package in.execguard.domain.connection;

import java.time.Duration;
import java.time.Instant;

/**
 * Connection to one bridge instance, as returned by a connection factory
 * or reported by the bridge.
 */
public record ConnectionDescriptor(
    String instanceId,
    ConnectionStatus status,
    Instant lastHeartbeat,
    String apiVersion,
    String endpoint
) {
    public boolean isConnected() {
        return status == ConnectionStatus.CONNECTED;
    }

    /**
     * Time since the last heartbeat, or null if none was ever received.
     */
    public Duration heartbeatAge(Instant now) {
        if (lastHeartbeat == null) {
            return null;
        }
        return Duration.between(lastHeartbeat, now);
    }
}
