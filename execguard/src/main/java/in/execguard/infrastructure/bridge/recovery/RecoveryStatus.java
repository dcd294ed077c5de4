package in.execguard.infrastructure.bridge.recovery;

import in.execguard.domain.connection.ConnectionState;
import in.execguard.domain.connection.RecoveryAttempt;

/**
 * Point-in-time view of one instance: its state and, while recovering, the
 * running attempt.
 */
public record RecoveryStatus(
    String instanceId,
    ConnectionState state,
    RecoveryAttempt attempt
) {
    public boolean recovering() {
        return state == ConnectionState.RECOVERING;
    }
}
