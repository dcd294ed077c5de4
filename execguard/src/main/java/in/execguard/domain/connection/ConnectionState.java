package in.execguard.domain.connection;

/**
 * Recovery-manager view of a monitored connection.
 */
public enum ConnectionState {
    UNKNOWN,     // Never seen by the recovery manager
    CONNECTED,   // Last recovery episode succeeded
    RECOVERING,  // A recovery episode is running
    FAILED,      // Last episode exhausted its attempts
    STOPPED      // Episode cancelled by an operator or shutdown
}
