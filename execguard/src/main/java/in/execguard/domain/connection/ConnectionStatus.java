package in.execguard.domain.connection;

/**
 * Status reported by a bridge connection.
 */
public enum ConnectionStatus {
    CONNECTED,
    CONNECTING,
    DISCONNECTED,
    ERROR
}
