package in.execguard.domain.execution;

/**
 * Path a signal was executed through.
 */
public enum ExecutionMethod {
    BRIDGE,  // Delegated to the external execution engine
    DIRECT   // Placed straight against the exchange API
}
