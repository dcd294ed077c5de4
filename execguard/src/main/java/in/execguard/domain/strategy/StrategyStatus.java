package in.execguard.domain.strategy;

/**
 * Lifecycle status of a strategy as reported by the bridge.
 */
public enum StrategyStatus {
    PENDING,
    ACTIVE,
    PAUSED,
    STOPPED,
    ERROR
}
