package trustbridge.core.model.resilience;

/**
 * Circuit breaker states.
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
