package trustbridge.core.model.resilience;

/**
 * Operating mode toward a peer. Derived from the circuit unless maintenance is forced.
 */
public enum FailoverMode {
    NORMAL,
    DEGRADED,
    OFFLINE,
    MAINTENANCE
}
