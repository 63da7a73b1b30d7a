package trustbridge.core.model.federation;

/**
 * How an introspection verdict was reached.
 */
public enum ValidationPath {
    /** Signature verified against the origin's published keys. */
    LOCAL,
    /** Origin's introspection endpoint answered. */
    REMOTE,
    /** No validation ran (trust gate, breaker, configuration). */
    NONE
}
