package trustbridge.core.model.authz;

/**
 * Answer of a peer's federation evaluation endpoint.
 */
public sealed interface RemotePolicyOutcome {

    record Decision(boolean allow, String reason) implements RemotePolicyOutcome {}

    /**
     * The peer does not expose a federation evaluation endpoint (HTTP 404).
     */
    record EndpointNotFound() implements RemotePolicyOutcome {}
}
