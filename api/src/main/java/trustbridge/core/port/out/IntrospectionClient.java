package trustbridge.core.port.out;

import io.smallrye.mutiny.Uni;

import trustbridge.core.model.federation.InstanceConfig;
import trustbridge.core.model.federation.PeerIntrospection;

/**
 * Port for calling a peer's token introspection endpoint.
 */
public interface IntrospectionClient {

    /**
     * Ask {@code origin} whether {@code token} is active.
     *
     * <p>Fails on transport errors, non-2xx responses and malformed bodies.
     *
     * @param requestingInstance code sent as {@code X-Federated-From}
     */
    Uni<PeerIntrospection> introspect(InstanceConfig origin, String token, String requestingInstance);
}
