package trustbridge.core.port.out;

import io.smallrye.mutiny.Uni;

import trustbridge.core.model.authz.PolicyInput;
import trustbridge.core.model.authz.RemotePolicyOutcome;
import trustbridge.core.model.federation.InstanceConfig;

/**
 * Port for a peer's federation policy evaluation endpoint.
 */
public interface RemotePolicyClient {

    /**
     * Ask {@code peer} to evaluate {@code input}.
     *
     * <p>A 404 is reported as {@link RemotePolicyOutcome.EndpointNotFound}; every other
     * non-2xx status, transport error or malformed body is a failure.
     *
     * @param bearerToken forwarded as the Authorization header when present
     */
    Uni<RemotePolicyOutcome> evaluate(InstanceConfig peer, PolicyInput input, String bearerToken);
}
