package trustbridge.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import trustbridge.core.model.authz.FederatedResource;
import trustbridge.core.model.authz.FederatedResourceQuery;
import trustbridge.core.model.federation.InstanceConfig;

/**
 * Port for querying a peer's resource catalog.
 */
public interface FederatedResourceClient {

    /**
     * Run {@code query} at {@code peer}. Returned resources are attributed to the peer.
     */
    Uni<List<FederatedResource>> query(InstanceConfig peer, FederatedResourceQuery query);
}
