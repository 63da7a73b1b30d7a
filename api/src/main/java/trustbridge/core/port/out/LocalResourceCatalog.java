package trustbridge.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import trustbridge.core.model.authz.FederatedResource;
import trustbridge.core.model.authz.FederatedResourceQuery;

/**
 * Port for the resources this instance owns.
 */
public interface LocalResourceCatalog {

    Uni<List<FederatedResource>> search(FederatedResourceQuery query);
}
