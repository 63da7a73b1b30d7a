package trustbridge.core.model.authz;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A search fanned out across federation instances.
 *
 * @param criteria        opaque search criteria forwarded to every instance
 * @param targetInstances instances to query, empty for every registered instance
 */
public record FederatedResourceQuery(
        FederatedSubject subject,
        Map<String, Object> criteria,
        String requestId,
        Optional<String> bearerToken,
        List<String> targetInstances) {

    public FederatedResourceQuery {
        criteria = criteria == null ? Map.of() : Map.copyOf(criteria);
        bearerToken = bearerToken == null ? Optional.empty() : bearerToken;
        targetInstances = targetInstances == null ? List.of() : List.copyOf(targetInstances);
    }
}
