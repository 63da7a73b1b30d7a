package trustbridge.core.model.authz;

import java.util.List;

/**
 * Resources returned by a federated query together with the access verdict for each.
 */
public record FederatedQueryResult(int totalResources, List<ResourceAccess> resources, QueryStats queryStats) {

    public FederatedQueryResult {
        resources = List.copyOf(resources);
    }

    public long accessibleCount() {
        return resources.stream().filter(ResourceAccess::accessAllowed).count();
    }

    public record ResourceAccess(FederatedResource resource, boolean accessAllowed, String accessReason) {}

    /**
     * @param failedQueries one {@code instance: reason} entry per instance that could not be queried
     */
    public record QueryStats(
            int instancesQueried, int successfulQueries, List<String> failedQueries, long totalLatencyMs) {

        public QueryStats {
            failedQueries = List.copyOf(failedQueries);
        }
    }
}
