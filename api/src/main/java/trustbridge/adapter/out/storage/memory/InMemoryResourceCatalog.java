package trustbridge.adapter.out.storage.memory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;

import trustbridge.core.model.authz.FederatedResource;
import trustbridge.core.model.authz.FederatedResourceQuery;
import trustbridge.core.port.out.LocalResourceCatalog;

/**
 * Resources owned by this instance, held in memory.
 *
 * <p>Search criteria are matched exactly against {@code resourceId}, {@code classification}
 * and {@code title}; unknown criteria are ignored.
 */
@ApplicationScoped
public class InMemoryResourceCatalog implements LocalResourceCatalog {

    private final List<FederatedResource> resources = new CopyOnWriteArrayList<>();

    public void register(FederatedResource resource) {
        resources.removeIf(existing -> existing.resourceId().equals(resource.resourceId()));
        resources.add(resource);
    }

    @Override
    public Uni<List<FederatedResource>> search(FederatedResourceQuery query) {
        return Uni.createFrom().item(() -> resources.stream()
                .filter(resource -> matches(resource, query.criteria()))
                .toList());
    }

    private static boolean matches(FederatedResource resource, Map<String, Object> criteria) {
        for (var criterion : criteria.entrySet()) {
            final var expected = String.valueOf(criterion.getValue());
            final var matched = switch (criterion.getKey()) {
                case "resourceId" -> resource.resourceId().equals(expected);
                case "classification" -> expected.equalsIgnoreCase(resource.classification());
                case "title" -> resource.title().map(expected::equals).orElse(false);
                default -> true;
            };
            if (!matched) {
                return false;
            }
        }
        return true;
    }
}
