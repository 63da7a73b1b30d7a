package trustbridge.core.model.authz;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A resource owned by some federation instance.
 */
public record FederatedResource(
        String resourceId,
        Optional<String> title,
        String classification,
        List<String> releasabilityTo,
        Set<String> communitiesOfInterest,
        String instanceId,
        Optional<String> instanceUrl) {

    public FederatedResource {
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("resourceId cannot be blank");
        }
        if (instanceId == null || instanceId.isBlank()) {
            throw new IllegalArgumentException("instanceId cannot be blank");
        }
        title = title == null ? Optional.empty() : title;
        releasabilityTo = releasabilityTo == null ? List.of() : List.copyOf(releasabilityTo);
        communitiesOfInterest = communitiesOfInterest == null ? Set.of() : Set.copyOf(communitiesOfInterest);
        instanceUrl = instanceUrl == null ? Optional.empty() : instanceUrl;
    }

    public FederatedResource ownedBy(String owner, String ownerUrl) {
        return new FederatedResource(
                resourceId,
                title,
                classification,
                releasabilityTo,
                communitiesOfInterest,
                owner,
                Optional.ofNullable(ownerUrl));
    }
}
