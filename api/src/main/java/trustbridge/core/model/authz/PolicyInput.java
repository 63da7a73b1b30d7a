package trustbridge.core.model.authz;

import java.time.Instant;

/**
 * Input document for a policy engine evaluation.
 *
 * @param targetInstance owning instance of the resource
 */
public record PolicyInput(
        FederatedSubject subject,
        AuthzAction action,
        FederatedResource resource,
        String requestId,
        String originInstance,
        String targetInstance,
        Instant currentTime) {

    public static PolicyInput of(CrossInstanceAuthzRequest request, FederatedSubject subject, Instant now) {
        return new PolicyInput(
                subject,
                request.action(),
                request.resource(),
                request.requestId(),
                subject.originInstance(),
                request.resource().instanceId(),
                now);
    }
}
