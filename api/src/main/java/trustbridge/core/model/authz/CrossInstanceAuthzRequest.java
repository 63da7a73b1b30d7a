package trustbridge.core.model.authz;

import java.util.Optional;

/**
 * A single cross-instance authorization question.
 */
public record CrossInstanceAuthzRequest(
        FederatedSubject subject,
        FederatedResource resource,
        AuthzAction action,
        String requestId,
        Optional<String> bearerToken) {

    public CrossInstanceAuthzRequest {
        if (subject == null || resource == null || action == null) {
            throw new IllegalArgumentException("subject, resource and action are required");
        }
        bearerToken = bearerToken == null ? Optional.empty() : bearerToken.filter(t -> !t.isBlank());
    }
}
