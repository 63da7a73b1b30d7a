package trustbridge.core.model.federation;

import java.util.Set;

/**
 * Request to validate a token issued by {@code originInstance} on behalf of {@code requestingInstance}.
 */
public record IntrospectionRequest(
        String token,
        String originInstance,
        String requestingInstance,
        String requestId,
        Set<String> requestedScopes) {

    public IntrospectionRequest {
        requestedScopes = requestedScopes == null ? Set.of() : Set.copyOf(requestedScopes);
    }

    public IntrospectionRequest(String token, String originInstance, String requestingInstance, String requestId) {
        this(token, originInstance, requestingInstance, requestId, Set.of());
    }
}
