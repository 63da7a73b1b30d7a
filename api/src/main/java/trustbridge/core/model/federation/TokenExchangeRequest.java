package trustbridge.core.model.federation;

import java.util.Optional;
import java.util.Set;

/**
 * RFC 8693 style exchange of a token from {@code originInstance} for one usable at {@code targetInstance}.
 */
public record TokenExchangeRequest(
        String subjectToken,
        TokenType subjectTokenType,
        Optional<TokenType> requestedTokenType,
        String originInstance,
        String targetInstance,
        Set<String> requestedScopes,
        String requestId) {

    public TokenExchangeRequest {
        subjectTokenType = subjectTokenType == null ? TokenType.ACCESS_TOKEN : subjectTokenType;
        requestedTokenType = requestedTokenType == null ? Optional.empty() : requestedTokenType;
        requestedScopes = requestedScopes == null ? Set.of() : Set.copyOf(requestedScopes);
    }
}
