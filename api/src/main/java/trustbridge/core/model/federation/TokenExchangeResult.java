package trustbridge.core.model.federation;

import java.util.Optional;
import java.util.Set;

/**
 * Outcome of a token exchange. Failures carry an RFC 8693 error code.
 */
public record TokenExchangeResult(
        boolean success,
        Optional<String> accessToken,
        String tokenType,
        long expiresInSeconds,
        TokenType issuedTokenType,
        Set<String> scope,
        String originInstance,
        String targetInstance,
        Optional<String> error,
        Optional<String> errorDescription,
        String auditId) {

    public static final String INVALID_GRANT = "invalid_grant";
    public static final String SERVER_ERROR = "server_error";

    public static TokenExchangeResult issued(
            String accessToken,
            long expiresInSeconds,
            TokenType issuedTokenType,
            Set<String> scope,
            String originInstance,
            String targetInstance,
            String auditId) {
        return new TokenExchangeResult(
                true,
                Optional.of(accessToken),
                "Bearer",
                expiresInSeconds,
                issuedTokenType,
                Set.copyOf(scope),
                originInstance,
                targetInstance,
                Optional.empty(),
                Optional.empty(),
                auditId);
    }

    public static TokenExchangeResult failed(
            String error, String description, String originInstance, String targetInstance, String auditId) {
        return new TokenExchangeResult(
                false,
                Optional.empty(),
                "Bearer",
                0,
                TokenType.ACCESS_TOKEN,
                Set.of(),
                originInstance,
                targetInstance,
                Optional.of(error),
                Optional.of(description),
                auditId);
    }
}
