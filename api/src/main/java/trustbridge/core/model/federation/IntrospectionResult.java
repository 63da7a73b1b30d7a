package trustbridge.core.model.federation;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Outcome of validating a foreign token.
 */
public record IntrospectionResult(
        boolean active,
        Optional<TokenClaims> claims,
        String originInstance,
        Instant validatedAt,
        boolean trustVerified,
        Optional<Set<String>> scopesAllowed,
        Optional<String> error,
        Optional<FederationErrorCode> errorCode,
        ValidationPath validationPath,
        boolean cacheHit,
        long latencyMs) {

    public static IntrospectionResult active(
            TokenClaims claims,
            String originInstance,
            Instant validatedAt,
            Set<String> scopesAllowed,
            ValidationPath path,
            long latencyMs) {
        return new IntrospectionResult(
                true,
                Optional.of(claims),
                originInstance,
                validatedAt,
                true,
                Optional.of(Set.copyOf(scopesAllowed)),
                Optional.empty(),
                Optional.empty(),
                path,
                false,
                latencyMs);
    }

    public static IntrospectionResult inactive(
            String originInstance,
            Instant validatedAt,
            boolean trustVerified,
            FederationErrorCode code,
            String error,
            ValidationPath path,
            long latencyMs) {
        return new IntrospectionResult(
                false,
                Optional.empty(),
                originInstance,
                validatedAt,
                trustVerified,
                Optional.empty(),
                Optional.of(error),
                Optional.of(code),
                path,
                false,
                latencyMs);
    }

    /**
     * Copy served from cache, with scopes re-derived for the current request.
     */
    public IntrospectionResult asCacheHit(Set<String> scopes, long latencyMs) {
        return new IntrospectionResult(
                active,
                claims,
                originInstance,
                validatedAt,
                trustVerified,
                active ? Optional.of(Set.copyOf(scopes)) : scopesAllowed,
                error,
                errorCode,
                validationPath,
                true,
                latencyMs);
    }
}
