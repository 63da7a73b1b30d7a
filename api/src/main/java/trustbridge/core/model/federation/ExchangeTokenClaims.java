package trustbridge.core.model.federation;

import java.time.Instant;
import java.util.Set;

/**
 * Everything an exchange token asserts.
 *
 * @param provenance where the subject token came from and which edge authorized the exchange
 */
public record ExchangeTokenClaims(
        String issuer,
        String audience,
        String jti,
        Instant issuedAt,
        Instant expiresAt,
        TokenClaims subjectClaims,
        Set<String> scopes,
        Provenance provenance) {

    public ExchangeTokenClaims {
        scopes = Set.copyOf(scopes);
    }

    public record Provenance(
            String originalIssuer,
            String originalInstance,
            String targetInstance,
            TrustLevel trustLevel,
            Classification maxClassification) {}
}
