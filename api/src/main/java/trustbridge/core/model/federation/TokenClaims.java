package trustbridge.core.model.federation;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Normalized subject attributes taken from a validated token.
 *
 * <p>Never persisted beyond a cache TTL.
 */
public record TokenClaims(
        String subject,
        String issuer,
        List<String> audience,
        Instant expiresAt,
        Instant issuedAt,
        Optional<String> jti,
        String uniqueId,
        String clearance,
        String countryOfAffiliation,
        Set<String> communitiesOfInterest,
        Optional<String> organizationType,
        String instanceCode) {

    public TokenClaims {
        audience = audience == null ? List.of() : List.copyOf(audience);
        jti = jti == null ? Optional.empty() : jti;
        communitiesOfInterest = communitiesOfInterest == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(communitiesOfInterest));
        organizationType = organizationType == null ? Optional.empty() : organizationType;
    }
}
