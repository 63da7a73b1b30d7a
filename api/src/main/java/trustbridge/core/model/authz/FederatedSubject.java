package trustbridge.core.model.authz;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import trustbridge.core.model.federation.TokenClaims;

/**
 * The subject attributes a cross-instance decision is made on.
 *
 * <p>{@code clearance} is kept as a label so national vocabularies can flow through
 * translation unchanged.
 */
public record FederatedSubject(
        String uniqueId,
        String clearance,
        String countryOfAffiliation,
        Set<String> communitiesOfInterest,
        Optional<String> organizationType,
        Optional<String> dutyOrg,
        String originInstance) {

    public FederatedSubject {
        if (uniqueId == null || uniqueId.isBlank()) {
            throw new IllegalArgumentException("uniqueId cannot be blank");
        }
        communitiesOfInterest = communitiesOfInterest == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(communitiesOfInterest));
        organizationType = organizationType == null ? Optional.empty() : organizationType;
        dutyOrg = dutyOrg == null ? Optional.empty() : dutyOrg;
    }

    public static FederatedSubject fromClaims(TokenClaims claims) {
        return new FederatedSubject(
                claims.uniqueId(),
                claims.clearance(),
                claims.countryOfAffiliation(),
                claims.communitiesOfInterest(),
                claims.organizationType(),
                Optional.empty(),
                claims.instanceCode());
    }

    public FederatedSubject withClearance(String translatedClearance) {
        return new FederatedSubject(
                uniqueId,
                translatedClearance,
                countryOfAffiliation,
                communitiesOfInterest,
                organizationType,
                dutyOrg,
                originInstance);
    }
}
