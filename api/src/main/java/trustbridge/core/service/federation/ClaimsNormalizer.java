package trustbridge.core.service.federation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import trustbridge.core.model.federation.Classification;
import trustbridge.core.model.federation.FederationException.TokenInvalidException;
import trustbridge.core.model.federation.InstanceConfig;
import trustbridge.core.model.federation.TokenClaims;

/**
 * Maps raw token or introspection claims onto {@link TokenClaims}.
 *
 * <p>Defaults: {@code uniqueID} falls back to {@code preferred_username} then {@code sub};
 * clearance to UNCLASSIFIED; country to the issuing instance's country; communities of
 * interest to {@code acpCOI}, then {@code coi}, then none.
 */
public final class ClaimsNormalizer {

    private ClaimsNormalizer() {}

    /**
     * @param raw    claims as decoded from JSON
     * @param origin instance that issued the token
     * @param now    used as {@code issuedAt} when the token carries none
     * @throws TokenInvalidException when {@code sub} or {@code exp} is missing or malformed
     */
    public static TokenClaims normalize(Map<String, Object> raw, InstanceConfig origin, Instant now) {
        final var subject = string(raw, "sub")
                .orElseThrow(() -> new TokenInvalidException("Token has no subject"));
        final var expiresAt = epochSeconds(raw, "exp")
                .orElseThrow(() -> new TokenInvalidException("Token has no expiration time"));
        final var issuedAt = epochSeconds(raw, "iat").orElse(now);

        final var uniqueId = string(raw, "uniqueID")
                .or(() -> string(raw, "preferred_username"))
                .orElse(subject);
        final var clearance = string(raw, "clearance").orElse(Classification.UNCLASSIFIED.name());
        final var country = string(raw, "countryOfAffiliation").orElse(origin.country());

        Set<String> communities = strings(raw.get("acpCOI"));
        if (communities.isEmpty()) {
            communities = strings(raw.get("coi"));
        }

        return new TokenClaims(
                subject,
                string(raw, "iss").orElse(origin.baseUrl().toString()),
                List.copyOf(strings(raw.get("aud"))),
                expiresAt,
                issuedAt,
                string(raw, "jti"),
                uniqueId,
                clearance,
                country,
                communities,
                string(raw, "organizationType"),
                origin.instanceCode());
    }

    private static Optional<String> string(Map<String, Object> raw, String name) {
        final var value = raw.get(name);
        if (value instanceof String s && !s.isBlank()) {
            return Optional.of(s);
        }
        return Optional.empty();
    }

    private static Optional<Instant> epochSeconds(Map<String, Object> raw, String name) {
        final var value = raw.get(name);
        if (value instanceof Number n) {
            return Optional.of(Instant.ofEpochSecond(n.longValue()));
        }
        if (value instanceof String s) {
            try {
                return Optional.of(Instant.ofEpochSecond(Long.parseLong(s.trim())));
            } catch (NumberFormatException e) {
                throw new TokenInvalidException("Claim " + name + " is not a numeric date", e);
            }
        }
        return Optional.empty();
    }

    private static Set<String> strings(Object value) {
        final var result = new LinkedHashSet<String>();
        if (value instanceof String s) {
            if (!s.isBlank()) {
                result.add(s);
            }
        } else if (value instanceof Collection<?> values) {
            for (var item : new ArrayList<>(values)) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        }
        return result;
    }
}
