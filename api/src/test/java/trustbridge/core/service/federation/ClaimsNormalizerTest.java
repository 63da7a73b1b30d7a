package trustbridge.core.service.federation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import trustbridge.core.model.federation.FederationException.TokenInvalidException;
import trustbridge.testing.Federation;

@DisplayName("ClaimsNormalizer")
class ClaimsNormalizerTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private static Map<String, Object> minimal() {
        var raw = new HashMap<String, Object>();
        raw.put("sub", "a1b2c3");
        raw.put("exp", NOW.plusSeconds(300).getEpochSecond());
        return raw;
    }

    @Test
    @DisplayName("should map coalition attributes when present")
    void shouldMapAttributes() {
        var raw = minimal();
        raw.put("iss", "https://gbr-idp.coalition.test");
        raw.put("aud", "usa-api");
        raw.put("iat", NOW.getEpochSecond());
        raw.put("uniqueID", "john.smith@mod.uk");
        raw.put("clearance", "SECRET");
        raw.put("countryOfAffiliation", "GBR");
        raw.put("acpCOI", List.of("FVEY", "NATO"));
        raw.put("organizationType", "MIL");

        var claims = ClaimsNormalizer.normalize(raw, Federation.gbr(), NOW);

        assertEquals("a1b2c3", claims.subject());
        assertEquals("john.smith@mod.uk", claims.uniqueId());
        assertEquals("SECRET", claims.clearance());
        assertEquals(Set.of("FVEY", "NATO"), claims.communitiesOfInterest());
        assertEquals(List.of("usa-api"), claims.audience());
        assertEquals(NOW, claims.issuedAt());
        assertEquals("MIL", claims.organizationType().orElseThrow());
        assertEquals("GBR", claims.instanceCode());
    }

    @Test
    @DisplayName("should fall back to defaults for missing attributes")
    void shouldApplyDefaults() {
        var claims = ClaimsNormalizer.normalize(minimal(), Federation.fra(), NOW);

        assertEquals("a1b2c3", claims.uniqueId());
        assertEquals("UNCLASSIFIED", claims.clearance());
        assertEquals("FRA", claims.countryOfAffiliation());
        assertTrue(claims.communitiesOfInterest().isEmpty());
        assertEquals(NOW, claims.issuedAt());
        assertEquals("https://fra-api.coalition.test", claims.issuer());
    }

    @Test
    @DisplayName("should prefer preferred_username over sub for the unique id")
    void shouldPreferUsername() {
        var raw = minimal();
        raw.put("preferred_username", "marie.dubois");
        raw.put("coi", "EU");

        var claims = ClaimsNormalizer.normalize(raw, Federation.fra(), NOW);

        assertEquals("marie.dubois", claims.uniqueId());
        assertEquals(Set.of("EU"), claims.communitiesOfInterest());
    }

    @Test
    @DisplayName("should accept numeric dates sent as strings")
    void shouldAcceptStringDates() {
        var raw = minimal();
        raw.put("exp", String.valueOf(NOW.plusSeconds(60).getEpochSecond()));

        assertEquals(NOW.plusSeconds(60), ClaimsNormalizer.normalize(raw, Federation.usa(), NOW).expiresAt());
    }

    @Test
    @DisplayName("should reject claims without a subject")
    void shouldRejectMissingSubject() {
        var raw = minimal();
        raw.remove("sub");

        assertThrows(TokenInvalidException.class, () -> ClaimsNormalizer.normalize(raw, Federation.usa(), NOW));
    }

    @Test
    @DisplayName("should reject claims without an expiry")
    void shouldRejectMissingExpiry() {
        var raw = minimal();
        raw.remove("exp");

        assertThrows(TokenInvalidException.class, () -> ClaimsNormalizer.normalize(raw, Federation.usa(), NOW));
    }

    @Test
    @DisplayName("should reject a malformed expiry")
    void shouldRejectMalformedExpiry() {
        var raw = minimal();
        raw.put("exp", "tomorrow");

        assertThrows(TokenInvalidException.class, () -> ClaimsNormalizer.normalize(raw, Federation.usa(), NOW));
    }
}
