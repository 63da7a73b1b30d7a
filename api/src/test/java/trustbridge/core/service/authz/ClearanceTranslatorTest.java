package trustbridge.core.service.authz;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ClearanceTranslator")
class ClearanceTranslatorTest {

    private static final Map<String, String> FRENCH = Map.of(
            "SECRET_DEFENSE", "SECRET",
            "CONFIDENTIEL_DEFENSE", "CONFIDENTIAL",
            "Diffusion Restreinte", "RESTRICTED");

    @Test
    @DisplayName("should map a national label")
    void shouldMapNationalLabel() {
        assertEquals("SECRET", ClearanceTranslator.translate("SECRET_DEFENSE", FRENCH));
    }

    @Test
    @DisplayName("should prefer an exact match over the upper-cased label")
    void shouldPreferExactMatch() {
        assertEquals("RESTRICTED", ClearanceTranslator.translate("Diffusion Restreinte", FRENCH));
    }

    @Test
    @DisplayName("should match case-insensitively through upper-casing")
    void shouldMatchUpperCased() {
        assertEquals("CONFIDENTIAL", ClearanceTranslator.translate("confidentiel_defense", FRENCH));
    }

    @Test
    @DisplayName("should pass unmapped labels through")
    void shouldPassThroughUnmapped() {
        assertEquals("TOP_SECRET", ClearanceTranslator.translate("TOP_SECRET", FRENCH));
        assertEquals("SECRET", ClearanceTranslator.translate("SECRET", Map.of()));
        assertNull(ClearanceTranslator.translate(null, FRENCH));
    }
}
