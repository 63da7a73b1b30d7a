package trustbridge.core.service.authz;

import java.util.Locale;
import java.util.Map;

/**
 * Rewrites a clearance label through an instance's mapping table.
 *
 * <p>Lookup is exact first, then upper-cased. Unmapped labels pass through unchanged: they may
 * already be shared vocabulary.
 */
final class ClearanceTranslator {

    private ClearanceTranslator() {}

    static String translate(String clearance, Map<String, String> mapping) {
        if (clearance == null || mapping.isEmpty()) {
            return clearance;
        }
        final var exact = mapping.get(clearance);
        if (exact != null) {
            return exact;
        }
        final var upper = mapping.get(clearance.toUpperCase(Locale.ROOT));
        return upper != null ? upper : clearance;
    }
}
