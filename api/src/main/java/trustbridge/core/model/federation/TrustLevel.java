package trustbridge.core.model.federation;

import java.util.Locale;

/**
 * Declared strength of a trust relationship or of a registered instance.
 */
public enum TrustLevel {
    HIGH,
    MEDIUM,
    LOW;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TrustLevel fromString(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
