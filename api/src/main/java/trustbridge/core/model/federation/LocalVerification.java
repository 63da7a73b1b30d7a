package trustbridge.core.model.federation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of verifying a token against the issuing instance's published keys.
 */
public sealed interface LocalVerification {

    /**
     * Signature and expiry checked; claims taken from the payload.
     */
    record Verified(Map<String, Object> claims) implements LocalVerification {
        public Verified {
            claims = Collections.unmodifiableMap(new LinkedHashMap<>(claims));
        }
    }

    /**
     * The token is definitively invalid: bad signature, expired or malformed.
     */
    record Rejected(String reason) implements LocalVerification {}

    /**
     * Local verification could not be attempted: unknown key id, key fetch failure,
     * or the instance publishes no keys. Remote introspection should be used instead.
     */
    record Unavailable(String reason) implements LocalVerification {}
}
