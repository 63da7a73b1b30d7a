package trustbridge.core.model.federation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validated body of a peer's introspection response.
 *
 * @param active whether the peer considers the token active
 * @param claims raw response members; {@code sub} and {@code exp} are present whenever {@code active} is true
 */
public record PeerIntrospection(boolean active, Map<String, Object> claims) {

    public PeerIntrospection {
        claims = claims == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(claims));
    }
}
