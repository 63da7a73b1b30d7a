package trustbridge.core.model.federation;

import java.net.URI;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * A registered federation peer.
 *
 * <p>Created once from configuration and never mutated.
 *
 * @param instanceId        lower-case identifier (e.g. {@code gbr})
 * @param instanceCode      upper-case code used by the trust matrix (e.g. {@code GBR})
 * @param baseUrl           base URL of the peer's API
 * @param introspectionUrl  token introspection endpoint
 * @param signingKeysUrl    JWKS endpoint, empty when the peer only supports introspection
 * @param trustLevel        declared trust level of the peer
 * @param country           ISO 3166 alpha-3 country of the peer
 * @param enabled           whether the peer participates in the federation
 * @param clearanceMapping  national clearance label to NATO-normalized label
 */
public record InstanceConfig(
        String instanceId,
        String instanceCode,
        URI baseUrl,
        URI introspectionUrl,
        Optional<URI> signingKeysUrl,
        TrustLevel trustLevel,
        String country,
        boolean enabled,
        Map<String, String> clearanceMapping) {

    public InstanceConfig {
        if (instanceId == null || instanceId.isBlank()) {
            throw new IllegalArgumentException("instanceId cannot be blank");
        }
        instanceId = instanceId.toLowerCase(Locale.ROOT);
        instanceCode = instanceCode == null || instanceCode.isBlank()
                ? instanceId.toUpperCase(Locale.ROOT)
                : instanceCode.toUpperCase(Locale.ROOT);
        signingKeysUrl = signingKeysUrl == null ? Optional.empty() : signingKeysUrl;
        trustLevel = trustLevel == null ? TrustLevel.LOW : trustLevel;
        clearanceMapping = clearanceMapping == null ? Map.of() : Map.copyOf(clearanceMapping);
    }

    /**
     * Whether the given identifier names this instance, by id or code.
     */
    public boolean matches(String idOrCode) {
        return idOrCode != null
                && (instanceId.equalsIgnoreCase(idOrCode) || instanceCode.equalsIgnoreCase(idOrCode));
    }
}
