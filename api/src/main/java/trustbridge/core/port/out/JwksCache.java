package trustbridge.core.port.out;

import java.net.URI;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;

/**
 * Port for caching and retrieving a peer's published signing keys.
 */
public interface JwksCache {

    /**
     * Get the key set, from cache when fresh.
     *
     * @param jwksUri the JWKS endpoint URI
     * @return the JSON Web Key Set
     */
    Uni<JsonWebKeySet> getKeySet(URI jwksUri);

    /**
     * Get a specific key by ID.
     *
     * @param jwksUri the JWKS endpoint URI
     * @param keyId   the key ID (kid) to retrieve
     * @return the key if found
     */
    Uni<Optional<JsonWebKey>> getKey(URI jwksUri, String keyId);

    /**
     * Drop the cached key set and fetch it again. Used when a kid is unknown.
     *
     * @param jwksUri the JWKS endpoint URI
     * @return the refreshed key set
     */
    Uni<JsonWebKeySet> refresh(URI jwksUri);

    /**
     * Remove the cached key set.
     *
     * @param jwksUri the JWKS endpoint URI
     */
    void invalidate(URI jwksUri);

    /**
     * Remove every cached key set.
     */
    void invalidateAll();
}
