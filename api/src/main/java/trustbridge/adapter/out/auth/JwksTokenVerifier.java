package trustbridge.adapter.out.auth;

import java.net.URI;
import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.lang.JoseException;

import trustbridge.adapter.out.http.JwksCacheService;
import trustbridge.adapter.out.http.JwksCacheService.JwksFetchException;
import trustbridge.core.model.federation.InstanceConfig;
import trustbridge.core.model.federation.LocalVerification;
import trustbridge.core.port.out.JwksCache;
import trustbridge.core.port.out.TokenVerifier;

/**
 * Verifies peer-issued JWTs against the keys the peer publishes.
 *
 * <p>A token whose signature or expiry is wrong is {@link LocalVerification.Rejected}. When the
 * keys cannot be obtained, or the token's key is not published even after a refresh, the result
 * is {@link LocalVerification.Unavailable} so the caller can ask the peer instead.
 */
@ApplicationScoped
public class JwksTokenVerifier implements TokenVerifier {

    private static final Logger LOG = Logger.getLogger(JwksTokenVerifier.class);
    private static final int CLOCK_SKEW_SECONDS = 30;

    private final JwksCache jwksCache;
    private final Clock clock;

    @Inject
    public JwksTokenVerifier(JwksCache jwksCache, Clock clock) {
        this.jwksCache = jwksCache;
        this.clock = clock;
    }

    @Override
    public Uni<LocalVerification> verify(String token, InstanceConfig origin) {
        if (origin.signingKeysUrl().isEmpty()) {
            return Uni.createFrom().item(new LocalVerification.Unavailable("No signing keys published by " + origin.instanceCode()));
        }
        final var jwksUri = origin.signingKeysUrl().get();

        final String keyId;
        try {
            keyId = extractKeyId(token);
        } catch (JoseException e) {
            LOG.debugv("Token from {0} is not a compact JWS: {1}", origin.instanceCode(), e.getMessage());
            return Uni.createFrom().item(new LocalVerification.Rejected("Malformed token"));
        }

        return jwksCache.getKey(jwksUri, keyId)
                .flatMap(key -> {
                    if (key.isEmpty()) {
                        return retryWithRefresh(token, jwksUri, keyId);
                    }
                    return Uni.createFrom().item(verifyWithKey(token, key.get()));
                })
                .onFailure(JwksFetchException.class)
                .recoverWithItem(error -> new LocalVerification.Unavailable(error.getMessage()))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Local verification for {0} failed: {1}", origin.instanceCode(), error.getMessage());
                    return new LocalVerification.Unavailable(String.valueOf(error.getMessage()));
                });
    }

    private static String extractKeyId(String token) throws JoseException {
        JsonWebSignature jws = new JsonWebSignature();
        jws.setCompactSerialization(token);
        return jws.getKeyIdHeaderValue();
    }

    private Uni<LocalVerification> retryWithRefresh(String token, URI jwksUri, String keyId) {
        LOG.infov("Key {0} not found, refreshing JWKS from {1}", keyId, jwksUri);
        return jwksCache.refresh(jwksUri).map(keySet -> {
            final var key = JwksCacheService.findKey(keySet, keyId);
            if (key.isEmpty()) {
                return new LocalVerification.Unavailable("Signing key " + keyId + " not published");
            }
            return verifyWithKey(token, key.get());
        });
    }

    private LocalVerification verifyWithKey(String token, JsonWebKey key) {
        try {
            final var claims = new JwtConsumerBuilder()
                    .setRequireSubject()
                    .setRequireExpirationTime()
                    .setAllowedClockSkewInSeconds(CLOCK_SKEW_SECONDS)
                    .setEvaluationTime(NumericDate.fromMilliseconds(clock.millis()))
                    .setSkipDefaultAudienceValidation()
                    .setJwsAlgorithmConstraints(AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.RSA_USING_SHA256)
                    .setVerificationKey(key.getKey())
                    .build()
                    .processToClaims(token);
            return new LocalVerification.Verified(claims.getClaimsMap());
        } catch (InvalidJwtException e) {
            LOG.debugv("JWT validation failed: {0}", e.getMessage());
            return new LocalVerification.Rejected(summarizeJwtError(e));
        }
    }

    private static String summarizeJwtError(InvalidJwtException e) {
        if (e.hasExpired()) {
            return "Token has expired";
        }
        final var message = String.valueOf(e.getMessage());
        if (message.contains("signature")) {
            return "Invalid token signature";
        }
        if (message.contains("Subject")) {
            return "Token has no subject";
        }
        return "Token validation failed";
    }
}
