package trustbridge.adapter.out.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.URI;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.jwk.RsaJsonWebKey;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import trustbridge.adapter.out.http.JwksCacheService.JwksFetchException;
import trustbridge.core.model.federation.InstanceConfig;
import trustbridge.core.model.federation.LocalVerification;
import trustbridge.core.model.federation.TrustLevel;
import trustbridge.core.port.out.JwksCache;
import trustbridge.testing.Federation;
import trustbridge.testing.MutableClock;

@DisplayName("JwksTokenVerifier")
@ExtendWith(MockitoExtension.class)
class JwksTokenVerifierTest {

    private static final String KEY_ID = "gbr-signing-1";
    private static final URI JWKS_URI = URI.create("https://gbr-api.coalition.test/jwks");
    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private static PrivateKey signingKey;
    private static RsaJsonWebKey publishedKey;
    private static PrivateKey foreignKey;
    private static RsaJsonWebKey secondPublishedKey;

    @Mock
    private JwksCache jwksCache;

    private JwksTokenVerifier verifier;
    private InstanceConfig gbr;

    @BeforeAll
    static void setUpKeys() throws Exception {
        final var keyGen = KeyPairGenerator.getInstance("RSA");
        keyGen.initialize(2048);
        final var keyPair = keyGen.generateKeyPair();
        signingKey = keyPair.getPrivate();
        publishedKey = new RsaJsonWebKey((RSAPublicKey) keyPair.getPublic());
        publishedKey.setKeyId(KEY_ID);
        publishedKey.setAlgorithm(AlgorithmIdentifiers.RSA_USING_SHA256);
        final var foreignPair = keyGen.generateKeyPair();
        foreignKey = foreignPair.getPrivate();
        secondPublishedKey = new RsaJsonWebKey((RSAPublicKey) foreignPair.getPublic());
        secondPublishedKey.setKeyId("gbr-signing-2");
    }

    @BeforeEach
    void setUp() {
        verifier = new JwksTokenVerifier(jwksCache, new MutableClock(NOW));
        gbr = Federation.gbr();
    }

    private static String token(PrivateKey key, String keyId, String subject, Instant expiresAt) throws Exception {
        final var claims = new JwtClaims();
        claims.setIssuer("https://gbr-idp.coalition.test");
        if (subject != null) {
            claims.setSubject(subject);
        }
        claims.setIssuedAt(NumericDate.fromSeconds(NOW.minusSeconds(60).getEpochSecond()));
        claims.setExpirationTime(NumericDate.fromSeconds(expiresAt.getEpochSecond()));
        claims.setClaim("clearance", "OFFICIAL_SENSITIVE");

        final var jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setKey(key);
        if (keyId != null) {
            jws.setKeyIdHeaderValue(keyId);
        }
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.RSA_USING_SHA256);
        return jws.getCompactSerialization();
    }

    private static String validToken() throws Exception {
        return token(signingKey, KEY_ID, "jane.smith@mod.uk", NOW.plusSeconds(600));
    }

    private LocalVerification verifyToken(String token) {
        return verifier.verify(token, gbr).await().atMost(Duration.ofSeconds(1));
    }

    @Nested
    @DisplayName("Verified tokens")
    class VerifiedTokens {

        @Test
        @DisplayName("should return the claims of a correctly signed token")
        void shouldVerify() throws Exception {
            when(jwksCache.getKey(JWKS_URI, KEY_ID)).thenReturn(Uni.createFrom().item(Optional.of(publishedKey)));

            final var result = assertInstanceOf(LocalVerification.Verified.class, verifyToken(validToken()));

            assertEquals("jane.smith@mod.uk", result.claims().get("sub"));
            assertEquals("OFFICIAL_SENSITIVE", result.claims().get("clearance"));
        }

        @Test
        @DisplayName("should refresh the key set when the kid is unknown")
        void shouldRefreshOnUnknownKid() throws Exception {
            when(jwksCache.getKey(JWKS_URI, KEY_ID)).thenReturn(Uni.createFrom().item(Optional.empty()));
            when(jwksCache.refresh(JWKS_URI)).thenReturn(Uni.createFrom().item(new JsonWebKeySet(publishedKey)));

            assertInstanceOf(LocalVerification.Verified.class, verifyToken(validToken()));
        }

        @Test
        @DisplayName("should use the only published key for a token without kid")
        void shouldUseSingleKeyWithoutKid() throws Exception {
            when(jwksCache.getKey(JWKS_URI, null)).thenReturn(Uni.createFrom().item(Optional.empty()));
            when(jwksCache.refresh(JWKS_URI)).thenReturn(Uni.createFrom().item(new JsonWebKeySet(publishedKey)));
            final var withoutKid = token(signingKey, null, "jane.smith@mod.uk", NOW.plusSeconds(600));

            assertInstanceOf(LocalVerification.Verified.class, verifyToken(withoutKid));
        }
    }

    @Nested
    @DisplayName("Rejected tokens")
    class RejectedTokens {

        @Test
        @DisplayName("should reject an expired token")
        void shouldRejectExpired() throws Exception {
            when(jwksCache.getKey(JWKS_URI, KEY_ID)).thenReturn(Uni.createFrom().item(Optional.of(publishedKey)));
            final var expired = token(signingKey, KEY_ID, "jane.smith@mod.uk", NOW.minusSeconds(300));

            final var result = assertInstanceOf(LocalVerification.Rejected.class, verifyToken(expired));

            assertEquals("Token has expired", result.reason());
        }

        @Test
        @DisplayName("should reject a token signed with another key")
        void shouldRejectForgedSignature() throws Exception {
            when(jwksCache.getKey(JWKS_URI, KEY_ID)).thenReturn(Uni.createFrom().item(Optional.of(publishedKey)));
            final var forged = token(foreignKey, KEY_ID, "jane.smith@mod.uk", NOW.plusSeconds(600));

            final var result = assertInstanceOf(LocalVerification.Rejected.class, verifyToken(forged));

            assertEquals("Invalid token signature", result.reason());
        }

        @Test
        @DisplayName("should reject a token without a subject")
        void shouldRejectMissingSubject() throws Exception {
            when(jwksCache.getKey(JWKS_URI, KEY_ID)).thenReturn(Uni.createFrom().item(Optional.of(publishedKey)));
            final var anonymous = token(signingKey, KEY_ID, null, NOW.plusSeconds(600));

            final var result = assertInstanceOf(LocalVerification.Rejected.class, verifyToken(anonymous));

            assertEquals("Token has no subject", result.reason());
        }

        @Test
        @DisplayName("should reject a value that is not a JWS without fetching keys")
        void shouldRejectMalformed() {
            final var result = assertInstanceOf(LocalVerification.Rejected.class, verifyToken("opaque-reference-token"));

            assertEquals("Malformed token", result.reason());
            verify(jwksCache, never()).getKey(any(), any());
        }
    }

    @Nested
    @DisplayName("Unavailable verification")
    class UnavailableVerification {

        @Test
        @DisplayName("should be unavailable when the peer publishes no keys")
        void shouldBeUnavailableWithoutJwks() throws Exception {
            final var introspectionOnly = new InstanceConfig(
                    "gbr",
                    "GBR",
                    URI.create("https://gbr-api.coalition.test"),
                    URI.create("https://gbr-api.coalition.test/oauth/introspect"),
                    Optional.empty(),
                    TrustLevel.HIGH,
                    "GBR",
                    true,
                    Map.of());

            final var result = verifier.verify(validToken(), introspectionOnly).await().atMost(Duration.ofSeconds(1));

            assertInstanceOf(LocalVerification.Unavailable.class, result);
            verify(jwksCache, never()).getKey(any(), any());
        }

        @Test
        @DisplayName("should be unavailable when the kid is not published after refresh")
        void shouldBeUnavailableForUnpublishedKid() throws Exception {
            when(jwksCache.getKey(JWKS_URI, "rotated-key")).thenReturn(Uni.createFrom().item(Optional.empty()));
            when(jwksCache.refresh(JWKS_URI)).thenReturn(Uni.createFrom().item(new JsonWebKeySet(publishedKey)));
            final var rotated = token(signingKey, "rotated-key", "jane.smith@mod.uk", NOW.plusSeconds(600));

            final var result = assertInstanceOf(LocalVerification.Unavailable.class, verifyToken(rotated));

            assertEquals("Signing key rotated-key not published", result.reason());
        }

        @Test
        @DisplayName("should not guess a key for a token without kid when several are published")
        void shouldNotGuessKeyWithoutKid() throws Exception {
            when(jwksCache.getKey(JWKS_URI, null)).thenReturn(Uni.createFrom().item(Optional.empty()));
            when(jwksCache.refresh(JWKS_URI))
                    .thenReturn(Uni.createFrom().item(new JsonWebKeySet(secondPublishedKey, publishedKey)));
            final var withoutKid = token(signingKey, null, "jane.smith@mod.uk", NOW.plusSeconds(600));

            assertInstanceOf(LocalVerification.Unavailable.class, verifyToken(withoutKid));
        }

        @Test
        @DisplayName("should be unavailable when keys cannot be fetched")
        void shouldBeUnavailableOnFetchFailure() throws Exception {
            when(jwksCache.getKey(JWKS_URI, KEY_ID))
                    .thenReturn(Uni.createFrom().failure(new JwksFetchException("Timeout fetching JWKS")));

            final var result = assertInstanceOf(LocalVerification.Unavailable.class, verifyToken(validToken()));

            assertEquals("Timeout fetching JWKS", result.reason());
        }
    }
}
