package trustbridge.core.service.federation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import trustbridge.adapter.out.auth.RsaExchangeTokenSigner;
import trustbridge.adapter.out.storage.memory.ConfigInstanceRegistry;
import trustbridge.adapter.out.storage.memory.InMemoryTrustStore;
import trustbridge.core.model.federation.FederationErrorCode;
import trustbridge.core.model.federation.IntrospectionRequest;
import trustbridge.core.model.federation.IntrospectionResult;
import trustbridge.core.model.federation.TokenClaims;
import trustbridge.core.model.federation.TokenExchangeRequest;
import trustbridge.core.model.federation.TokenExchangeResult;
import trustbridge.core.model.federation.TokenType;
import trustbridge.core.model.federation.ValidationPath;
import trustbridge.spi.FederationEvent;
import trustbridge.testing.Federation;
import trustbridge.testing.MutableClock;
import trustbridge.testing.RecordingPublisher;

/**
 * Unit tests for TokenExchangeService.
 */
@DisplayName("TokenExchangeService")
@ExtendWith(MockitoExtension.class)
class TokenExchangeServiceTest {

    private static final String SUBJECT_TOKEN = "usa.subject.token";
    private static final String USA_ISSUER = "https://usa-idp.coalition.test/realms/usa";

    private static RsaExchangeTokenSigner signer;

    @Mock
    private TokenIntrospectionService introspection;

    private MutableClock clock;
    private RecordingPublisher events;
    private TokenExchangeService service;

    @BeforeAll
    static void createSigner() {
        signer = new RsaExchangeTokenSigner(Optional.empty(), "usa-exchange-1");
    }

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-06-01T12:00:00Z");
        events = new RecordingPublisher();
        var trustService = new TrustService(
                new InMemoryTrustStore(Federation.matrix()), new ConfigInstanceRegistry(Federation.instances()), clock);
        service = new TokenExchangeService(
                trustService, introspection, signer, events, clock, "usa", Optional.empty(), Duration.ofHours(1));
    }

    private TokenClaims subjectClaims() {
        return new TokenClaims(
                "f3a9",
                USA_ISSUER,
                List.of("usa-api"),
                clock.instant().plusSeconds(600),
                clock.instant(),
                Optional.of("jti-1"),
                "jane.doe@mail.mil",
                "TOP_SECRET",
                "USA",
                Set.of("FVEY", "NATO"),
                Optional.of("MIL"),
                "USA");
    }

    private void subjectTokenIsActive() {
        when(introspection.introspect(any(IntrospectionRequest.class)))
                .thenReturn(Uni.createFrom().item(IntrospectionResult.active(
                        subjectClaims(), "USA", clock.instant(), Set.of(), ValidationPath.LOCAL, 3)));
    }

    private TokenExchangeRequest request(String origin, String target, Set<String> scopes) {
        return new TokenExchangeRequest(
                SUBJECT_TOKEN, TokenType.ACCESS_TOKEN, Optional.empty(), origin, target, scopes, "req-42");
    }

    private TokenExchangeResult exchange(TokenExchangeRequest request) {
        return service.exchange(request).await().atMost(Duration.ofSeconds(5));
    }

    private JwtClaims verify(String token) throws Exception {
        var keys = new JsonWebKeySet(service.publicKeySet());
        return new JwtConsumerBuilder()
                .setRequireExpirationTime()
                .setEvaluationTime(NumericDate.fromMilliseconds(clock.millis()))
                .setExpectedAudience("https://gbr-api.coalition.test")
                .setExpectedIssuer("https://usa-api.coalition.test")
                .setJwsAlgorithmConstraints(
                        AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.RSA_USING_SHA256)
                .setVerificationKey(keys.getJsonWebKeys().get(0).getKey())
                .build()
                .processToClaims(token);
    }

    @Nested
    @DisplayName("Successful exchange")
    class SuccessfulExchange {

        @Test
        @DisplayName("should issue an RS256 token bound to the target instance")
        void shouldIssueSignedToken() throws Exception {
            subjectTokenIsActive();

            var result = exchange(request("USA", "GBR", Set.of()));

            assertTrue(result.success());
            assertEquals("Bearer", result.tokenType());
            var claims = verify(result.accessToken().orElseThrow());
            assertEquals("jane.doe@mail.mil", claims.getSubject());
            assertEquals("TOP_SECRET", claims.getStringClaimValue("clearance"));
            assertEquals(List.of("FVEY", "NATO"), claims.getStringListClaimValue("acpCOI").stream().sorted().toList());
        }

        @Test
        @DisplayName("should cap the token lifetime at fifteen minutes")
        void shouldCapLifetime() throws Exception {
            subjectTokenIsActive();

            var result = exchange(request("USA", "GBR", Set.of()));

            assertEquals(900, result.expiresInSeconds());
            var claims = verify(result.accessToken().orElseThrow());
            assertEquals(900, claims.getExpirationTime().getValue() - claims.getIssuedAt().getValue());
        }

        @Test
        @DisplayName("should grant only scopes the trust edge allows")
        void shouldIntersectScopes() throws Exception {
            subjectTokenIsActive();

            var result = exchange(request("USA", "GBR", Set.of("policy:gbr", "admin:all")));

            assertEquals(Set.of("policy:gbr"), result.scope());
            assertEquals("policy:gbr", verify(result.accessToken().orElseThrow()).getStringClaimValue("scope"));
        }

        @Test
        @DisplayName("should record provenance in the token_exchange claim")
        void shouldRecordProvenance() throws Exception {
            subjectTokenIsActive();

            var result = exchange(request("usa", "gbr", Set.of()));

            @SuppressWarnings("unchecked")
            var block = (Map<String, Object>) verify(result.accessToken().orElseThrow()).getClaimValue("token_exchange");
            assertEquals(USA_ISSUER, block.get("original_issuer"));
            assertEquals("USA", block.get("original_instance"));
            assertEquals("GBR", block.get("target_instance"));
            assertEquals("high", block.get("trust_level"));
            assertEquals("TOP_SECRET", block.get("max_classification"));
        }

        @Test
        @DisplayName("should validate the subject token on behalf of the target")
        void shouldIntrospectAsTarget() {
            subjectTokenIsActive();

            exchange(request("USA", "GBR", Set.of("policy:base")));

            var captor = ArgumentCaptor.forClass(IntrospectionRequest.class);
            org.mockito.Mockito.verify(introspection).introspect(captor.capture());
            assertEquals("USA", captor.getValue().originInstance());
            assertEquals("GBR", captor.getValue().requestingInstance());
            assertEquals(SUBJECT_TOKEN, captor.getValue().token());
        }
    }

    @Nested
    @DisplayName("Refused exchange")
    class RefusedExchange {

        @Test
        @DisplayName("should refuse with invalid_grant when the origin does not trust the target")
        void shouldRefuseWithoutTrust() {
            var result = exchange(request("GBR", "FRA", Set.of()));

            assertFalse(result.success());
            assertEquals(TokenExchangeResult.INVALID_GRANT, result.error().orElseThrow());
            assertEquals("No bilateral trust between GBR and FRA", result.errorDescription().orElseThrow());
            assertTrue(result.accessToken().isEmpty());
            verifyNoInteractions(introspection);
            assertEquals(1, events.eventsOfType(FederationEvent.TrustDenied.class).size());
        }

        @Test
        @DisplayName("should refuse with invalid_grant when the subject token is inactive")
        void shouldRefuseInactiveToken() {
            when(introspection.introspect(any(IntrospectionRequest.class)))
                    .thenReturn(Uni.createFrom().item(IntrospectionResult.inactive(
                            "USA",
                            clock.instant(),
                            true,
                            FederationErrorCode.TOKEN_INVALID,
                            "Token has expired",
                            ValidationPath.LOCAL,
                            2)));

            var result = exchange(request("USA", "GBR", Set.of()));

            assertFalse(result.success());
            assertEquals(TokenExchangeResult.INVALID_GRANT, result.error().orElseThrow());
            assertEquals("Token has expired", result.errorDescription().orElseThrow());
        }

        @Test
        @DisplayName("should report server_error when validation fails unexpectedly")
        void shouldReportServerError() {
            when(introspection.introspect(any(IntrospectionRequest.class)))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("boom")));

            var result = exchange(request("USA", "GBR", Set.of()));

            assertFalse(result.success());
            assertEquals(TokenExchangeResult.SERVER_ERROR, result.error().orElseThrow());
        }

        @Test
        @DisplayName("should publish the outcome of every exchange")
        void shouldPublishOutcome() {
            var result = exchange(request("GBR", "FRA", Set.of()));

            var exchanged = events.eventsOfType(FederationEvent.TokenExchanged.class);
            assertEquals(1, exchanged.size());
            assertFalse(exchanged.get(0).success());
            assertEquals(result.auditId(), exchanged.get(0).auditId());
        }
    }
}
