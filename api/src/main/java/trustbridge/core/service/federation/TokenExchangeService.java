package trustbridge.core.service.federation;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import trustbridge.core.config.FederationConfig;
import trustbridge.core.model.federation.BilateralTrust;
import trustbridge.core.model.federation.ExchangeTokenClaims;
import trustbridge.core.model.federation.IntrospectionRequest;
import trustbridge.core.model.federation.IntrospectionResult;
import trustbridge.core.model.federation.TokenExchangeRequest;
import trustbridge.core.model.federation.TokenExchangeResult;
import trustbridge.core.model.federation.TokenType;
import trustbridge.core.port.out.ExchangeTokenSigner;
import trustbridge.core.port.out.FederationEventPublisher;
import trustbridge.spi.FederationEvent;

/**
 * RFC 8693 style token exchange between federation instances.
 *
 * <p>The issued token is bound to the target instance as audience, carries the subject's
 * normalized claims and a {@code token_exchange} provenance block, and lives at most
 * fifteen minutes. Its scopes are always a subset of the trust edge's allowed scopes.
 */
@ApplicationScoped
public class TokenExchangeService {

    private static final Logger LOG = Logger.getLogger(TokenExchangeService.class);
    static final Duration MAX_TOKEN_TTL = Duration.ofMinutes(15);

    private final TrustService trustService;
    private final TokenIntrospectionService introspectionService;
    private final ExchangeTokenSigner signer;
    private final FederationEventPublisher events;
    private final Clock clock;
    private final String localInstance;
    private final Optional<String> configuredIssuer;
    private final Duration tokenTtl;

    @Inject
    public TokenExchangeService(
            TrustService trustService,
            TokenIntrospectionService introspectionService,
            ExchangeTokenSigner signer,
            FederationEventPublisher events,
            FederationConfig config,
            Clock clock) {
        this(
                trustService,
                introspectionService,
                signer,
                events,
                clock,
                config.localInstance(),
                config.exchange().issuer(),
                config.exchange().tokenTtl());
    }

    public TokenExchangeService(
            TrustService trustService,
            TokenIntrospectionService introspectionService,
            ExchangeTokenSigner signer,
            FederationEventPublisher events,
            Clock clock,
            String localInstance,
            Optional<String> configuredIssuer,
            Duration tokenTtl) {
        this.trustService = trustService;
        this.introspectionService = introspectionService;
        this.signer = signer;
        this.events = events;
        this.clock = clock;
        this.localInstance = localInstance;
        this.configuredIssuer = configuredIssuer;
        this.tokenTtl = tokenTtl.compareTo(MAX_TOKEN_TTL) > 0 ? MAX_TOKEN_TTL : tokenTtl;
    }

    /**
     * Exchange a subject token from the origin instance for one usable at the target instance.
     *
     * <p>Fails with {@code invalid_grant} when there is no trust edge from origin to target or
     * when the subject token is not active. Never fails the returned {@link Uni}.
     */
    public Uni<TokenExchangeResult> exchange(TokenExchangeRequest request) {
        final var auditId = UUID.randomUUID().toString();
        final var origin = request.originInstance();
        final var target = request.targetInstance();

        LOG.infov("Token exchange {0} requested: {1} -> {2}", auditId, origin, target);

        final var trust = trustService.verifyTrust(origin, target);
        if (trust.isEmpty()) {
            LOG.warnv("Token exchange {0} refused: no bilateral trust {1} -> {2}", auditId, origin, target);
            events.publish(new FederationEvent.TrustDenied(clock.instant(), origin, target, "token_exchange"));
            return Uni.createFrom().item(finished(TokenExchangeResult.failed(
                    TokenExchangeResult.INVALID_GRANT,
                    "No bilateral trust between " + origin + " and " + target,
                    origin,
                    target,
                    auditId)));
        }

        final var introspection = new IntrospectionRequest(
                request.subjectToken(), origin, target, request.requestId(), request.requestedScopes());

        return introspectionService
                .introspect(introspection)
                .map(result -> issue(request, trust.get(), result, auditId))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.errorv(error, "Token exchange {0} failed", auditId);
                    return TokenExchangeResult.failed(
                            TokenExchangeResult.SERVER_ERROR, "Token exchange failed", origin, target, auditId);
                })
                .map(this::finished);
    }

    private TokenExchangeResult issue(
            TokenExchangeRequest request, BilateralTrust trust, IntrospectionResult introspection, String auditId) {
        final var origin = request.originInstance();
        final var target = request.targetInstance();

        if (!introspection.active() || introspection.claims().isEmpty()) {
            LOG.warnv(
                    "Token exchange {0} refused: subject token inactive ({1})",
                    auditId,
                    introspection.error().orElse("unknown"));
            return TokenExchangeResult.failed(
                    TokenExchangeResult.INVALID_GRANT,
                    introspection.error().orElse("Subject token is invalid or expired"),
                    origin,
                    target,
                    auditId);
        }

        final var subjectClaims = introspection.claims().get();
        final var scopes = TrustService.grantedScopes(trust, request.requestedScopes());
        final var now = clock.instant();
        final var claims = new ExchangeTokenClaims(
                issuer(),
                audience(target),
                UUID.randomUUID().toString(),
                now,
                now.plus(tokenTtl),
                subjectClaims,
                scopes,
                new ExchangeTokenClaims.Provenance(
                        subjectClaims.issuer(),
                        origin.toUpperCase(Locale.ROOT),
                        target.toUpperCase(Locale.ROOT),
                        trust.trustLevel(),
                        trust.maxClassification()));

        final var token = signer.sign(claims);
        LOG.infov(
                "Token exchange {0} issued for {1}: {2} -> {3}, scopes={4}",
                auditId,
                subjectClaims.uniqueId(),
                origin,
                target,
                scopes);
        return TokenExchangeResult.issued(
                token,
                tokenTtl.toSeconds(),
                request.requestedTokenType().orElse(TokenType.ACCESS_TOKEN),
                scopes,
                origin,
                target,
                auditId);
    }

    private TokenExchangeResult finished(TokenExchangeResult result) {
        events.publish(new FederationEvent.TokenExchanged(
                clock.instant(),
                result.auditId(),
                result.originInstance(),
                result.targetInstance(),
                result.success(),
                result.error()));
        return result;
    }

    private String issuer() {
        return configuredIssuer.orElseGet(() -> trustService
                .resolve(localInstance)
                .map(instance -> instance.baseUrl().toString())
                .orElse("urn:trustbridge:" + localInstance.toLowerCase(Locale.ROOT)));
    }

    private String audience(String target) {
        return trustService
                .resolve(target)
                .map(instance -> instance.baseUrl().toString())
                .orElse("urn:trustbridge:" + target.toLowerCase(Locale.ROOT));
    }

    /**
     * JWKS document peers use to verify exchange tokens issued here.
     */
    public String publicKeySet() {
        return signer.publicKeySetJson();
    }
}
