package trustbridge.core.service.federation;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import trustbridge.core.cache.CaffeineLocalCache;
import trustbridge.core.cache.LocalCache;
import trustbridge.core.config.FederationConfig;
import trustbridge.core.model.federation.BilateralTrust;
import trustbridge.core.model.federation.FederationErrorCode;
import trustbridge.core.model.federation.FederationException.CircuitOpenException;
import trustbridge.core.model.federation.FederationException.TokenInvalidException;
import trustbridge.core.model.federation.InstanceConfig;
import trustbridge.core.model.federation.IntrospectionRequest;
import trustbridge.core.model.federation.IntrospectionResult;
import trustbridge.core.model.federation.LocalVerification;
import trustbridge.core.model.federation.ValidationPath;
import trustbridge.core.port.out.FederationEventPublisher;
import trustbridge.core.port.out.IntrospectionClient;
import trustbridge.core.port.out.TokenVerifier;
import trustbridge.core.service.resilience.CircuitBreakerRegistry;
import trustbridge.core.util.SecureHash;
import trustbridge.spi.FederationEvent;

/**
 * Validates tokens issued by other federation instances.
 *
 * <p>Order of checks:
 * <ol>
 *   <li>Trust gate: the requesting instance must trust the origin; otherwise the token is
 *       rejected without any network call</li>
 *   <li>Introspection cache, keyed by a digest of token, origin and requester</li>
 *   <li>Local signature verification against the origin's published keys</li>
 *   <li>Remote introspection through the origin's circuit breaker, only when local
 *       verification is impossible</li>
 * </ol>
 *
 * <p>Only active results are cached.
 */
@ApplicationScoped
public class TokenIntrospectionService {

    private static final Logger LOG = Logger.getLogger(TokenIntrospectionService.class);
    static final Duration MAX_CACHE_TTL = Duration.ofSeconds(30);

    private final TrustService trustService;
    private final TokenVerifier tokenVerifier;
    private final IntrospectionClient introspectionClient;
    private final CircuitBreakerRegistry breakers;
    private final FederationEventPublisher events;
    private final LocalCache<String, IntrospectionResult> cache;
    private final Clock clock;

    @Inject
    public TokenIntrospectionService(
            TrustService trustService,
            TokenVerifier tokenVerifier,
            IntrospectionClient introspectionClient,
            CircuitBreakerRegistry breakers,
            FederationEventPublisher events,
            FederationConfig config,
            Clock clock) {
        this(
                trustService,
                tokenVerifier,
                introspectionClient,
                breakers,
                events,
                new CaffeineLocalCache<>(
                        cappedTtl(config.introspection().cacheTtl()),
                        config.introspection().maxCacheEntries()),
                clock);
    }

    public TokenIntrospectionService(
            TrustService trustService,
            TokenVerifier tokenVerifier,
            IntrospectionClient introspectionClient,
            CircuitBreakerRegistry breakers,
            FederationEventPublisher events,
            LocalCache<String, IntrospectionResult> cache,
            Clock clock) {
        this.trustService = trustService;
        this.tokenVerifier = tokenVerifier;
        this.introspectionClient = introspectionClient;
        this.breakers = breakers;
        this.events = events;
        this.cache = cache;
        this.clock = clock;
    }

    static Duration cappedTtl(Duration configured) {
        return configured.compareTo(MAX_CACHE_TTL) > 0 ? MAX_CACHE_TTL : configured;
    }

    /**
     * Validate {@code request.token()} as issued by {@code request.originInstance()}.
     *
     * <p>Never fails; every problem is reported as an inactive result with an error code.
     */
    public Uni<IntrospectionResult> introspect(IntrospectionRequest request) {
        final var started = clock.millis();
        final var origin = trustService.codeOf(request.originInstance());
        final var requester = trustService.codeOf(request.requestingInstance());

        final var trust = trustService.verifyTrust(requester, origin);
        if (trust.isEmpty()) {
            LOG.warnv("Introspection refused: no bilateral trust {0} -> {1}", requester, origin);
            events.publish(new FederationEvent.TrustDenied(clock.instant(), requester, origin, "introspection"));
            return Uni.createFrom().item(completed(request, inactive(
                    request,
                    false,
                    FederationErrorCode.NO_BILATERAL_TRUST,
                    "No bilateral trust between " + requester + " and " + origin,
                    ValidationPath.NONE,
                    started)));
        }

        final var originInstance = trustService.resolve(origin);
        if (originInstance.isEmpty()) {
            LOG.warnv("Introspection refused: instance {0} is unknown or disabled", origin);
            return Uni.createFrom().item(completed(request, inactive(
                    request,
                    false,
                    FederationErrorCode.NO_BILATERAL_TRUST,
                    "Unknown or disabled instance: " + origin,
                    ValidationPath.NONE,
                    started)));
        }

        if (request.token() == null || request.token().isBlank()) {
            return Uni.createFrom().item(completed(request, inactive(
                    request, true, FederationErrorCode.TOKEN_INVALID, "Token is empty", ValidationPath.NONE, started)));
        }

        final var key = cacheKey(request.token(), origin, requester);
        final var cached = lookup(key);
        if (cached.isPresent()) {
            LOG.debugv("Introspection cache hit for {0} -> {1}", requester, origin);
            final var scopes = TrustService.grantedScopes(trust.get(), request.requestedScopes());
            return Uni.createFrom().item(completed(request, cached.get().asCacheHit(scopes, clock.millis() - started)));
        }

        return validate(request, originInstance.get(), trust.get(), started)
                .invoke(result -> {
                    if (result.active()) {
                        store(key, result);
                    }
                    completed(request, result);
                });
    }

    private Uni<IntrospectionResult> validate(
            IntrospectionRequest request, InstanceConfig origin, BilateralTrust trust, long started) {
        return tokenVerifier.verify(request.token(), origin).flatMap(verification -> {
            if (verification instanceof LocalVerification.Verified verified) {
                return Uni.createFrom().item(activeResult(request, origin, trust, verified.claims(), ValidationPath.LOCAL, started));
            }
            if (verification instanceof LocalVerification.Rejected rejected) {
                LOG.debugv("Token from {0} rejected locally: {1}", origin.instanceCode(), rejected.reason());
                return Uni.createFrom().item(inactive(
                        request, true, FederationErrorCode.TOKEN_INVALID, rejected.reason(), ValidationPath.LOCAL, started));
            }
            final var unavailable = (LocalVerification.Unavailable) verification;
            LOG.debugv(
                    "Local verification unavailable for {0} ({1}), using remote introspection",
                    origin.instanceCode(),
                    unavailable.reason());
            return introspectRemotely(request, origin, trust, started);
        });
    }

    private Uni<IntrospectionResult> introspectRemotely(
            IntrospectionRequest request, InstanceConfig origin, BilateralTrust trust, long started) {
        final var requesterCode = trustService.codeOf(request.requestingInstance());
        return breakers.forPeer(origin.instanceId())
                .guard(() -> introspectionClient.introspect(origin, request.token(), requesterCode))
                .map(response -> {
                    if (!response.active()) {
                        return inactive(
                                request,
                                true,
                                FederationErrorCode.TOKEN_INVALID,
                                "Token is not active",
                                ValidationPath.REMOTE,
                                started);
                    }
                    return activeResult(request, origin, trust, response.claims(), ValidationPath.REMOTE, started);
                })
                .onFailure(CircuitOpenException.class)
                .recoverWithItem(error -> inactive(
                        request,
                        true,
                        FederationErrorCode.REMOTE_EVALUATION_UNAVAILABLE,
                        error.getMessage(),
                        ValidationPath.NONE,
                        started))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Remote introspection at {0} failed: {1}", origin.instanceCode(), error.getMessage());
                    return inactive(
                            request,
                            true,
                            FederationErrorCode.REMOTE_EVALUATION_UNAVAILABLE,
                            "Introspection failed: " + error.getMessage(),
                            ValidationPath.REMOTE,
                            started);
                });
    }

    private IntrospectionResult activeResult(
            IntrospectionRequest request,
            InstanceConfig origin,
            BilateralTrust trust,
            Map<String, Object> rawClaims,
            ValidationPath path,
            long started) {
        try {
            final var claims = ClaimsNormalizer.normalize(rawClaims, origin, clock.instant());
            return IntrospectionResult.active(
                    claims,
                    request.originInstance(),
                    clock.instant(),
                    TrustService.grantedScopes(trust, request.requestedScopes()),
                    path,
                    clock.millis() - started);
        } catch (TokenInvalidException e) {
            return inactive(request, true, FederationErrorCode.TOKEN_INVALID, e.getMessage(), path, started);
        }
    }

    private IntrospectionResult inactive(
            IntrospectionRequest request,
            boolean trustVerified,
            FederationErrorCode code,
            String error,
            ValidationPath path,
            long started) {
        return IntrospectionResult.inactive(
                request.originInstance(), clock.instant(), trustVerified, code, error, path, clock.millis() - started);
    }

    private IntrospectionResult completed(IntrospectionRequest request, IntrospectionResult result) {
        events.publish(new FederationEvent.IntrospectionCompleted(
                clock.instant(),
                request.originInstance(),
                request.requestingInstance(),
                result.active(),
                result.validationPath(),
                result.cacheHit(),
                result.errorCode(),
                result.latencyMs()));
        return result;
    }

    private Optional<IntrospectionResult> lookup(String key) {
        try {
            return cache.get(key);
        } catch (RuntimeException e) {
            LOG.warnv("Introspection cache read failed, continuing uncached: {0}", e.getMessage());
            return Optional.empty();
        }
    }

    private void store(String key, IntrospectionResult result) {
        try {
            cache.put(key, result);
        } catch (RuntimeException e) {
            LOG.warnv("Introspection cache write failed: {0}", e.getMessage());
        }
    }

    /**
     * Digest of token, origin and requester. The token itself never becomes part of a key.
     *
     * <p>All tokens signed with the same JOSE header share a long common prefix, so the
     * whole token is digested rather than a prefix of it.
     */
    static String cacheKey(IntrospectionRequest request) {
        return cacheKey(request.token(), request.originInstance(), request.requestingInstance());
    }

    private static String cacheKey(String token, String origin, String requester) {
        return SecureHash.fingerprint(token, origin.toUpperCase(Locale.ROOT), requester.toUpperCase(Locale.ROOT));
    }

    /**
     * Drop every cached introspection result.
     */
    public void clearCache() {
        cache.invalidateAll();
        LOG.info("Introspection cache cleared");
    }

    public long cacheSize() {
        return cache.estimatedSize();
    }
}
