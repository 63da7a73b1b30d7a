package trustbridge.adapter.out.http;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.lang.JoseException;

import trustbridge.core.config.ResiliencyConfig;
import trustbridge.core.port.out.JwksCache;

/**
 * Signing keys published by peer instances, kept per JWKS endpoint.
 *
 * <p>A key set is downloaded at most once per endpoint at a time; callers arriving while a
 * download runs share its result. A key set older than the configured TTL is downloaded again.
 * If that download fails or times out, the last key set obtained from the peer keeps being used,
 * so a peer whose key endpoint is briefly down can still be verified locally. Only a peer never
 * reached before yields {@link JwksFetchException}.
 */
@ApplicationScoped
public class JwksCacheService implements JwksCache {

    private static final Logger LOG = Logger.getLogger(JwksCacheService.class);

    private final WebClient webClient;
    private final ResiliencyConfig.JwksConfig jwksConfig;
    private final Clock clock;
    private final Counter fetchTimeouts;

    // entries are never evicted by age; freshness is decided by PeerKeys.freshUntil
    private final Cache<URI, PeerKeys> keysByEndpoint;
    private final Map<URI, Uni<JsonWebKeySet>> downloads = new ConcurrentHashMap<>();

    @Inject
    public JwksCacheService(Vertx vertx, ResiliencyConfig resiliencyConfig, MeterRegistry meterRegistry, Clock clock) {
        this(vertx, resiliencyConfig.jwks(), meterRegistry, clock);
    }

    public JwksCacheService(
            Vertx vertx, ResiliencyConfig.JwksConfig jwksConfig, MeterRegistry meterRegistry, Clock clock) {
        this.webClient = WebClient.create(vertx);
        this.jwksConfig = jwksConfig;
        this.clock = clock;
        this.keysByEndpoint = Caffeine.newBuilder()
                .maximumSize(jwksConfig.maxCacheEntries())
                .recordStats()
                .build();

        CaffeineCacheMetrics.monitor(meterRegistry, keysByEndpoint, "trustbridge.jwks.cache");
        this.fetchTimeouts = Counter.builder("trustbridge.jwks.fetch.timeouts")
                .description("JWKS fetches that exceeded the fetch timeout")
                .register(meterRegistry);
    }

    @Override
    public Uni<JsonWebKeySet> getKeySet(URI jwksUri) {
        final var known = keysByEndpoint.getIfPresent(jwksUri);
        if (known != null && known.isFresh(clock.instant())) {
            return Uni.createFrom().item(known.keySet());
        }
        return sharedDownload(jwksUri);
    }

    @Override
    public Uni<Optional<JsonWebKey>> getKey(URI jwksUri, String keyId) {
        return getKeySet(jwksUri).map(keySet -> findKey(keySet, keyId));
    }

    @Override
    public Uni<JsonWebKeySet> refresh(URI jwksUri) {
        LOG.debugv("Signing keys of {0} requested out of cycle", jwksUri);
        downloads.remove(jwksUri);
        return sharedDownload(jwksUri);
    }

    @Override
    public void invalidate(URI jwksUri) {
        keysByEndpoint.invalidate(jwksUri);
        downloads.remove(jwksUri);
    }

    @Override
    public void invalidateAll() {
        keysByEndpoint.invalidateAll();
        downloads.clear();
        LOG.info("All cached peer signing keys dropped");
    }

    /**
     * The key a token's {@code kid} designates.
     *
     * <p>A token without a {@code kid} only matches a key set holding exactly one key.
     */
    public static Optional<JsonWebKey> findKey(JsonWebKeySet keySet, String keyId) {
        final List<JsonWebKey> keys = keySet.getJsonWebKeys();
        if (keyId == null) {
            return keys.size() == 1 ? Optional.of(keys.get(0)) : Optional.empty();
        }
        return keys.stream().filter(key -> keyId.equals(key.getKeyId())).findFirst();
    }

    private Uni<JsonWebKeySet> sharedDownload(URI jwksUri) {
        return Uni.createFrom().deferred(() -> downloads.computeIfAbsent(jwksUri, uri -> download(uri)
                .onTermination()
                .invoke(() -> downloads.remove(uri))
                .memoize()
                .indefinitely()));
    }

    private Uni<JsonWebKeySet> download(URI jwksUri) {
        final var timeout = jwksConfig.fetchTimeout();
        return webClient
                .getAbs(jwksUri.toString())
                .ssl("https".equals(jwksUri.getScheme()))
                .send()
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    fetchTimeouts.increment();
                    return new JwksFetchException("No JWKS response from " + jwksUri + " within " + timeout);
                })
                .map(JwksCacheService::toKeySet)
                .invoke(keySet -> remember(jwksUri, keySet))
                .onFailure()
                .recoverWithUni(error -> lastKnown(jwksUri, error));
    }

    private void remember(URI jwksUri, JsonWebKeySet keySet) {
        final var now = clock.instant();
        keysByEndpoint.put(jwksUri, new PeerKeys(keySet, now, now.plus(jwksConfig.cacheTtl())));
        LOG.debugv("Peer {0} publishes {1} signing key(s)", jwksUri, keySet.getJsonWebKeys().size());
    }

    private Uni<JsonWebKeySet> lastKnown(URI jwksUri, Throwable error) {
        final var known = keysByEndpoint.getIfPresent(jwksUri);
        if (known != null) {
            LOG.warnv(
                    "Signing keys of {0} unavailable ({1}), keeping keys obtained at {2}",
                    jwksUri,
                    error.getMessage(),
                    known.obtainedAt());
            return Uni.createFrom().item(known.keySet());
        }
        LOG.errorv("Signing keys of {0} unavailable and none obtained before: {1}", jwksUri, error.getMessage());
        final var failure = error instanceof JwksFetchException
                ? error
                : new JwksFetchException("JWKS of " + jwksUri + " unavailable: " + error.getMessage(), error);
        return Uni.createFrom().failure(failure);
    }

    private static JsonWebKeySet toKeySet(HttpResponse<Buffer> response) {
        if (response.statusCode() != 200) {
            throw new JwksFetchException("JWKS endpoint answered with status " + response.statusCode());
        }
        try {
            return new JsonWebKeySet(response.bodyAsString());
        } catch (JoseException e) {
            throw new JwksFetchException("JWKS response is not a key set: " + e.getMessage(), e);
        }
    }

    private record PeerKeys(JsonWebKeySet keySet, Instant obtainedAt, Instant freshUntil) {
        boolean isFresh(Instant now) {
            return !now.isAfter(freshUntil);
        }
    }

    /**
     * A key set could not be downloaded and none was obtained before.
     */
    public static class JwksFetchException extends RuntimeException {
        public JwksFetchException(String message) {
            super(message);
        }

        public JwksFetchException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
