package trustbridge.adapter.out.http;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.MultiMap;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import trustbridge.core.config.ResiliencyConfig;
import trustbridge.core.model.federation.FederationException.RemoteEvaluationUnavailableException;
import trustbridge.core.model.federation.InstanceConfig;
import trustbridge.core.model.federation.MalformedPeerResponseException;
import trustbridge.core.model.federation.PeerIntrospection;
import trustbridge.core.port.out.IntrospectionClient;

/**
 * RFC 7662 introspection against a peer's introspection endpoint.
 *
 * <h2>Request Format</h2>
 * <pre>{@code
 * POST <introspection-url>
 * Content-Type: application/x-www-form-urlencoded
 * X-Federated-From: USA
 *
 * token=eyJ...
 * }</pre>
 *
 * <h2>Response Format</h2>
 * <pre>{@code
 * { "active": true, "sub": "...", "exp": 1700000000, ... }
 * }</pre>
 */
@ApplicationScoped
public class VertxIntrospectionClient implements IntrospectionClient {

    private static final Logger LOG = Logger.getLogger(VertxIntrospectionClient.class);

    private final WebClient webClient;
    private final Duration timeout;

    @Inject
    public VertxIntrospectionClient(Vertx vertx, ResiliencyConfig config) {
        this(vertx, config.http().introspectionTimeout());
    }

    public VertxIntrospectionClient(Vertx vertx, Duration timeout) {
        this.webClient = WebClient.create(vertx);
        this.timeout = timeout;
    }

    @Override
    public Uni<PeerIntrospection> introspect(InstanceConfig origin, String token, String requestingInstance) {
        final var url = origin.introspectionUrl().toString();
        LOG.debugv("Introspecting token at {0} on behalf of {1}", url, requestingInstance);

        final var form = MultiMap.caseInsensitiveMultiMap().add("token", token);

        return webClient
                .postAbs(url)
                .timeout(timeout.toMillis())
                .putHeader("Accept", "application/json")
                .putHeader("X-Federated-From", requestingInstance)
                .sendForm(form)
                .map(response -> {
                    if (response.statusCode() != 200) {
                        LOG.warnv("Introspection at {0} returned status {1}", url, response.statusCode());
                        throw new RemoteEvaluationUnavailableException(
                                "Introspection endpoint returned status " + response.statusCode());
                    }
                    final JsonObject body;
                    try {
                        body = response.bodyAsJsonObject();
                    } catch (DecodeException e) {
                        throw new MalformedPeerResponseException("Introspection response is not JSON", e);
                    }
                    return parse(body);
                });
    }

    static PeerIntrospection parse(JsonObject body) {
        if (body == null || !(body.getValue("active") instanceof Boolean active)) {
            throw new MalformedPeerResponseException("Introspection response has no boolean 'active' member");
        }
        if (!active) {
            return new PeerIntrospection(false, FederationJson.toMap(body));
        }
        if (!(body.getValue("sub") instanceof String)) {
            throw new MalformedPeerResponseException("Active introspection response has no 'sub'");
        }
        if (!(body.getValue("exp") instanceof Number)) {
            throw new MalformedPeerResponseException("Active introspection response has no numeric 'exp'");
        }
        return new PeerIntrospection(true, FederationJson.toMap(body));
    }
}
