package trustbridge.adapter.out.http;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import trustbridge.core.config.FederationConfig;
import trustbridge.core.config.ResiliencyConfig;
import trustbridge.core.model.authz.FederatedResource;
import trustbridge.core.model.authz.FederatedResourceQuery;
import trustbridge.core.model.federation.FederationException.RemoteEvaluationUnavailableException;
import trustbridge.core.model.federation.InstanceConfig;
import trustbridge.core.model.federation.MalformedPeerResponseException;
import trustbridge.core.port.out.FederatedResourceClient;

/**
 * Runs a resource search at a peer.
 *
 * <p>{@code POST {baseUrl}/api/federation/query-resources} with {@code {"query": {...}, "requestId": "..."}};
 * the peer answers {@code {"resources": [...]}}.
 */
@ApplicationScoped
public class VertxFederatedResourceClient implements FederatedResourceClient {

    private static final Logger LOG = Logger.getLogger(VertxFederatedResourceClient.class);
    static final String QUERY_PATH = "/api/federation/query-resources";

    private final WebClient webClient;
    private final String localInstance;
    private final Duration timeout;

    @Inject
    public VertxFederatedResourceClient(
            Vertx vertx, FederationConfig federationConfig, ResiliencyConfig resiliencyConfig) {
        this(vertx, federationConfig.localInstance(), resiliencyConfig.http().resourceQueryTimeout());
    }

    public VertxFederatedResourceClient(Vertx vertx, String localInstance, Duration timeout) {
        this.webClient = WebClient.create(vertx);
        this.localInstance = localInstance;
        this.timeout = timeout;
    }

    @Override
    public Uni<List<FederatedResource>> query(InstanceConfig peer, FederatedResourceQuery query) {
        final var url = Urls.join(peer.baseUrl(), QUERY_PATH);
        final var body = new JsonObject()
                .put("query", new JsonObject(new LinkedHashMap<>(query.criteria())))
                .put("requestId", query.requestId());

        final var request = webClient
                .postAbs(url)
                .timeout(timeout.toMillis())
                .putHeader("Content-Type", "application/json")
                .putHeader("Accept", "application/json")
                .putHeader("X-Request-Id", query.requestId())
                .putHeader("X-Federated-From", localInstance);
        query.bearerToken().ifPresent(token -> request.putHeader("Authorization", "Bearer " + token));

        return request.sendJsonObject(body).map(response -> {
            if (response.statusCode() != 200) {
                LOG.warnv("Resource query at {0} returned status {1}", url, response.statusCode());
                throw new RemoteEvaluationUnavailableException(
                        "Resource query endpoint returned status " + response.statusCode());
            }
            final JsonObject json;
            try {
                json = response.bodyAsJsonObject();
            } catch (DecodeException e) {
                throw new MalformedPeerResponseException("Resource query response is not JSON", e);
            }
            if (json == null || !(json.getValue("resources") instanceof JsonArray resources)) {
                throw new MalformedPeerResponseException("Resource query response has no 'resources' array");
            }
            final var result = new ArrayList<FederatedResource>(resources.size());
            for (int i = 0; i < resources.size(); i++) {
                if (!(resources.getValue(i) instanceof JsonObject item)) {
                    throw new MalformedPeerResponseException("Resource entry " + i + " is not an object");
                }
                result.add(FederationJson.resource(item, peer));
            }
            LOG.debugv("Instance {0} returned {1} resources", peer.instanceId(), result.size());
            return result;
        });
    }
}
