package trustbridge.adapter.out.http;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.DecodeException;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import trustbridge.core.config.FederationConfig;
import trustbridge.core.config.ResiliencyConfig;
import trustbridge.core.model.authz.PolicyInput;
import trustbridge.core.model.authz.RemotePolicyOutcome;
import trustbridge.core.model.federation.FederationException.RemoteEvaluationUnavailableException;
import trustbridge.core.model.federation.InstanceConfig;
import trustbridge.core.model.federation.MalformedPeerResponseException;
import trustbridge.core.port.out.RemotePolicyClient;

/**
 * Calls a peer's federation policy evaluation endpoint.
 *
 * <h2>Request Format</h2>
 * <pre>{@code
 * POST {baseUrl}/api/federation/evaluate-policy
 * Authorization: Bearer <token>
 * X-Request-Id: <requestId>
 * X-Federated-From: <local instance>
 *
 * { "subject": {..., "federatedFrom": "usa"}, "resource": {...}, "action": "read", "requestId": "..." }
 * }</pre>
 *
 * <h2>Response Format</h2>
 * <pre>{@code
 * { "allow": true, "reason": "..." }
 * }</pre>
 */
@ApplicationScoped
public class VertxRemotePolicyClient implements RemotePolicyClient {

    private static final Logger LOG = Logger.getLogger(VertxRemotePolicyClient.class);
    static final String EVALUATE_PATH = "/api/federation/evaluate-policy";

    private final WebClient webClient;
    private final String localInstance;
    private final Duration timeout;

    @Inject
    public VertxRemotePolicyClient(Vertx vertx, FederationConfig federationConfig, ResiliencyConfig resiliencyConfig) {
        this(vertx, federationConfig.localInstance(), resiliencyConfig.http().remotePolicyTimeout());
    }

    public VertxRemotePolicyClient(Vertx vertx, String localInstance, Duration timeout) {
        this.webClient = WebClient.create(vertx);
        this.localInstance = localInstance;
        this.timeout = timeout;
    }

    @Override
    public Uni<RemotePolicyOutcome> evaluate(InstanceConfig peer, PolicyInput input, String bearerToken) {
        final var url = Urls.join(peer.baseUrl(), EVALUATE_PATH);
        LOG.debugv("Requesting remote policy evaluation at {0} for request {1}", url, input.requestId());

        final var request = webClient
                .postAbs(url)
                .timeout(timeout.toMillis())
                .putHeader("Content-Type", "application/json")
                .putHeader("Accept", "application/json")
                .putHeader("X-Request-Id", input.requestId())
                .putHeader("X-Federated-From", localInstance);
        if (bearerToken != null && !bearerToken.isBlank()) {
            request.putHeader("Authorization", "Bearer " + bearerToken);
        }

        return request.sendJsonObject(FederationJson.remoteEvaluation(input, localInstance)).map(response -> {
            if (response.statusCode() == 404) {
                return new RemotePolicyOutcome.EndpointNotFound();
            }
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                LOG.warnv("Remote policy evaluation at {0} returned status {1}", url, response.statusCode());
                throw new RemoteEvaluationUnavailableException(
                        "Remote policy endpoint returned status " + response.statusCode());
            }
            try {
                final var decision = FederationJson.decision(response.bodyAsJsonObject());
                return new RemotePolicyOutcome.Decision(decision.allow(), decision.reason());
            } catch (DecodeException e) {
                throw new MalformedPeerResponseException("Remote policy response is not JSON", e);
            }
        });
    }
}
