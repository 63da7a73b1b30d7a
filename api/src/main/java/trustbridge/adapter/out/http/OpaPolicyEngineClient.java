package trustbridge.adapter.out.http;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import trustbridge.core.config.FederationConfig;
import trustbridge.core.config.ResiliencyConfig;
import trustbridge.core.model.authz.PolicyDecision;
import trustbridge.core.model.authz.PolicyInput;
import trustbridge.core.model.federation.FederationException.LocalEvaluationUnavailableException;
import trustbridge.core.port.out.PolicyEngineClient;

/**
 * Local policy engine reached over the OPA data API.
 *
 * <p>The decision is read from {@code result.decision}, or from {@code result} itself when the
 * policy returns the decision object directly.
 */
@ApplicationScoped
public class OpaPolicyEngineClient implements PolicyEngineClient {

    private static final Logger LOG = Logger.getLogger(OpaPolicyEngineClient.class);

    private final WebClient webClient;
    private final String decisionUrl;
    private final Duration timeout;

    @Inject
    public OpaPolicyEngineClient(Vertx vertx, FederationConfig federationConfig, ResiliencyConfig resiliencyConfig) {
        this(
                vertx,
                federationConfig.authz().policyEngineUrl(),
                federationConfig.authz().policyPath(),
                resiliencyConfig.http().policyEngineTimeout());
    }

    public OpaPolicyEngineClient(Vertx vertx, String engineUrl, String policyPath, Duration timeout) {
        this.webClient = WebClient.create(vertx);
        this.decisionUrl = trimTrailingSlash(engineUrl) + "/v1/data/" + policyPath;
        this.timeout = timeout;
    }

    @Override
    public Uni<PolicyDecision> evaluate(PolicyInput input) {
        final var startTime = System.currentTimeMillis();
        return webClient
                .postAbs(decisionUrl)
                .timeout(timeout.toMillis())
                .putHeader("Content-Type", "application/json")
                .sendJsonObject(FederationJson.policyEngineInput(input))
                .map(response -> {
                    if (response.statusCode() != 200) {
                        throw new LocalEvaluationUnavailableException(
                                "Policy engine returned status " + response.statusCode());
                    }
                    final var decision = readDecision(response.bodyAsJsonObject());
                    LOG.debugv(
                            "Policy engine decision for request {0}: allow={1}, duration={2}ms",
                            input.requestId(),
                            decision.allow(),
                            System.currentTimeMillis() - startTime);
                    return decision;
                })
                .onFailure(error -> !(error instanceof LocalEvaluationUnavailableException))
                .transform(error -> new LocalEvaluationUnavailableException(
                        "Policy engine unavailable: " + error.getMessage(), error));
    }

    static PolicyDecision readDecision(JsonObject body) {
        final var result = body == null ? null : body.getValue("result");
        if (!(result instanceof JsonObject resultObject)) {
            throw new LocalEvaluationUnavailableException("Policy engine response has no result");
        }
        final var decision = resultObject.getValue("decision") instanceof JsonObject nested ? nested : resultObject;
        try {
            return FederationJson.decision(decision);
        } catch (RuntimeException e) {
            throw new LocalEvaluationUnavailableException("Policy engine returned a malformed decision", e);
        }
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
