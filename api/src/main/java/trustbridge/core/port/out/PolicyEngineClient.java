package trustbridge.core.port.out;

import io.smallrye.mutiny.Uni;

import trustbridge.core.model.authz.PolicyDecision;
import trustbridge.core.model.authz.PolicyInput;

/**
 * Port for the local policy engine.
 */
public interface PolicyEngineClient {

    /**
     * Evaluate the authorization policy.
     *
     * <p>Fails with a {@code LocalEvaluationUnavailableException} when the engine cannot
     * be reached or answers with an unexpected shape.
     */
    Uni<PolicyDecision> evaluate(PolicyInput input);
}
