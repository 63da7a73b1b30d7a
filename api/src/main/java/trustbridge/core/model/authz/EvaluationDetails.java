package trustbridge.core.model.authz;

import java.util.Optional;

/**
 * The intermediate verdicts behind a {@link CrossInstanceAuthzResult}.
 */
public record EvaluationDetails(
        PolicyDecision localDecision,
        Optional<RemoteDecision> remoteDecision,
        Optional<AttributeTranslation> attributeTranslation,
        Optional<TrustSnapshot> bilateralTrust,
        boolean trustVerified,
        boolean cacheHit) {

    public static EvaluationDetails localOnly(PolicyDecision localDecision, boolean trustVerified) {
        return new EvaluationDetails(
                localDecision, Optional.empty(), Optional.empty(), Optional.empty(), trustVerified, false);
    }

    public EvaluationDetails withCacheHit(boolean hit) {
        return new EvaluationDetails(localDecision, remoteDecision, attributeTranslation, bilateralTrust, trustVerified, hit);
    }

    public EvaluationDetails withBilateralTrust(TrustSnapshot snapshot) {
        return new EvaluationDetails(
                localDecision, remoteDecision, attributeTranslation, Optional.of(snapshot), true, cacheHit);
    }
}
