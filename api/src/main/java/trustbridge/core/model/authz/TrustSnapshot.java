package trustbridge.core.model.authz;

import java.util.Set;

import trustbridge.core.model.federation.BilateralTrust;
import trustbridge.core.model.federation.Classification;
import trustbridge.core.model.federation.TrustLevel;

/**
 * Copy of the trust edge a decision relied on.
 */
public record TrustSnapshot(
        String sourceInstance,
        String targetInstance,
        TrustLevel trustLevel,
        Classification maxClassification,
        Set<String> allowedScopes) {

    public static TrustSnapshot of(BilateralTrust trust) {
        return new TrustSnapshot(
                trust.sourceInstance(),
                trust.targetInstance(),
                trust.trustLevel(),
                trust.maxClassification(),
                trust.allowedScopes());
    }
}
