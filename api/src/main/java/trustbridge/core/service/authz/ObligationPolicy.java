package trustbridge.core.service.authz;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import trustbridge.core.model.authz.AuthzAction;
import trustbridge.core.model.authz.CrossInstanceAuthzRequest;
import trustbridge.core.model.authz.Obligation;
import trustbridge.core.model.federation.Classification;

/**
 * Obligations attached to a granted cross-instance access.
 */
final class ObligationPolicy {

    private final Classification enhancedAuditThreshold;

    ObligationPolicy(Classification enhancedAuditThreshold) {
        this.enhancedAuditThreshold = enhancedAuditThreshold;
    }

    /**
     * @param ownerCountry country of the owning instance, empty when unknown
     */
    List<Obligation> obligationsFor(CrossInstanceAuthzRequest request, Optional<String> ownerCountry) {
        final var obligations = new ArrayList<Obligation>();
        obligations.add(Obligation.AUDIT_FEDERATED_ACCESS);

        final var subjectCountry = request.subject().countryOfAffiliation();
        if (ownerCountry.isEmpty() || !ownerCountry.get().equalsIgnoreCase(subjectCountry)) {
            obligations.add(Obligation.MARK_COALITION_ACCESS);
        }

        if (request.action() == AuthzAction.DECRYPT) {
            obligations.add(Obligation.KAS_KEY_REQUEST);
        }

        // an unrecognized label is treated as high
        final var classification = Classification.parse(request.resource().classification());
        if (classification.isEmpty() || classification.get().isAtLeast(enhancedAuditThreshold)) {
            obligations.add(Obligation.ENHANCED_AUDIT_LOGGING);
        }
        return obligations;
    }
}
