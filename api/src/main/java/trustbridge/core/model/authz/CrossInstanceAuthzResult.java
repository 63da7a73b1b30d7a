package trustbridge.core.model.authz;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import trustbridge.core.model.federation.FederationErrorCode;

/**
 * Final cross-instance decision with its audit trail.
 *
 * <p>A deny always carries an {@code errorCode}; an allow never does.
 */
public record CrossInstanceAuthzResult(
        boolean allow,
        String reason,
        Optional<FederationErrorCode> errorCode,
        EvaluationDetails evaluationDetails,
        List<Obligation> obligations,
        long executionTimeMs,
        List<AuditEntry> auditTrail) {

    public CrossInstanceAuthzResult {
        errorCode = errorCode == null ? Optional.empty() : errorCode;
        obligations = obligations == null ? List.of() : List.copyOf(obligations);
        auditTrail = auditTrail == null ? List.of() : List.copyOf(auditTrail);
    }

    public static CrossInstanceAuthzResult granted(
            String reason,
            EvaluationDetails details,
            List<Obligation> obligations,
            long executionTimeMs,
            List<AuditEntry> auditTrail) {
        return new CrossInstanceAuthzResult(
                true, reason, Optional.empty(), details, obligations, executionTimeMs, auditTrail);
    }

    public static CrossInstanceAuthzResult denied(
            String reason,
            FederationErrorCode code,
            EvaluationDetails details,
            long executionTimeMs,
            List<AuditEntry> auditTrail) {
        return new CrossInstanceAuthzResult(
                false, reason, Optional.of(code), details, List.of(), executionTimeMs, auditTrail);
    }

    public CrossInstanceAuthzResult asCacheHit(long executionTimeMs) {
        return new CrossInstanceAuthzResult(
                allow,
                reason,
                errorCode,
                evaluationDetails.withCacheHit(true),
                obligations,
                executionTimeMs,
                auditTrail);
    }

    /**
     * Attach the trust edge that gated this decision and prepend the gate's audit steps.
     */
    public CrossInstanceAuthzResult withBilateralTrust(
            TrustSnapshot snapshot, List<AuditEntry> precedingTrail, long executionTimeMs) {
        final var trail = new ArrayList<AuditEntry>(precedingTrail.size() + auditTrail.size());
        trail.addAll(precedingTrail);
        trail.addAll(auditTrail);
        return new CrossInstanceAuthzResult(
                allow,
                reason,
                errorCode,
                evaluationDetails.withBilateralTrust(snapshot),
                obligations,
                executionTimeMs,
                trail);
    }
}
