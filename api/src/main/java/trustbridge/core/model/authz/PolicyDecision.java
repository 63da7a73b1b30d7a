package trustbridge.core.model.authz;

/**
 * Verdict of a single policy evaluation.
 */
public record PolicyDecision(boolean allow, String reason) {

    public static PolicyDecision allowed(String reason) {
        return new PolicyDecision(true, reason);
    }

    public static PolicyDecision denied(String reason) {
        return new PolicyDecision(false, reason);
    }
}
