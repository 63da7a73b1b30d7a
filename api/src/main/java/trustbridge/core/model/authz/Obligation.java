package trustbridge.core.model.authz;

/**
 * Follow-up actions the caller must honor when access is granted.
 */
public enum Obligation {
    AUDIT_FEDERATED_ACCESS,
    MARK_COALITION_ACCESS,
    KAS_KEY_REQUEST,
    ENHANCED_AUDIT_LOGGING
}
