package trustbridge.core.model.authz;

public enum AuditOutcome {
    ALLOW,
    DENY,
    ERROR
}
