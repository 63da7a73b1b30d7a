package trustbridge.core.model.authz;

import java.time.Instant;

/**
 * One step of a decision's audit trail.
 *
 * @param action step identifier, e.g. {@code local_policy_result} or {@code remote_circuit_open}
 */
public record AuditEntry(Instant timestamp, String instanceId, String action, AuditOutcome outcome, String details) {}
