package trustbridge.core.model.resilience;

import java.time.Instant;
import java.util.Optional;

/**
 * Aggregate view of a peer's availability.
 */
public record FailoverState(
        String peerId,
        FailoverMode mode,
        CircuitBreakerState circuitBreaker,
        Optional<Instant> offlineSince,
        Optional<Instant> lastContact,
        boolean policyCacheValid,
        Instant policyCacheExpiry,
        Optional<String> maintenanceReason,
        Optional<Instant> maintenanceStartedAt,
        int recoveryAttempts,
        Optional<Instant> lastRecoveryAttempt) {}
