package trustbridge.core.model.resilience;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Point-in-time copy of a breaker's internal counters.
 */
public record CircuitBreakerState(
        CircuitState state,
        int failures,
        int successes,
        List<Instant> failureHistory,
        Optional<Instant> lastFailure,
        Optional<Instant> lastSuccess,
        Instant lastStateChange,
        Optional<Instant> openedAt,
        Optional<Instant> halfOpenAt) {

    public CircuitBreakerState {
        failureHistory = List.copyOf(failureHistory);
    }
}
