package trustbridge.core.model.resilience;

/**
 * Outage accounting for one peer since its breaker was created or last reset.
 */
public record FailoverMetrics(
        long totalFailures,
        long totalSuccesses,
        long totalRecoveries,
        long totalCircuitOpens,
        long totalHalfOpenProbes,
        double averageRecoveryTimeMs,
        long longestOutageMs,
        long currentOutageMs,
        double uptimePercentage) {}
