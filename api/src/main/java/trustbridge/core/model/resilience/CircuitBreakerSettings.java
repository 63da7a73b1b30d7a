package trustbridge.core.model.resilience;

import java.time.Duration;

/**
 * Tuning for a single circuit breaker.
 *
 * @param failureThreshold          failures inside {@code failureWindow} that open a closed circuit
 * @param failureWindow             sliding window for failure counting
 * @param recoveryTimeout           time spent open before moving to half-open
 * @param successThreshold          half-open successes needed to close
 * @param halfOpenTimeout           time allowed in half-open before reopening
 * @param halfOpenRequestPercentage share of calls (0-100) admitted while half-open
 * @param maxOfflineTime            how long cached peer policy stays usable without contact
 */
public record CircuitBreakerSettings(
        int failureThreshold,
        Duration failureWindow,
        Duration recoveryTimeout,
        int successThreshold,
        Duration halfOpenTimeout,
        int halfOpenRequestPercentage,
        Duration maxOfflineTime) {

    public CircuitBreakerSettings {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be positive");
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be positive");
        }
        if (halfOpenRequestPercentage < 0 || halfOpenRequestPercentage > 100) {
            throw new IllegalArgumentException(
                    "halfOpenRequestPercentage must be between 0 and 100, got " + halfOpenRequestPercentage);
        }
    }

    public static CircuitBreakerSettings defaults() {
        return new CircuitBreakerSettings(
                5,
                Duration.ofSeconds(60),
                Duration.ofSeconds(30),
                3,
                Duration.ofSeconds(60),
                20,
                Duration.ofHours(24));
    }
}
