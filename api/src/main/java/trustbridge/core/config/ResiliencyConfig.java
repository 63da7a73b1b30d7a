package trustbridge.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import trustbridge.core.model.resilience.CircuitBreakerSettings;

/**
 * Configuration mapping for resiliency settings including timeouts, breakers and cache limits.
 *
 * <p>Configuration prefix: {@code trustbridge.resiliency}
 *
 * <p>This configuration controls:
 * <ul>
 *   <li>Per-peer circuit breaker thresholds and timers</li>
 *   <li>JWKS fetch timeouts and cache limits</li>
 *   <li>Outbound HTTP timeouts per operation</li>
 * </ul>
 */
@ConfigMapping(prefix = "trustbridge.resiliency")
public interface ResiliencyConfig {

    /**
     * Circuit breaker configuration, applied to every peer.
     */
    CircuitBreakerConfig circuitBreaker();

    /**
     * JWKS fetch and cache configuration.
     */
    JwksConfig jwks();

    /**
     * Outbound HTTP timeout configuration.
     */
    HttpConfig http();

    interface CircuitBreakerConfig {

        /**
         * @return failures within the window that open the circuit (default: 5)
         */
        @WithDefault("5")
        int failureThreshold();

        /**
         * @return sliding window for failure counting (default: 60 seconds)
         */
        @WithDefault("PT60S")
        Duration failureWindow();

        /**
         * @return time spent open before probing (default: 30 seconds)
         */
        @WithDefault("PT30S")
        Duration recoveryTimeout();

        /**
         * @return half-open successes needed to close (default: 3)
         */
        @WithDefault("3")
        int successThreshold();

        /**
         * @return time allowed in half-open before reopening (default: 60 seconds)
         */
        @WithDefault("PT60S")
        Duration halfOpenTimeout();

        /**
         * @return percentage of calls admitted while half-open (default: 20)
         */
        @WithDefault("20")
        int halfOpenRequestPercentage();

        /**
         * How long cached peer policy remains usable without contact. Past this a
         * degraded peer is reported offline.
         *
         * @return max offline time (default: 24 hours)
         */
        @WithDefault("PT24H")
        Duration maxOfflineTime();

        /**
         * @return how often breaker timers are evaluated (default: 1s)
         */
        @WithDefault("1s")
        String monitorInterval();

        default CircuitBreakerSettings toSettings() {
            return new CircuitBreakerSettings(
                    failureThreshold(),
                    failureWindow(),
                    recoveryTimeout(),
                    successThreshold(),
                    halfOpenTimeout(),
                    halfOpenRequestPercentage(),
                    maxOfflineTime());
        }
    }

    interface JwksConfig {

        /**
         * Maximum time to wait when fetching JWKS from a peer.
         *
         * <p>If exceeded, falls back to cached keys if available.
         *
         * @return Fetch timeout duration (default: 5 seconds)
         */
        @WithDefault("PT5S")
        Duration fetchTimeout();

        /**
         * @return Maximum cache entries, one per peer (default: 100)
         */
        @WithDefault("100")
        int maxCacheEntries();

        /**
         * @return Cache TTL duration (default: 1 hour)
         */
        @WithDefault("PT1H")
        Duration cacheTtl();
    }

    interface HttpConfig {

        /**
         * @return timeout for peer introspection calls (default: 10 seconds)
         */
        @WithDefault("PT10S")
        Duration introspectionTimeout();

        /**
         * @return timeout for local policy engine calls (default: 5 seconds)
         */
        @WithDefault("PT5S")
        Duration policyEngineTimeout();

        /**
         * @return timeout for remote policy evaluation (default: 10 seconds)
         */
        @WithDefault("PT10S")
        Duration remotePolicyTimeout();

        /**
         * @return timeout for federated resource queries (default: 10 seconds)
         */
        @WithDefault("PT10S")
        Duration resourceQueryTimeout();
    }
}
