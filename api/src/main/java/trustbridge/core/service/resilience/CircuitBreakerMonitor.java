package trustbridge.core.service.resilience;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;

/**
 * Drives breaker timers so that a peer with no traffic still moves from open to half-open.
 */
@ApplicationScoped
public class CircuitBreakerMonitor {

    private final CircuitBreakerRegistry registry;

    @Inject
    public CircuitBreakerMonitor(CircuitBreakerRegistry registry) {
        this.registry = registry;
    }

    @Scheduled(
            every = "${trustbridge.resiliency.circuit-breaker.monitor-interval:1s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void evaluateBreakers() {
        registry.evaluateTimers();
    }
}
