package trustbridge.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import trustbridge.core.model.resilience.FailoverMode;
import trustbridge.core.service.resilience.CircuitBreakerRegistry;

/**
 * Reports the circuit state and failover mode of every peer contacted so far.
 *
 * <p>Always UP. An unreachable peer leads to fail-closed denials for that peer only; it does not
 * make this instance unable to serve. Peer outages are alerted on through the
 * {@code trustbridge.federation.circuit.transitions} metric.
 */
@Readiness
@ApplicationScoped
public class PeerAvailabilityHealthCheck implements HealthCheck {

    private final CircuitBreakerRegistry breakers;

    @Inject
    public PeerAvailabilityHealthCheck(CircuitBreakerRegistry breakers) {
        this.breakers = breakers;
    }

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name("federation-peers");
        long unavailable = 0;
        for (var breaker : breakers.all()) {
            final var state = breaker.state();
            builder.withData(breaker.peerId() + ".circuit", state.circuitBreaker().state().name());
            builder.withData(breaker.peerId() + ".mode", state.mode().name());
            if (state.mode() == FailoverMode.OFFLINE || state.mode() == FailoverMode.MAINTENANCE) {
                unavailable++;
            }
        }
        builder.withData("peers.tracked", breakers.all().size());
        builder.withData("peers.unavailable", unavailable);
        return builder.up().build();
    }
}
