package trustbridge.adapter.out.telemetry;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import trustbridge.spi.FederationEvent;
import trustbridge.spi.FederationEventListener;

/**
 * Records federation events as Micrometer metrics.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code trustbridge.federation.events.total} - All events by type and severity</li>
 *   <li>{@code trustbridge.federation.circuit.transitions} - Breaker transitions by peer and state</li>
 *   <li>{@code trustbridge.federation.introspections} - Introspections by origin, path and outcome</li>
 *   <li>{@code trustbridge.federation.exchanges} - Token exchanges by direction and outcome</li>
 *   <li>{@code trustbridge.federation.authz.decisions} - Decisions by owner and outcome</li>
 *   <li>{@code trustbridge.federation.authz.duration} - Decision latency</li>
 *   <li>{@code trustbridge.federation.trust.denied} - Trust gate refusals</li>
 * </ul>
 */
@ApplicationScoped
public class MetricsFederationEventListener implements FederationEventListener {

    private final MeterRegistry registry;

    @Inject
    public MetricsFederationEventListener(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String name() {
        return "metrics";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isAvailable() {
        return registry != null;
    }

    @Override
    public void handle(FederationEvent event) {
        Counter.builder("trustbridge.federation.events.total")
                .tag("type", event.getClass().getSimpleName())
                .tag("severity", event.severity().name())
                .register(registry)
                .increment();

        if (event instanceof FederationEvent.CircuitStateChanged e) {
            Counter.builder("trustbridge.federation.circuit.transitions")
                    .tag("peer", e.peerId())
                    .tag("state", e.current().name())
                    .register(registry)
                    .increment();
        } else if (event instanceof FederationEvent.IntrospectionCompleted e) {
            Counter.builder("trustbridge.federation.introspections")
                    .tag("origin", e.originInstance())
                    .tag("path", e.path().name())
                    .tag("active", String.valueOf(e.active()))
                    .tag("cache_hit", String.valueOf(e.cacheHit()))
                    .register(registry)
                    .increment();
        } else if (event instanceof FederationEvent.TokenExchanged e) {
            Counter.builder("trustbridge.federation.exchanges")
                    .tag("origin", e.originInstance())
                    .tag("target", e.targetInstance())
                    .tag("outcome", e.success() ? "issued" : e.error().orElse("failed"))
                    .register(registry)
                    .increment();
        } else if (event instanceof FederationEvent.AuthorizationDecided e) {
            Counter.builder("trustbridge.federation.authz.decisions")
                    .tag("owner", e.owningInstance())
                    .tag("decision", e.allow() ? "allow" : "deny")
                    .tag("error", e.errorCode().map(Enum::name).orElse("none"))
                    .register(registry)
                    .increment();
            Timer.builder("trustbridge.federation.authz.duration")
                    .tag("cache_hit", String.valueOf(e.cacheHit()))
                    .register(registry)
                    .record(Duration.ofMillis(e.executionTimeMs()));
        } else if (event instanceof FederationEvent.TrustDenied e) {
            Counter.builder("trustbridge.federation.trust.denied")
                    .tag("source", e.sourceInstance())
                    .tag("target", e.targetInstance())
                    .tag("operation", e.operation())
                    .register(registry)
                    .increment();
        }
    }
}
