package trustbridge.core.service.resilience;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import trustbridge.core.config.ResiliencyConfig;
import trustbridge.core.model.resilience.CircuitBreakerSettings;
import trustbridge.core.port.out.FederationEventPublisher;

/**
 * Holds one {@link CircuitBreaker} per peer instance, created on first use.
 */
@ApplicationScoped
public class CircuitBreakerRegistry {

    private static final Logger LOG = Logger.getLogger(CircuitBreakerRegistry.class);

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreakerSettings settings;
    private final Clock clock;
    private final DoubleSupplier random;
    private final FederationEventPublisher events;

    @Inject
    public CircuitBreakerRegistry(ResiliencyConfig config, Clock clock, FederationEventPublisher events) {
        this(
                config.circuitBreaker().toSettings(),
                clock,
                () -> ThreadLocalRandom.current().nextDouble(),
                events);
    }

    public CircuitBreakerRegistry(
            CircuitBreakerSettings settings, Clock clock, DoubleSupplier random, FederationEventPublisher events) {
        this.settings = settings;
        this.clock = clock;
        this.random = random;
        this.events = events;
    }

    /**
     * The breaker guarding calls to {@code peerId}. Ids are case-insensitive.
     */
    public CircuitBreaker forPeer(String peerId) {
        final var key = peerId.toLowerCase(Locale.ROOT);
        return breakers.computeIfAbsent(key, id -> {
            LOG.debugv("Creating circuit breaker for {0}", id);
            return new CircuitBreaker(id, settings, clock, random, events);
        });
    }

    public Collection<CircuitBreaker> all() {
        return List.copyOf(breakers.values());
    }

    /**
     * Apply time-based transitions on every breaker.
     */
    public void evaluateTimers() {
        breakers.values().forEach(CircuitBreaker::evaluateTimers);
    }

    public CircuitBreakerSettings settings() {
        return settings;
    }
}
