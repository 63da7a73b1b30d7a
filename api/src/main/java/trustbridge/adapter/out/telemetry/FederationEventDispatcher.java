package trustbridge.adapter.out.telemetry;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import trustbridge.core.port.out.FederationEventPublisher;
import trustbridge.spi.FederationEvent;
import trustbridge.spi.FederationEventListener;

/**
 * Dispatches federation events to registered listeners.
 *
 * <p>Listeners are invoked in priority order (highest priority first) on a single background
 * thread, so publishing never blocks a request and listeners see events in publication order.
 */
@ApplicationScoped
public class FederationEventDispatcher implements FederationEventPublisher {

    private static final Logger LOG = Logger.getLogger(FederationEventDispatcher.class);

    private final List<FederationEventListener> listeners;
    private final ExecutorService executor;

    @Inject
    public FederationEventDispatcher(@Any Instance<FederationEventListener> discovered) {
        this(discovered.stream().toList(), Executors.newSingleThreadExecutor(r -> {
            var thread = new Thread(r, "federation-event-dispatcher");
            thread.setDaemon(true);
            return thread;
        }));
    }

    public FederationEventDispatcher(List<FederationEventListener> candidates, ExecutorService executor) {
        this.listeners = candidates.stream()
                .filter(FederationEventListener::isAvailable)
                .sorted(Comparator.comparingInt(FederationEventListener::priority).reversed())
                .toList();
        this.executor = executor;

        if (listeners.isEmpty()) {
            LOG.warn("No federation event listeners found - events will not be processed");
        } else {
            LOG.infof(
                    "Loaded %d federation event listener(s): %s",
                    listeners.size(),
                    listeners.stream()
                            .map(l -> l.name() + "(priority=" + l.priority() + ")")
                            .toList());
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdown();
        listeners.forEach(listener -> {
            try {
                listener.close();
            } catch (Exception e) {
                LOG.warnf("Error closing listener %s: %s", listener.name(), e.getMessage());
            }
        });
    }

    @Override
    public void publish(FederationEvent event) {
        if (listeners.isEmpty()) {
            return;
        }
        try {
            executor.submit(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            LOG.debugf("Dropping %s, dispatcher is shut down", event.getClass().getSimpleName());
        }
    }

    private void deliver(FederationEvent event) {
        for (var listener : listeners) {
            try {
                listener.handle(event);
            } catch (Exception e) {
                LOG.warnf("Listener %s failed to process event: %s", listener.name(), e.getMessage());
            }
        }
    }

    public List<FederationEventListener> getListeners() {
        return listeners;
    }
}
