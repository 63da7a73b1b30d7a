package trustbridge.core.port.out;

import trustbridge.spi.FederationEvent;

/**
 * Port for publishing federation events to listeners.
 *
 * <p>Publishing never blocks the caller and never fails.
 */
public interface FederationEventPublisher {

    void publish(FederationEvent event);
}
