package trustbridge.spi;

/**
 * SPI for reacting to federation events.
 *
 * <p>Implementations are CDI beans; the dispatcher receives all of them when it is
 * constructed. There is no registration at runtime.
 *
 * <p>Built-in listeners:
 * <ul>
 *   <li>{@code logging} - Logs events using JBoss Logging (priority 0)</li>
 *   <li>{@code metrics} - Records events as Micrometer counters (priority 10)</li>
 * </ul>
 */
public interface FederationEventListener {

    /**
     * Returns the unique name of this listener.
     *
     * @return listener name
     */
    String name();

    /**
     * Returns the priority of this listener. Higher priority listeners are invoked first.
     *
     * @return priority value
     */
    default int priority() {
        return 0;
    }

    /**
     * Returns whether this listener should receive events.
     *
     * @return true if available
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Handle a federation event.
     *
     * <p>Exceptions thrown here are logged by the dispatcher and do not reach other listeners.
     *
     * @param event the event to handle
     */
    void handle(FederationEvent event);

    /**
     * Called during shutdown to release any resources.
     */
    default void close() {}
}
