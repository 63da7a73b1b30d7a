package trustbridge.spi;

import java.time.Instant;
import java.util.Optional;

import trustbridge.core.model.federation.FederationErrorCode;
import trustbridge.core.model.federation.ValidationPath;
import trustbridge.core.model.resilience.CircuitState;
import trustbridge.core.model.resilience.FailoverMode;

/**
 * Sealed interface representing notable federation events.
 *
 * <p>Events are dispatched to every {@link FederationEventListener} known at startup,
 * for logging, metrics and alerting.
 *
 * <p>Event types:
 * <ul>
 *   <li>{@link CircuitStateChanged} - A peer's breaker changed state</li>
 *   <li>{@link FailoverModeChanged} - A peer's operating mode changed</li>
 *   <li>{@link IntrospectionCompleted} - A foreign token was validated or rejected</li>
 *   <li>{@link TokenExchanged} - An exchange token was issued or refused</li>
 *   <li>{@link AuthorizationDecided} - A cross-instance decision was made</li>
 *   <li>{@link TrustDenied} - A request was refused for lack of a trust edge</li>
 * </ul>
 */
public sealed interface FederationEvent {

    /**
     * Return the timestamp when this event occurred.
     *
     * @return event timestamp
     */
    Instant timestamp();

    /**
     * Return the severity level of this event.
     *
     * @return severity level
     */
    Severity severity();

    /**
     * Severity levels for federation events.
     */
    enum Severity {
        /** Routine outcomes. */
        INFO,
        /** Denials and degraded peers. */
        WARNING,
        /** A peer is unreachable. */
        CRITICAL
    }

    /**
     * @param reason what triggered the transition
     */
    record CircuitStateChanged(
            Instant timestamp, String peerId, CircuitState previous, CircuitState current, String reason)
            implements FederationEvent {

        @Override
        public Severity severity() {
            return switch (current) {
                case OPEN -> Severity.CRITICAL;
                case HALF_OPEN -> Severity.WARNING;
                case CLOSED -> Severity.INFO;
            };
        }
    }

    record FailoverModeChanged(Instant timestamp, String peerId, FailoverMode previous, FailoverMode current)
            implements FederationEvent {

        @Override
        public Severity severity() {
            return current == FailoverMode.NORMAL ? Severity.INFO : Severity.WARNING;
        }
    }

    /**
     * @param errorCode present when the token was not accepted
     */
    record IntrospectionCompleted(
            Instant timestamp,
            String originInstance,
            String requestingInstance,
            boolean active,
            ValidationPath path,
            boolean cacheHit,
            Optional<FederationErrorCode> errorCode,
            long latencyMs)
            implements FederationEvent {

        @Override
        public Severity severity() {
            return active ? Severity.INFO : Severity.WARNING;
        }
    }

    /**
     * @param error RFC 8693 error code when the exchange was refused
     */
    record TokenExchanged(
            Instant timestamp,
            String auditId,
            String originInstance,
            String targetInstance,
            boolean success,
            Optional<String> error)
            implements FederationEvent {

        @Override
        public Severity severity() {
            return success ? Severity.INFO : Severity.WARNING;
        }
    }

    record AuthorizationDecided(
            Instant timestamp,
            String requestId,
            String resourceId,
            String owningInstance,
            boolean allow,
            Optional<FederationErrorCode> errorCode,
            boolean cacheHit,
            long executionTimeMs)
            implements FederationEvent {

        @Override
        public Severity severity() {
            return allow ? Severity.INFO : Severity.WARNING;
        }
    }

    record TrustDenied(Instant timestamp, String sourceInstance, String targetInstance, String operation)
            implements FederationEvent {

        @Override
        public Severity severity() {
            return Severity.WARNING;
        }
    }
}
