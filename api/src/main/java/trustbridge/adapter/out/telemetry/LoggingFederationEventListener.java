package trustbridge.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import trustbridge.spi.FederationEvent;
import trustbridge.spi.FederationEventListener;

/**
 * Logs federation events on the {@code trustbridge.federation} category.
 *
 * <p>Log levels follow event severity:
 * <ul>
 *   <li>INFO severity → DEBUG level</li>
 *   <li>WARNING severity → WARN level</li>
 *   <li>CRITICAL severity → ERROR level</li>
 * </ul>
 */
@ApplicationScoped
public class LoggingFederationEventListener implements FederationEventListener {

    private static final Logger LOG = Logger.getLogger("trustbridge.federation");

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public void handle(FederationEvent event) {
        var message = format(event);
        switch (event.severity()) {
            case INFO -> LOG.debug(message);
            case WARNING -> LOG.warn(message);
            case CRITICAL -> LOG.error(message);
        }
    }

    static String format(FederationEvent event) {
        if (event instanceof FederationEvent.CircuitStateChanged e) {
            return String.format(
                    "CIRCUIT_STATE: peer=%s %s->%s reason=%s", e.peerId(), e.previous(), e.current(), e.reason());
        }
        if (event instanceof FederationEvent.FailoverModeChanged e) {
            return String.format("FAILOVER_MODE: peer=%s %s->%s", e.peerId(), e.previous(), e.current());
        }
        if (event instanceof FederationEvent.IntrospectionCompleted e) {
            return String.format(
                    "INTROSPECTION: origin=%s requester=%s active=%s path=%s cacheHit=%s error=%s latency=%dms",
                    e.originInstance(),
                    e.requestingInstance(),
                    e.active(),
                    e.path(),
                    e.cacheHit(),
                    e.errorCode().map(Enum::name).orElse("-"),
                    e.latencyMs());
        }
        if (event instanceof FederationEvent.TokenExchanged e) {
            return String.format(
                    "TOKEN_EXCHANGE: audit=%s %s->%s success=%s error=%s",
                    e.auditId(), e.originInstance(), e.targetInstance(), e.success(), e.error().orElse("-"));
        }
        if (event instanceof FederationEvent.AuthorizationDecided e) {
            return String.format(
                    "AUTHZ_DECISION: request=%s resource=%s owner=%s allow=%s error=%s cacheHit=%s time=%dms",
                    e.requestId(),
                    e.resourceId(),
                    e.owningInstance(),
                    e.allow(),
                    e.errorCode().map(Enum::name).orElse("-"),
                    e.cacheHit(),
                    e.executionTimeMs());
        }
        if (event instanceof FederationEvent.TrustDenied e) {
            return String.format(
                    "TRUST_DENIED: %s->%s operation=%s", e.sourceInstance(), e.targetInstance(), e.operation());
        }
        return event.toString();
    }
}
