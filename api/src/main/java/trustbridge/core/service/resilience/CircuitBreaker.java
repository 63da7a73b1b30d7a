package trustbridge.core.service.resilience;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import trustbridge.core.model.federation.FederationException.CircuitOpenException;
import trustbridge.core.model.resilience.CircuitBreakerSettings;
import trustbridge.core.model.resilience.CircuitBreakerState;
import trustbridge.core.model.resilience.CircuitState;
import trustbridge.core.model.resilience.FailoverMetrics;
import trustbridge.core.model.resilience.FailoverMode;
import trustbridge.core.model.resilience.FailoverState;
import trustbridge.core.model.resilience.ProbeResult;
import trustbridge.core.port.out.FederationEventPublisher;
import trustbridge.spi.FederationEvent;

/**
 * Circuit breaker and failover state for a single peer.
 *
 * <p>State machine:
 * <ul>
 *   <li>{@code CLOSED}: every call is admitted; {@code failureThreshold} failures inside the
 *       sliding {@code failureWindow} open the circuit</li>
 *   <li>{@code OPEN}: no call is admitted; after {@code recoveryTimeout} the monitor moves
 *       the circuit to half-open without any call being made</li>
 *   <li>{@code HALF_OPEN}: each call is admitted with probability
 *       {@code halfOpenRequestPercentage / 100}; {@code successThreshold} successes close the
 *       circuit, any failure reopens it, and {@code halfOpenTimeout} without a verdict reopens it</li>
 * </ul>
 *
 * <p>Maintenance mode blocks every call regardless of circuit state and is left only through
 * {@link #exitMaintenance()}.
 *
 * <p>Thread-safety: all state is guarded by this instance's monitor. {@link #guard(Supplier)}
 * releases the monitor before the guarded call is subscribed.
 */
public class CircuitBreaker {

    private static final Logger LOG = Logger.getLogger(CircuitBreaker.class);

    private final String peerId;
    private final CircuitBreakerSettings settings;
    private final Clock clock;
    private final DoubleSupplier random;
    private final FederationEventPublisher events;

    private CircuitState state;
    private int failures;
    private int successes;
    private final Deque<Instant> failureHistory = new ArrayDeque<>();
    private Instant lastFailure;
    private Instant lastSuccess;
    private Instant lastStateChange;
    private Instant openedAt;
    private Instant halfOpenAt;

    private FailoverMode mode;
    private Instant offlineSince;
    private Instant lastContact;
    private Instant policyCacheExpiry;
    private String maintenanceReason;
    private Instant maintenanceStartedAt;
    private int recoveryAttempts;
    private Instant lastRecoveryAttempt;

    private Instant trackingSince;
    private long totalFailures;
    private long totalSuccesses;
    private long totalRecoveries;
    private long totalCircuitOpens;
    private long totalHalfOpenProbes;
    private double averageRecoveryTimeMs;
    private long longestOutageMs;
    private long accumulatedOutageMs;

    /**
     * @param random uniform source in {@code [0, 1)} used for half-open admission
     */
    public CircuitBreaker(
            String peerId,
            CircuitBreakerSettings settings,
            Clock clock,
            DoubleSupplier random,
            FederationEventPublisher events) {
        this.peerId = peerId;
        this.settings = settings;
        this.clock = clock;
        this.random = random;
        this.events = events;
        initialize();
    }

    private void initialize() {
        final var now = clock.instant();
        state = CircuitState.CLOSED;
        failures = 0;
        successes = 0;
        failureHistory.clear();
        lastFailure = null;
        lastSuccess = null;
        lastStateChange = now;
        openedAt = null;
        halfOpenAt = null;
        mode = FailoverMode.NORMAL;
        offlineSince = null;
        lastContact = null;
        policyCacheExpiry = now.plus(settings.maxOfflineTime());
        maintenanceReason = null;
        maintenanceStartedAt = null;
        recoveryAttempts = 0;
        lastRecoveryAttempt = null;
        trackingSince = now;
        totalFailures = 0;
        totalSuccesses = 0;
        totalRecoveries = 0;
        totalCircuitOpens = 0;
        totalHalfOpenProbes = 0;
        averageRecoveryTimeMs = 0;
        longestOutageMs = 0;
        accumulatedOutageMs = 0;
    }

    public String peerId() {
        return peerId;
    }

    // ---------------------------------------------------------------- admission

    /**
     * Whether a call to the peer should be attempted now.
     *
     * <p>Pure local decision; no I/O. While half-open every call draws independently.
     *
     * @return true if the call may proceed
     */
    public synchronized boolean shouldAllowRequest() {
        if (mode == FailoverMode.MAINTENANCE) {
            return false;
        }
        return switch (state) {
            case CLOSED -> true;
            case OPEN -> false;
            case HALF_OPEN -> {
                final var admitted = random.getAsDouble() * 100.0 < settings.halfOpenRequestPercentage();
                if (admitted) {
                    totalHalfOpenProbes++;
                }
                yield admitted;
            }
        };
    }

    /**
     * Run {@code call} under this breaker.
     *
     * <p>Fails fast with {@link CircuitOpenException} when the call is not admitted. Otherwise the
     * outcome is recorded: an item is a success, a failure is a failure. No retries.
     *
     * @param call the outbound call, created only when admitted
     * @return the call's result
     */
    public <T> Uni<T> guard(Supplier<Uni<T>> call) {
        return Uni.createFrom().deferred(() -> {
            if (!shouldAllowRequest()) {
                LOG.debugv("Circuit for {0} refused call in state {1}", peerId, currentState());
                return Uni.createFrom().failure(new CircuitOpenException(peerId));
            }
            return Uni.createFrom()
                    .deferred(call::get)
                    .onItem()
                    .invoke(ignored -> recordSuccess())
                    .onFailure()
                    .invoke(error -> recordFailure(error.getMessage()));
        });
    }

    /**
     * Run an explicit health probe and record its outcome.
     *
     * <p>Probes bypass admission so operators can test a peer while the circuit is open.
     *
     * @param probe emits true when the peer is healthy
     * @return the probe outcome; never a failure
     */
    public Uni<ProbeResult> executeProbe(Supplier<Uni<Boolean>> probe) {
        final var started = clock.millis();
        return Uni.createFrom()
                .deferred(probe::get)
                .map(healthy -> {
                    final var latency = clock.millis() - started;
                    if (Boolean.TRUE.equals(healthy)) {
                        recordSuccess();
                        return new ProbeResult(true, latency, Optional.empty(), clock.instant());
                    }
                    recordFailure("Probe reported unhealthy");
                    return new ProbeResult(false, latency, Optional.of("Probe reported unhealthy"), clock.instant());
                })
                .onFailure()
                .recoverWithItem(error -> {
                    recordFailure(error.getMessage());
                    return new ProbeResult(
                            false, clock.millis() - started, Optional.ofNullable(error.getMessage()), clock.instant());
                });
    }

    // ---------------------------------------------------------------- outcomes

    public synchronized void recordSuccess() {
        final var now = clock.instant();
        lastSuccess = now;
        lastContact = now;
        successes++;
        totalSuccesses++;
        policyCacheExpiry = now.plus(settings.maxOfflineTime());

        if (state == CircuitState.HALF_OPEN && successes >= settings.successThreshold()) {
            close("Recovered after " + successes + " successful probes");
        } else if (state == CircuitState.OPEN) {
            LOG.warnv("Success recorded for {0} while circuit is open", peerId);
        }
        refreshMode();
    }

    public synchronized void recordFailure(String error) {
        final var now = clock.instant();
        lastFailure = now;
        failures++;
        totalFailures++;
        failureHistory.addLast(now);
        pruneFailureHistory(now);

        LOG.debugv("Recorded failure for {0} in state {1}: {2}", peerId, state, error);

        if (state == CircuitState.CLOSED && failureHistory.size() >= settings.failureThreshold()) {
            open(failureHistory.size() + " failures within " + settings.failureWindow());
        } else if (state == CircuitState.HALF_OPEN) {
            open("Failure while half-open: " + error);
        }
        refreshMode();
    }

    private void pruneFailureHistory(Instant now) {
        final var cutoff = now.minus(settings.failureWindow());
        while (!failureHistory.isEmpty() && failureHistory.peekFirst().isBefore(cutoff)) {
            failureHistory.removeFirst();
        }
    }

    // ---------------------------------------------------------------- timers

    /**
     * Apply time-based transitions: open to half-open after the recovery timeout, and
     * half-open back to open after the half-open timeout. Called periodically by the monitor.
     */
    public synchronized void evaluateTimers() {
        final var now = clock.instant();
        if (state == CircuitState.OPEN && openedAt != null && elapsed(openedAt, now, settings.recoveryTimeout())) {
            halfOpen();
        } else if (state == CircuitState.HALF_OPEN
                && halfOpenAt != null
                && elapsed(halfOpenAt, now, settings.halfOpenTimeout())) {
            open("No verdict within half-open timeout " + settings.halfOpenTimeout());
        }
        pruneFailureHistory(now);
        refreshMode();
    }

    private static boolean elapsed(Instant since, Instant now, Duration timeout) {
        return !now.isBefore(since.plus(timeout));
    }

    // ---------------------------------------------------------------- transitions

    private void open(String reason) {
        final var previous = state;
        final var now = clock.instant();
        state = CircuitState.OPEN;
        openedAt = now;
        halfOpenAt = null;
        lastStateChange = now;
        successes = 0;
        totalCircuitOpens++;
        if (offlineSince == null) {
            offlineSince = now;
        }
        LOG.warnv("Circuit breaker OPENED for {0} (was {1}): {2}", peerId, previous, reason);
        events.publish(new FederationEvent.CircuitStateChanged(now, peerId, previous, CircuitState.OPEN, reason));
    }

    private void halfOpen() {
        final var now = clock.instant();
        state = CircuitState.HALF_OPEN;
        halfOpenAt = now;
        lastStateChange = now;
        successes = 0;
        failures = 0;
        recoveryAttempts++;
        lastRecoveryAttempt = now;
        LOG.infov("Circuit breaker HALF-OPEN for {0}, recovery attempt {1}", peerId, recoveryAttempts);
        events.publish(new FederationEvent.CircuitStateChanged(
                now, peerId, CircuitState.OPEN, CircuitState.HALF_OPEN, "Recovery timeout elapsed"));
    }

    private void close(String reason) {
        final var previous = state;
        final var now = clock.instant();
        final long outageMs = offlineSince == null ? 0 : Duration.between(offlineSince, now).toMillis();

        state = CircuitState.CLOSED;
        lastStateChange = now;
        failures = 0;
        successes = 0;
        failureHistory.clear();
        openedAt = null;
        halfOpenAt = null;

        if (outageMs > 0) {
            totalRecoveries++;
            longestOutageMs = Math.max(longestOutageMs, outageMs);
            averageRecoveryTimeMs = (averageRecoveryTimeMs * (totalRecoveries - 1) + outageMs) / totalRecoveries;
            accumulatedOutageMs += outageMs;
        }
        offlineSince = null;

        if (previous != CircuitState.CLOSED) {
            LOG.infov("Circuit breaker CLOSED for {0} after {1}ms outage", peerId, outageMs);
            events.publish(
                    new FederationEvent.CircuitStateChanged(now, peerId, previous, CircuitState.CLOSED, reason));
        }
    }

    /**
     * Open the circuit regardless of recent outcomes. Does nothing when it is already open.
     */
    public synchronized void forceOpen(String reason) {
        if (state == CircuitState.OPEN) {
            LOG.debugv("Circuit for {0} already open, ignoring forced open: {1}", peerId, reason);
            return;
        }
        LOG.infov("Force opening circuit for {0}: {1}", peerId, reason);
        open("Forced: " + reason);
        refreshMode();
    }

    /**
     * Close the circuit and clear failure history regardless of recent outcomes.
     */
    public synchronized void forceClose() {
        LOG.infov("Force closing circuit for {0} (was {1})", peerId, state);
        close("Forced close");
        refreshMode();
    }

    // ---------------------------------------------------------------- maintenance

    public synchronized void enterMaintenance(String reason) {
        if (mode == FailoverMode.MAINTENANCE) {
            return;
        }
        maintenanceReason = reason;
        maintenanceStartedAt = clock.instant();
        LOG.infov("Entering maintenance for {0}: {1}", peerId, reason);
        transitionMode(FailoverMode.MAINTENANCE);
    }

    public synchronized void exitMaintenance() {
        if (mode != FailoverMode.MAINTENANCE) {
            return;
        }
        LOG.infov("Exiting maintenance for {0} after {1}", peerId,
                Duration.between(maintenanceStartedAt, clock.instant()));
        maintenanceReason = null;
        maintenanceStartedAt = null;
        transitionMode(derivedMode());
    }

    public synchronized boolean isInMaintenance() {
        return mode == FailoverMode.MAINTENANCE;
    }

    // ---------------------------------------------------------------- mode

    private void refreshMode() {
        if (mode == FailoverMode.MAINTENANCE) {
            return;
        }
        transitionMode(derivedMode());
    }

    private FailoverMode derivedMode() {
        if (state == CircuitState.CLOSED) {
            return FailoverMode.NORMAL;
        }
        return isPolicyCacheValidAt(clock.instant()) ? FailoverMode.DEGRADED : FailoverMode.OFFLINE;
    }

    private void transitionMode(FailoverMode next) {
        if (next == mode) {
            return;
        }
        final var previous = mode;
        mode = next;
        LOG.infov("Failover mode for {0}: {1} -> {2}", peerId, previous, next);
        events.publish(new FederationEvent.FailoverModeChanged(clock.instant(), peerId, previous, next));
    }

    // ---------------------------------------------------------------- policy cache

    /**
     * Whether policy data cached from this peer is still usable.
     */
    public synchronized boolean isPolicyCacheValid() {
        return isPolicyCacheValidAt(clock.instant());
    }

    private boolean isPolicyCacheValidAt(Instant now) {
        return now.isBefore(policyCacheExpiry);
    }

    public synchronized void updatePolicyCacheExpiry(Instant expiry) {
        policyCacheExpiry = expiry;
        refreshMode();
    }

    // ---------------------------------------------------------------- inspection

    public synchronized CircuitState currentState() {
        return state;
    }

    public synchronized FailoverMode mode() {
        return mode;
    }

    public synchronized FailoverState state() {
        final var breaker = new CircuitBreakerState(
                state,
                failures,
                successes,
                List.copyOf(failureHistory),
                Optional.ofNullable(lastFailure),
                Optional.ofNullable(lastSuccess),
                lastStateChange,
                Optional.ofNullable(openedAt),
                Optional.ofNullable(halfOpenAt));
        return new FailoverState(
                peerId,
                mode,
                breaker,
                Optional.ofNullable(offlineSince),
                Optional.ofNullable(lastContact),
                isPolicyCacheValidAt(clock.instant()),
                policyCacheExpiry,
                Optional.ofNullable(maintenanceReason),
                Optional.ofNullable(maintenanceStartedAt),
                recoveryAttempts,
                Optional.ofNullable(lastRecoveryAttempt));
    }

    /**
     * Outage metrics. Uptime is the share of tracked time not spent between the first
     * open and the following close.
     */
    public synchronized FailoverMetrics metrics() {
        final var now = clock.instant();
        final long currentOutageMs = offlineSince == null ? 0 : Duration.between(offlineSince, now).toMillis();
        final long trackedMs = Duration.between(trackingSince, now).toMillis();
        double uptime = 100.0;
        if (trackedMs > 0) {
            final var downMs = accumulatedOutageMs + currentOutageMs;
            uptime = Math.max(0.0, (double) (trackedMs - downMs) / trackedMs * 100.0);
        }
        return new FailoverMetrics(
                totalFailures,
                totalSuccesses,
                totalRecoveries,
                totalCircuitOpens,
                totalHalfOpenProbes,
                averageRecoveryTimeMs,
                longestOutageMs,
                currentOutageMs,
                uptime);
    }

    /**
     * Return to the initial closed state and discard all counters and metrics.
     */
    public synchronized void reset() {
        final var previousState = state;
        final var previousMode = mode;
        initialize();
        LOG.infov("Circuit breaker for {0} reset", peerId);
        final var now = clock.instant();
        if (previousState != CircuitState.CLOSED) {
            events.publish(new FederationEvent.CircuitStateChanged(
                    now, peerId, previousState, CircuitState.CLOSED, "Reset"));
        }
        if (previousMode != FailoverMode.NORMAL) {
            events.publish(new FederationEvent.FailoverModeChanged(now, peerId, previousMode, FailoverMode.NORMAL));
        }
    }
}
