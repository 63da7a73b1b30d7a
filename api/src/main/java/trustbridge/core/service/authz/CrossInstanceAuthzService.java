package trustbridge.core.service.authz;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import trustbridge.core.cache.CaffeineLocalCache;
import trustbridge.core.cache.LocalCache;
import trustbridge.core.config.FederationConfig;
import trustbridge.core.model.authz.AttributeTranslation;
import trustbridge.core.model.authz.AuditEntry;
import trustbridge.core.model.authz.AuditOutcome;
import trustbridge.core.model.authz.AuthzAction;
import trustbridge.core.model.authz.CrossInstanceAuthzRequest;
import trustbridge.core.model.authz.CrossInstanceAuthzResult;
import trustbridge.core.model.authz.EvaluationDetails;
import trustbridge.core.model.authz.FederatedQueryResult;
import trustbridge.core.model.authz.FederatedResource;
import trustbridge.core.model.authz.FederatedResourceQuery;
import trustbridge.core.model.authz.PolicyDecision;
import trustbridge.core.model.authz.PolicyInput;
import trustbridge.core.model.authz.RemoteDecision;
import trustbridge.core.model.authz.RemotePolicyOutcome;
import trustbridge.core.model.authz.TrustSnapshot;
import trustbridge.core.model.federation.BilateralTrust;
import trustbridge.core.model.federation.Classification;
import trustbridge.core.model.federation.FederationErrorCode;
import trustbridge.core.model.federation.FederationException.CircuitOpenException;
import trustbridge.core.model.federation.FederationException.ClassificationExceedsTrustException;
import trustbridge.core.model.federation.FederationException.NoBilateralTrustException;
import trustbridge.core.model.federation.InstanceConfig;
import trustbridge.core.model.federation.IntrospectionRequest;
import trustbridge.core.port.out.FederatedResourceClient;
import trustbridge.core.port.out.FederationEventPublisher;
import trustbridge.core.port.out.LocalResourceCatalog;
import trustbridge.core.port.out.PolicyEngineClient;
import trustbridge.core.port.out.RemotePolicyClient;
import trustbridge.core.service.federation.TokenIntrospectionService;
import trustbridge.core.service.federation.TrustService;
import trustbridge.core.service.resilience.CircuitBreakerRegistry;
import trustbridge.core.util.SecureHash;
import trustbridge.spi.FederationEvent;

/**
 * Evaluates access to resources owned by any federation instance.
 *
 * <p>{@link #evaluate} runs:
 * <ol>
 *   <li>decision cache lookup</li>
 *   <li>trust gate for resources owned elsewhere (local instance to owner)</li>
 *   <li>local policy; a local deny ends the evaluation</li>
 *   <li>clearance translation with the owner's mapping table</li>
 *   <li>remote policy through the owner's circuit breaker, falling back to the local engine
 *       with translated attributes when the owner has no evaluation endpoint</li>
 *   <li>AND of both verdicts, obligations, caching</li>
 * </ol>
 *
 * <p>Every failure denies. Policy verdicts are cached; denials caused by unavailability are not,
 * so a recovered peer is seen on the next request.
 */
@ApplicationScoped
public class CrossInstanceAuthzService {

    private static final Logger LOG = Logger.getLogger(CrossInstanceAuthzService.class);

    static final String REMOTE_CIRCUIT_OPEN = "remote_circuit_open";
    static final String REMOTE_POLICY_ERROR = "remote_policy_error";
    static final String REMOTE_POLICY_RESULT = "remote_policy_result";

    private final TrustService trustService;
    private final TokenIntrospectionService introspectionService;
    private final PolicyEngineClient policyEngine;
    private final RemotePolicyClient remotePolicy;
    private final FederatedResourceClient resourceClient;
    private final LocalResourceCatalog localCatalog;
    private final CircuitBreakerRegistry breakers;
    private final FederationEventPublisher events;
    private final LocalCache<String, CrossInstanceAuthzResult> cache;
    private final ObligationPolicy obligationPolicy;
    private final String localInstance;
    private final Clock clock;

    @Inject
    public CrossInstanceAuthzService(
            TrustService trustService,
            TokenIntrospectionService introspectionService,
            PolicyEngineClient policyEngine,
            RemotePolicyClient remotePolicy,
            FederatedResourceClient resourceClient,
            LocalResourceCatalog localCatalog,
            CircuitBreakerRegistry breakers,
            FederationEventPublisher events,
            FederationConfig config,
            Clock clock) {
        this(
                trustService,
                introspectionService,
                policyEngine,
                remotePolicy,
                resourceClient,
                localCatalog,
                breakers,
                events,
                new CaffeineLocalCache<>(config.authz().decisionCacheTtl(), config.authz().maxCacheEntries()),
                config.authz().enhancedAuditThreshold(),
                config.localInstance(),
                clock);
    }

    public CrossInstanceAuthzService(
            TrustService trustService,
            TokenIntrospectionService introspectionService,
            PolicyEngineClient policyEngine,
            RemotePolicyClient remotePolicy,
            FederatedResourceClient resourceClient,
            LocalResourceCatalog localCatalog,
            CircuitBreakerRegistry breakers,
            FederationEventPublisher events,
            LocalCache<String, CrossInstanceAuthzResult> cache,
            Classification enhancedAuditThreshold,
            String localInstance,
            Clock clock) {
        this.trustService = trustService;
        this.introspectionService = introspectionService;
        this.policyEngine = policyEngine;
        this.remotePolicy = remotePolicy;
        this.resourceClient = resourceClient;
        this.localCatalog = localCatalog;
        this.breakers = breakers;
        this.events = events;
        this.cache = cache;
        this.obligationPolicy = new ObligationPolicy(enhancedAuditThreshold);
        this.localInstance = localInstance.toLowerCase(Locale.ROOT);
        this.clock = clock;
    }

    // ------------------------------------------------------------------ evaluate

    /**
     * Decide whether the subject may perform the action on the resource.
     *
     * <p>Never fails; every problem is a deny with an error code.
     */
    public Uni<CrossInstanceAuthzResult> evaluate(CrossInstanceAuthzRequest request) {
        final var evaluation = new Evaluation(request, clock.millis());

        final var cached = lookup(evaluation.cacheKey);
        if (cached.isPresent()) {
            LOG.debugv("Cross-instance authz cache hit for request {0}", request.requestId());
            return Uni.createFrom().item(decided(request, cached.get().asCacheHit(evaluation.elapsed())));
        }

        LOG.infov(
                "Cross-instance authorization started: request={0}, subjectCountry={1}, owner={2}, action={3}",
                request.requestId(),
                request.subject().countryOfAffiliation(),
                request.resource().instanceId(),
                request.action().wireName());

        if (evaluation.remote) {
            final var gate = gateRemoteOwner(evaluation);
            if (gate.isPresent()) {
                return Uni.createFrom().item(decided(request, gate.get()));
            }
        }

        evaluation.audit(localInstance, "local_policy_evaluation", AuditOutcome.ALLOW, "Starting local policy evaluation");
        final var input = PolicyInput.of(request, request.subject(), clock.instant());

        return policyEngine
                .evaluate(input)
                .onItem()
                .transformToUni(local -> afterLocalDecision(evaluation, local))
                .onFailure()
                .recoverWithItem(error -> localUnavailable(evaluation, error))
                .map(result -> decided(request, result));
    }

    private Optional<CrossInstanceAuthzResult> gateRemoteOwner(Evaluation evaluation) {
        final var owner = evaluation.ownerCode;
        final var trust = trustService.verifyTrust(localCode(), owner);
        if (trust.isPresent() && evaluation.owner.isPresent()) {
            evaluation.trust = trust;
            return Optional.empty();
        }
        final var reason = evaluation.owner.isEmpty()
                ? "Unknown or disabled instance: " + evaluation.request.resource().instanceId()
                : "No bilateral trust between " + localCode() + " and " + owner;
        LOG.warnv("Cross-instance access denied for request {0}: {1}", evaluation.request.requestId(), reason);
        events.publish(new FederationEvent.TrustDenied(clock.instant(), localCode(), owner, "authorization"));
        evaluation.audit(localInstance, "bilateral_trust_denied", AuditOutcome.DENY, reason);
        return Optional.of(CrossInstanceAuthzResult.denied(
                reason,
                FederationErrorCode.NO_BILATERAL_TRUST,
                EvaluationDetails.localOnly(PolicyDecision.denied("Bilateral trust check failed"), false),
                evaluation.elapsed(),
                evaluation.trail));
    }

    private Uni<CrossInstanceAuthzResult> afterLocalDecision(Evaluation evaluation, PolicyDecision local) {
        final var request = evaluation.request;
        evaluation.audit(
                localInstance,
                "local_policy_result",
                local.allow() ? AuditOutcome.ALLOW : AuditOutcome.DENY,
                local.reason());

        if (!local.allow()) {
            LOG.infov("Cross-instance access denied by local policy: request={0}, reason={1}", request.requestId(), local.reason());
            return Uni.createFrom().item(cacheable(evaluation, CrossInstanceAuthzResult.denied(
                    "Local policy denied: " + local.reason(),
                    FederationErrorCode.LOCAL_POLICY_DENIED,
                    EvaluationDetails.localOnly(local, evaluation.trustVerified()),
                    evaluation.elapsed(),
                    evaluation.trail)));
        }

        if (!evaluation.remote) {
            return Uni.createFrom().item(granted(evaluation, local, Optional.empty(), Optional.empty(), "Access granted by local policy"));
        }

        final var owner = evaluation.owner.get();
        final var translation = translate(evaluation, owner);
        final var subject = translation
                .map(t -> request.subject().withClearance(t.translatedClearance()))
                .orElse(request.subject());
        final var remoteInput = PolicyInput.of(request, subject, clock.instant());

        evaluation.audit(owner.instanceId(), "remote_policy_evaluation", AuditOutcome.ALLOW, "Starting remote policy evaluation");

        return breakers.forPeer(owner.instanceId())
                .guard(() -> remotePolicy.evaluate(owner, remoteInput, request.bearerToken().orElse(null)))
                .onItem()
                .transformToUni(outcome -> toRemoteDecision(owner, remoteInput, outcome))
                .map(remote -> afterRemoteDecision(evaluation, local, remote, translation))
                .onFailure(CircuitOpenException.class)
                .recoverWithItem(error -> remoteCircuitOpen(evaluation, local, translation, owner))
                .onFailure()
                .recoverWithItem(error -> remoteFailed(evaluation, local, translation, owner, error));
    }

    private Uni<RemoteDecision> toRemoteDecision(InstanceConfig owner, PolicyInput remoteInput, RemotePolicyOutcome outcome) {
        if (outcome instanceof RemotePolicyOutcome.Decision decision) {
            return Uni.createFrom().item(new RemoteDecision(
                    decision.allow(), decision.reason(), owner.instanceId(), RemoteDecision.Source.FEDERATION_ENDPOINT));
        }
        LOG.debugv("Federation endpoint not found at {0}, evaluating with local policy engine", owner.instanceId());
        return policyEngine
                .evaluate(remoteInput)
                .map(decision -> new RemoteDecision(
                        decision.allow(), decision.reason(), owner.instanceId(), RemoteDecision.Source.LOCAL_FALLBACK));
    }

    private Optional<AttributeTranslation> translate(Evaluation evaluation, InstanceConfig owner) {
        if (owner.clearanceMapping().isEmpty()) {
            return Optional.empty();
        }
        final var original = evaluation.request.subject().clearance();
        final var translated = ClearanceTranslator.translate(original, owner.clearanceMapping());
        evaluation.audit(
                owner.instanceId(), "attribute_translation", AuditOutcome.ALLOW, "Clearance " + original + " -> " + translated);
        return Optional.of(new AttributeTranslation(original, translated, owner.instanceId()));
    }

    private CrossInstanceAuthzResult afterRemoteDecision(
            Evaluation evaluation, PolicyDecision local, RemoteDecision remote, Optional<AttributeTranslation> translation) {
        evaluation.audit(
                remote.instanceId(),
                REMOTE_POLICY_RESULT,
                remote.allow() ? AuditOutcome.ALLOW : AuditOutcome.DENY,
                remote.reason());

        if (!remote.allow()) {
            LOG.infov(
                    "Cross-instance access denied by remote policy: request={0}, owner={1}, reason={2}",
                    evaluation.request.requestId(),
                    remote.instanceId(),
                    remote.reason());
            return cacheable(evaluation, CrossInstanceAuthzResult.denied(
                    "Remote policy denied: " + remote.reason(),
                    FederationErrorCode.REMOTE_POLICY_DENIED,
                    new EvaluationDetails(local, Optional.of(remote), translation, Optional.empty(), true, false),
                    evaluation.elapsed(),
                    evaluation.trail));
        }
        return granted(evaluation, local, Optional.of(remote), translation, "Access granted by local and remote policies");
    }

    private CrossInstanceAuthzResult granted(
            Evaluation evaluation,
            PolicyDecision local,
            Optional<RemoteDecision> remote,
            Optional<AttributeTranslation> translation,
            String reason) {
        final var request = evaluation.request;
        final var ownerCountry = evaluation.owner
                .or(() -> trustService.resolve(request.resource().instanceId()))
                .map(InstanceConfig::country);
        LOG.infov(
                "Cross-instance access granted: request={0}, owner={1}",
                request.requestId(),
                request.resource().instanceId());
        return cacheable(evaluation, CrossInstanceAuthzResult.granted(
                reason,
                new EvaluationDetails(local, remote, translation, Optional.empty(), evaluation.trustVerified(), false),
                obligationPolicy.obligationsFor(request, ownerCountry),
                evaluation.elapsed(),
                evaluation.trail));
    }

    private CrossInstanceAuthzResult remoteCircuitOpen(
            Evaluation evaluation, PolicyDecision local, Optional<AttributeTranslation> translation, InstanceConfig owner) {
        LOG.warnv("Remote policy for request {0} skipped: circuit open for {1}", evaluation.request.requestId(), owner.instanceId());
        evaluation.audit(
                owner.instanceId(), REMOTE_CIRCUIT_OPEN, AuditOutcome.ERROR, "Circuit open; remote instance considered unavailable");
        return CrossInstanceAuthzResult.denied(
                "Remote instance " + owner.instanceCode() + " unavailable (circuit open, fail-closed)",
                FederationErrorCode.REMOTE_EVALUATION_UNAVAILABLE,
                new EvaluationDetails(local, Optional.empty(), translation, Optional.empty(), true, false),
                evaluation.elapsed(),
                evaluation.trail);
    }

    private CrossInstanceAuthzResult remoteFailed(
            Evaluation evaluation,
            PolicyDecision local,
            Optional<AttributeTranslation> translation,
            InstanceConfig owner,
            Throwable error) {
        LOG.errorv("Remote policy evaluation failed: request={0}, owner={1}, error={2}",
                evaluation.request.requestId(), owner.instanceId(), error.getMessage());
        evaluation.audit(owner.instanceId(), REMOTE_POLICY_ERROR, AuditOutcome.ERROR, String.valueOf(error.getMessage()));
        return CrossInstanceAuthzResult.denied(
                "Remote policy evaluation failed (fail-closed)",
                FederationErrorCode.REMOTE_EVALUATION_UNAVAILABLE,
                new EvaluationDetails(local, Optional.empty(), translation, Optional.empty(), true, false),
                evaluation.elapsed(),
                evaluation.trail);
    }

    private CrossInstanceAuthzResult localUnavailable(Evaluation evaluation, Throwable error) {
        LOG.errorv("Local policy evaluation failed for request {0}: {1}", evaluation.request.requestId(), error.getMessage());
        evaluation.audit(localInstance, "local_policy_error", AuditOutcome.ERROR, String.valueOf(error.getMessage()));
        return CrossInstanceAuthzResult.denied(
                "Local policy evaluation unavailable (fail-closed)",
                FederationErrorCode.LOCAL_EVALUATION_UNAVAILABLE,
                EvaluationDetails.localOnly(
                        PolicyDecision.denied("Policy evaluation unavailable (fail-closed)"), evaluation.trustVerified()),
                evaluation.elapsed(),
                evaluation.trail);
    }

    // ------------------------------------------------------------------ bilateral variant

    /**
     * Like {@link #evaluate}, after checking trust from the subject's origin to the owner, the
     * trust edge's classification ceiling and, when a bearer token is present, the token.
     *
     * <p>Trust and ceiling failures deny without any outbound call.
     */
    public Uni<CrossInstanceAuthzResult> evaluateWithBilateralTrust(CrossInstanceAuthzRequest request) {
        final var started = clock.millis();
        final var trail = new ArrayList<AuditEntry>();
        final var source = trustService.codeOf(Optional.ofNullable(request.subject().originInstance())
                .filter(s -> !s.isBlank())
                .orElse(localInstance));
        final var target = trustService.codeOf(request.resource().instanceId());

        trail.add(entry(source, "bilateral_trust_check", AuditOutcome.ALLOW, "Checking trust from " + source + " to " + target));

        final var trust = trustService.verifyTrust(source, target);
        if (trust.isEmpty()) {
            final var reason = "No bilateral trust between " + source + " and " + target;
            LOG.warnv("Cross-instance access denied for request {0}: {1}", request.requestId(), reason);
            events.publish(new FederationEvent.TrustDenied(clock.instant(), source, target, "authorization"));
            trail.add(entry(source, "bilateral_trust_denied", AuditOutcome.DENY, reason));
            return Uni.createFrom().item(decided(request, CrossInstanceAuthzResult.denied(
                    reason,
                    FederationErrorCode.NO_BILATERAL_TRUST,
                    EvaluationDetails.localOnly(PolicyDecision.denied("Bilateral trust check failed"), false),
                    clock.millis() - started,
                    trail)));
        }

        final var edge = trust.get();
        final var label = request.resource().classification();
        try {
            TrustService.requireWithinCeiling(edge, label);
        } catch (ClassificationExceedsTrustException e) {
            final var reason = e.getMessage();
            LOG.warnv("Cross-instance access denied for request {0}: {1}", request.requestId(), reason);
            trail.add(entry(
                    target,
                    "classification_check_failed",
                    AuditOutcome.DENY,
                    "Resource " + label + " exceeds max " + edge.maxClassification()));
            return Uni.createFrom().item(decided(request, CrossInstanceAuthzResult.denied(
                    reason,
                    FederationErrorCode.CLASSIFICATION_EXCEEDS_TRUST,
                    new EvaluationDetails(
                            PolicyDecision.denied("Classification exceeds trust level"),
                            Optional.empty(),
                            Optional.empty(),
                            Optional.of(TrustSnapshot.of(edge)),
                            true,
                            false),
                    clock.millis() - started,
                    trail)));
        }

        trail.add(entry(
                source,
                "bilateral_trust_verified",
                AuditOutcome.ALLOW,
                "Trust level: " + edge.trustLevel().wireName() + ", max classification: " + edge.maxClassification()));

        if (request.bearerToken().isEmpty()) {
            return evaluateTrusted(request, edge, trail, started);
        }

        final var introspection = new IntrospectionRequest(request.bearerToken().get(), source, target, request.requestId());
        return introspectionService.introspect(introspection).flatMap(validation -> {
            trail.add(entry(
                    source,
                    "token_validation",
                    validation.active() ? AuditOutcome.ALLOW : AuditOutcome.DENY,
                    validation.error().orElse("Token validated successfully")));
            if (!validation.active()) {
                final var error = validation.error().orElse("Token is not active");
                return Uni.createFrom().item(decided(request, CrossInstanceAuthzResult.denied(
                        "Token validation failed: " + error,
                        FederationErrorCode.TOKEN_INVALID,
                        new EvaluationDetails(
                                PolicyDecision.denied("Token validation failed"),
                                Optional.empty(),
                                Optional.empty(),
                                Optional.of(TrustSnapshot.of(edge)),
                                true,
                                false),
                        clock.millis() - started,
                        trail)));
            }
            return evaluateTrusted(request, edge, trail, started);
        });
    }

    private Uni<CrossInstanceAuthzResult> evaluateTrusted(
            CrossInstanceAuthzRequest request, BilateralTrust edge, List<AuditEntry> trail, long started) {
        return evaluate(request)
                .map(result -> result.withBilateralTrust(TrustSnapshot.of(edge), trail, clock.millis() - started));
    }

    // ------------------------------------------------------------------ federated query

    /**
     * Query resources across instances in parallel and evaluate read access for each one.
     *
     * <p>Instances that cannot be queried are listed in {@code queryStats.failedQueries}; the
     * query itself never fails.
     */
    public Uni<FederatedQueryResult> queryFederatedResources(FederatedResourceQuery query) {
        final var started = clock.millis();
        final var targets = query.targetInstances().isEmpty()
                ? trustService.registeredInstances().stream().map(InstanceConfig::instanceId).toList()
                : query.targetInstances();

        LOG.infov("Federated resource query {0} started across {1}", query.requestId(), targets);

        if (targets.isEmpty()) {
            return Uni.createFrom().item(new FederatedQueryResult(
                    0, List.of(), new FederatedQueryResult.QueryStats(0, 0, List.of(), clock.millis() - started)));
        }

        final var perInstance = targets.stream().map(target -> queryInstance(target, query)).toList();
        return Uni.join()
                .all(perInstance)
                .andFailFast()
                .flatMap(outcomes -> {
                    final var failures = new ArrayList<String>();
                    final var resources = new ArrayList<FederatedResource>();
                    int successful = 0;
                    for (var outcome : outcomes) {
                        if (outcome.failure().isPresent()) {
                            failures.add(outcome.instanceId() + ": " + outcome.failure().get());
                        } else {
                            successful++;
                            resources.addAll(outcome.resources());
                        }
                    }
                    final var stats = new Stats(targets.size(), successful, failures);
                    return evaluateAll(query, resources).map(accesses -> {
                        final var result = new FederatedQueryResult(
                                accesses.size(),
                                accesses,
                                new FederatedQueryResult.QueryStats(
                                        stats.queried(), stats.successful(), stats.failures(), clock.millis() - started));
                        LOG.infov(
                                "Federated resource query {0} completed: resources={1}, accessible={2}, failedInstances={3}",
                                query.requestId(),
                                result.totalResources(),
                                result.accessibleCount(),
                                stats.failures().size());
                        return result;
                    });
                });
    }

    private Uni<InstanceQueryOutcome> queryInstance(String target, FederatedResourceQuery query) {
        if (isLocal(target)) {
            return localCatalog
                    .search(query)
                    .map(resources -> InstanceQueryOutcome.success(target, resources))
                    .onFailure()
                    .recoverWithItem(error -> InstanceQueryOutcome.failed(target, error.getMessage()));
        }
        final var instance = trustService.resolve(target);
        if (instance.isEmpty()) {
            return Uni.createFrom().item(InstanceQueryOutcome.failed(target, "Instance not found"));
        }
        try {
            trustService.requireTrust(localCode(), instance.get().instanceCode());
        } catch (NoBilateralTrustException e) {
            return Uni.createFrom().item(InstanceQueryOutcome.failed(target, e.getMessage()));
        }
        return breakers.forPeer(instance.get().instanceId())
                .guard(() -> resourceClient.query(instance.get(), query))
                .map(resources -> InstanceQueryOutcome.success(target, resources))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Failed to query instance {0}: {1}", target, error.getMessage());
                    return InstanceQueryOutcome.failed(target, error.getMessage());
                });
    }

    private Uni<List<FederatedQueryResult.ResourceAccess>> evaluateAll(
            FederatedResourceQuery query, List<FederatedResource> resources) {
        if (resources.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        final var evaluations = resources.stream()
                .map(resource -> evaluate(new CrossInstanceAuthzRequest(
                                query.subject(), resource, AuthzAction.READ, query.requestId(), query.bearerToken()))
                        .map(result -> new FederatedQueryResult.ResourceAccess(resource, result.allow(), result.reason())))
                .toList();
        return Uni.join().all(evaluations).andFailFast();
    }

    private record InstanceQueryOutcome(String instanceId, List<FederatedResource> resources, Optional<String> failure) {

        static InstanceQueryOutcome success(String instanceId, List<FederatedResource> resources) {
            return new InstanceQueryOutcome(instanceId, resources, Optional.empty());
        }

        static InstanceQueryOutcome failed(String instanceId, String reason) {
            return new InstanceQueryOutcome(instanceId, List.of(), Optional.of(String.valueOf(reason)));
        }
    }

    private record Stats(int queried, int successful, List<String> failures) {}

    // ------------------------------------------------------------------ administration

    public void clearCache() {
        cache.invalidateAll();
        LOG.info("Cross-instance authorization cache cleared");
    }

    public long cacheSize() {
        return cache.estimatedSize();
    }

    /**
     * Outgoing trust edges of the local instance.
     */
    public List<BilateralTrust> bilateralTrusts() {
        return trustService.listTrustsFor(localCode());
    }

    public boolean hasBilateralTrust(String source, String target) {
        return trustService.hasTrust(source, target);
    }

    // ------------------------------------------------------------------ helpers

    private CrossInstanceAuthzResult cacheable(Evaluation evaluation, CrossInstanceAuthzResult result) {
        try {
            cache.put(evaluation.cacheKey, result);
        } catch (RuntimeException e) {
            LOG.warnv("Authorization cache write failed, result not cached: {0}", e.getMessage());
        }
        return result;
    }

    private Optional<CrossInstanceAuthzResult> lookup(String key) {
        try {
            return cache.get(key);
        } catch (RuntimeException e) {
            LOG.warnv("Authorization cache read failed, evaluating uncached: {0}", e.getMessage());
            return Optional.empty();
        }
    }

    private CrossInstanceAuthzResult decided(CrossInstanceAuthzRequest request, CrossInstanceAuthzResult result) {
        events.publish(new FederationEvent.AuthorizationDecided(
                clock.instant(),
                request.requestId(),
                request.resource().resourceId(),
                request.resource().instanceId(),
                result.allow(),
                result.errorCode(),
                result.evaluationDetails().cacheHit(),
                result.executionTimeMs()));
        return result;
    }

    private AuditEntry entry(String instanceId, String action, AuditOutcome outcome, String details) {
        return new AuditEntry(clock.instant(), instanceId, action, outcome, details);
    }

    private boolean isLocal(String instanceId) {
        if (instanceId.equalsIgnoreCase(localInstance) || "local".equalsIgnoreCase(instanceId)) {
            return true;
        }
        return localCode().equalsIgnoreCase(instanceId);
    }

    private String localCode() {
        return trustService
                .resolve(localInstance)
                .map(InstanceConfig::instanceCode)
                .orElse(localInstance.toUpperCase(Locale.ROOT));
    }

    static String cacheKey(CrossInstanceAuthzRequest request) {
        return cacheKey(request, request.resource().instanceId());
    }

    static String cacheKey(CrossInstanceAuthzRequest request, String ownerCode) {
        final var subject = request.subject();
        return SecureHash.fingerprint(
                subject.uniqueId(),
                subject.clearance(),
                subject.countryOfAffiliation(),
                request.resource().resourceId(),
                ownerCode.toUpperCase(Locale.ROOT),
                request.action().wireName());
    }

    /**
     * Per-call evaluation state. Only touched by the single chain evaluating one request.
     */
    private final class Evaluation {
        final CrossInstanceAuthzRequest request;
        final long started;
        final String cacheKey;
        final String ownerCode;
        final boolean remote;
        final Optional<InstanceConfig> owner;
        final List<AuditEntry> trail = new ArrayList<>();
        Optional<BilateralTrust> trust = Optional.empty();

        Evaluation(CrossInstanceAuthzRequest request, long started) {
            this.request = request;
            this.started = started;
            this.ownerCode = trustService.codeOf(request.resource().instanceId());
            this.cacheKey = CrossInstanceAuthzService.cacheKey(request, ownerCode);
            this.remote = !isLocal(request.resource().instanceId());
            this.owner = remote ? trustService.resolve(request.resource().instanceId()) : Optional.empty();
        }

        void audit(String instanceId, String action, AuditOutcome outcome, String details) {
            trail.add(entry(instanceId, action, outcome, details));
        }

        boolean trustVerified() {
            return !remote || trust.isPresent();
        }

        long elapsed() {
            return clock.millis() - started;
        }
    }
}
