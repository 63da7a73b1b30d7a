package trustbridge.core.service.federation;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import trustbridge.core.model.federation.BilateralTrust;
import trustbridge.core.model.federation.Classification;
import trustbridge.core.model.federation.FederationException.ClassificationExceedsTrustException;
import trustbridge.core.model.federation.FederationException.NoBilateralTrustException;
import trustbridge.core.model.federation.InstanceConfig;
import trustbridge.core.port.out.InstanceRegistry;
import trustbridge.core.port.out.TrustStore;

/**
 * Answers trust questions over the instance registry and trust matrix.
 *
 * <p>Absence of trust is a normal outcome and is returned as an empty {@link Optional}.
 */
@ApplicationScoped
public class TrustService {

    private static final Logger LOG = Logger.getLogger(TrustService.class);

    private final TrustStore trustStore;
    private final InstanceRegistry registry;
    private final Clock clock;

    @Inject
    public TrustService(TrustStore trustStore, InstanceRegistry registry, Clock clock) {
        this.trustStore = trustStore;
        this.registry = registry;
        this.clock = clock;
    }

    /**
     * The effective edge from {@code source} to {@code target}.
     *
     * @return the edge, or empty when it is missing, disabled or expired
     */
    public Optional<BilateralTrust> verifyTrust(String source, String target) {
        if (isBlank(source) || isBlank(target)) {
            return Optional.empty();
        }
        final var now = clock.instant();
        final var edge = trustStore.find(codeOf(source), codeOf(target));
        if (edge.isPresent() && !edge.get().isEffective(now)) {
            LOG.debugv(
                    "Trust {0} -> {1} present but not effective (enabled={2}, expired={3})",
                    source,
                    target,
                    edge.get().enabled(),
                    edge.get().isExpired(now));
            return Optional.empty();
        }
        return edge;
    }

    public boolean hasTrust(String source, String target) {
        return verifyTrust(source, target).isPresent();
    }

    /**
     * Like {@link #verifyTrust(String, String)} for callers that treat absence as a failure.
     *
     * @throws NoBilateralTrustException when no effective edge exists
     */
    public BilateralTrust requireTrust(String source, String target) {
        return verifyTrust(source, target).orElseThrow(() -> new NoBilateralTrustException(source, target));
    }

    /**
     * Check a resource's classification label against the edge's ceiling.
     *
     * <p>A label outside the classification hierarchy never passes.
     *
     * @throws ClassificationExceedsTrustException when the label is unknown or above the ceiling
     */
    public static Classification requireWithinCeiling(BilateralTrust trust, String label) {
        final var classification = Classification.parse(label);
        if (classification.isEmpty() || classification.get().exceeds(trust.maxClassification())) {
            throw new ClassificationExceedsTrustException(label, trust.maxClassification());
        }
        return classification.get();
    }

    /**
     * Every configured outgoing edge of {@code instance}, including disabled and expired ones.
     */
    public List<BilateralTrust> listTrustsFor(String instance) {
        if (isBlank(instance)) {
            return List.of();
        }
        return trustStore.findBySource(codeOf(instance));
    }

    /**
     * The instance code edges are keyed by.
     *
     * <p>Registered instances are looked up by id or code; anything else is taken as a code.
     */
    public String codeOf(String idOrCode) {
        return registry.find(idOrCode)
                .map(InstanceConfig::instanceCode)
                .orElse(idOrCode)
                .toUpperCase(Locale.ROOT);
    }

    /**
     * Resolve an enabled instance by id or code.
     *
     * @return the instance, or empty when unknown or disabled
     */
    public Optional<InstanceConfig> resolve(String idOrCode) {
        if (isBlank(idOrCode)) {
            return Optional.empty();
        }
        return registry.find(idOrCode).filter(InstanceConfig::enabled);
    }

    /**
     * Enabled instances only.
     */
    public List<InstanceConfig> registeredInstances() {
        return registry.findAll().stream().filter(InstanceConfig::enabled).toList();
    }

    /**
     * Replace the trust matrix, e.g. after a policy distribution update.
     */
    public void refresh(Collection<BilateralTrust> edges) {
        trustStore.replaceAll(edges);
        LOG.infov("Trust matrix refreshed with {0} edges", edges.size());
    }

    /**
     * Scopes granted over {@code trust}: the requested scopes it allows, or all of its scopes
     * when nothing specific was requested.
     */
    public static Set<String> grantedScopes(BilateralTrust trust, Set<String> requested) {
        if (requested == null || requested.isEmpty()) {
            return trust.allowedScopes();
        }
        final var granted = new LinkedHashSet<String>();
        for (var scope : requested) {
            if (trust.allowedScopes().contains(scope)) {
                granted.add(scope);
            }
        }
        return Set.copyOf(granted);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
