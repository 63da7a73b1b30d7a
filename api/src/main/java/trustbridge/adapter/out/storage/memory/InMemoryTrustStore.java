package trustbridge.adapter.out.storage.memory;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import trustbridge.core.config.FederationConfig;
import trustbridge.core.model.federation.BilateralTrust;
import trustbridge.core.port.out.TrustStore;

/**
 * Trust matrix held in memory, seeded from configuration.
 *
 * <p>Data is NOT persisted across restarts. The matrix is an immutable snapshot swapped
 * atomically on {@link #replaceAll(Collection)}, so readers never see a partial update.
 */
@ApplicationScoped
public class InMemoryTrustStore implements TrustStore {

    private static final Logger LOG = Logger.getLogger(InMemoryTrustStore.class);

    private volatile Snapshot snapshot;

    @Inject
    public InMemoryTrustStore(FederationConfig config, Clock clock) {
        this(config.trusts().stream().map(trust -> toTrust(trust, clock)).toList());
        LOG.infov("Trust matrix loaded with {0} edges", snapshot.all().size());
    }

    public InMemoryTrustStore(Collection<BilateralTrust> edges) {
        this.snapshot = Snapshot.of(edges);
    }

    static BilateralTrust toTrust(FederationConfig.Trust trust, Clock clock) {
        return new BilateralTrust(
                trust.source(),
                trust.target(),
                trust.trustLevel(),
                trust.maxClassification(),
                Set.copyOf(trust.allowedScopes().orElse(List.of())),
                trust.enabled(),
                trust.establishedAt().orElseGet(clock::instant),
                trust.expiresAt());
    }

    @Override
    public Optional<BilateralTrust> find(String source, String target) {
        return Optional.ofNullable(snapshot.byEdge().get(key(source, target)));
    }

    @Override
    public List<BilateralTrust> findBySource(String source) {
        final var code = source.toUpperCase(Locale.ROOT);
        return snapshot.all().stream()
                .filter(edge -> edge.sourceInstance().equals(code))
                .toList();
    }

    @Override
    public List<BilateralTrust> findAll() {
        return snapshot.all();
    }

    @Override
    public void replaceAll(Collection<BilateralTrust> edges) {
        snapshot = Snapshot.of(edges);
    }

    private static String key(String source, String target) {
        return source.toUpperCase(Locale.ROOT) + "->" + target.toUpperCase(Locale.ROOT);
    }

    private record Snapshot(Map<String, BilateralTrust> byEdge, List<BilateralTrust> all) {

        static Snapshot of(Collection<BilateralTrust> edges) {
            final var byEdge = new LinkedHashMap<String, BilateralTrust>();
            for (var edge : edges) {
                // a later duplicate replaces an earlier one
                byEdge.put(key(edge.sourceInstance(), edge.targetInstance()), edge);
            }
            return new Snapshot(Map.copyOf(byEdge), List.copyOf(byEdge.values()));
        }
    }
}
