package trustbridge.core.port.out;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import trustbridge.core.model.federation.BilateralTrust;

/**
 * Port for the directional trust matrix.
 *
 * <p>Lookups return raw edges, including disabled or expired ones; effectiveness is
 * decided by the caller. Instance codes are matched case-insensitively.
 */
public interface TrustStore {

    /**
     * Find the edge from {@code source} to {@code target}.
     *
     * @param source trusting instance code
     * @param target trusted instance code
     * @return the edge if configured
     */
    Optional<BilateralTrust> find(String source, String target);

    /**
     * All edges whose source is {@code source}.
     */
    List<BilateralTrust> findBySource(String source);

    /**
     * All configured edges.
     */
    List<BilateralTrust> findAll();

    /**
     * Atomically replace the whole matrix.
     *
     * <p>Readers observe either the previous or the new matrix, never a mix.
     *
     * @param edges the new matrix
     */
    void replaceAll(Collection<BilateralTrust> edges);
}
