package trustbridge.core.model.federation;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * A directional trust edge from {@code sourceInstance} to {@code targetInstance}.
 *
 * <p>The presence of A to B says nothing about B to A.
 */
public record BilateralTrust(
        String sourceInstance,
        String targetInstance,
        TrustLevel trustLevel,
        Classification maxClassification,
        Set<String> allowedScopes,
        boolean enabled,
        Instant establishedAt,
        Optional<Instant> expiresAt) {

    public BilateralTrust {
        if (sourceInstance == null || sourceInstance.isBlank()) {
            throw new IllegalArgumentException("sourceInstance cannot be blank");
        }
        if (targetInstance == null || targetInstance.isBlank()) {
            throw new IllegalArgumentException("targetInstance cannot be blank");
        }
        sourceInstance = sourceInstance.toUpperCase(Locale.ROOT);
        targetInstance = targetInstance.toUpperCase(Locale.ROOT);
        allowedScopes = allowedScopes == null ? Set.of() : Set.copyOf(allowedScopes);
        expiresAt = expiresAt == null ? Optional.empty() : expiresAt;
    }

    public boolean isExpired(Instant now) {
        return expiresAt.map(now::isAfter).orElse(false);
    }

    /**
     * An edge counts only while it is enabled and not expired.
     */
    public boolean isEffective(Instant now) {
        return enabled && !isExpired(now);
    }

    public boolean connects(String source, String target) {
        return sourceInstance.equalsIgnoreCase(source) && targetInstance.equalsIgnoreCase(target);
    }
}
