package trustbridge.core.model.federation;

import java.util.Locale;
import java.util.Optional;

/**
 * NATO-normalized classification hierarchy.
 *
 * <p>Declaration order is the sensitivity order, so {@link #compareTo} and
 * {@link #level()} can be used for ceiling checks.
 */
public enum Classification {
    UNCLASSIFIED,
    RESTRICTED,
    CONFIDENTIAL,
    SECRET,
    TOP_SECRET;

    public int level() {
        return ordinal();
    }

    public boolean exceeds(Classification ceiling) {
        return compareTo(ceiling) > 0;
    }

    public boolean isAtLeast(Classification threshold) {
        return compareTo(threshold) >= 0;
    }

    /**
     * Parse a classification label.
     *
     * <p>Matching is case-insensitive and accepts spaces or hyphens in place of underscores.
     *
     * @param label the label, possibly null
     * @return the classification, or empty when the label is not part of the hierarchy
     */
    public static Optional<Classification> parse(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        final var normalized =
                label.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        for (var value : values()) {
            if (value.name().equals(normalized)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
