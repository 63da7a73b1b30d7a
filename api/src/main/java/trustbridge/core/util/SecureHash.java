package trustbridge.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 fingerprints for cache keys derived from sensitive values.
 *
 * <p>Raw tokens and subject identifiers never appear as cache keys; their digest does.
 */
public final class SecureHash {

    private static final char FIELD_SEPARATOR = '\u001F';

    private SecureHash() {}

    /**
     * Return the hex SHA-256 digest of the input string.
     *
     * @param input the string to hash
     * @return 64 character hex digest
     */
    public static String sha256(String input) {
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 is a required JDK algorithm", e);
        }
    }

    /**
     * Digest of several fields, joined with a separator that cannot appear in them.
     *
     * <p>Null fields hash as empty strings.
     *
     * @param fields values to combine
     * @return 64 character hex digest
     */
    public static String fingerprint(String... fields) {
        final var joined = new StringBuilder();
        for (int i = 0; i < fields.length; i++) {
            if (i > 0) {
                joined.append(FIELD_SEPARATOR);
            }
            joined.append(fields[i] == null ? "" : fields[i]);
        }
        return sha256(joined.toString());
    }
}
