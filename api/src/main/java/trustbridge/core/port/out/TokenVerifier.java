package trustbridge.core.port.out;

import io.smallrye.mutiny.Uni;

import trustbridge.core.model.federation.InstanceConfig;
import trustbridge.core.model.federation.LocalVerification;

/**
 * Port for verifying a token locally against the issuing instance's public keys.
 */
public interface TokenVerifier {

    /**
     * Verify signature and expiry of {@code token} as issued by {@code origin}.
     *
     * <p>Never fails; problems are reported as {@link LocalVerification.Rejected} or
     * {@link LocalVerification.Unavailable}.
     */
    Uni<LocalVerification> verify(String token, InstanceConfig origin);
}
