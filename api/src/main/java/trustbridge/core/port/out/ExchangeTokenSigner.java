package trustbridge.core.port.out;

import trustbridge.core.model.federation.ExchangeTokenClaims;

/**
 * Port for signing exchange tokens with this instance's private key.
 */
public interface ExchangeTokenSigner {

    /**
     * Sign the claims as a compact JWS.
     *
     * @throws IllegalStateException if no signing key is available
     */
    String sign(ExchangeTokenClaims claims);

    /**
     * The public half of the signing key as a JWKS document, for peers to verify with.
     */
    String publicKeySetJson();
}
