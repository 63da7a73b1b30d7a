package trustbridge.core.model.federation;

/**
 * RFC 8693 token type identifiers.
 */
public enum TokenType {
    ACCESS_TOKEN("urn:ietf:params:oauth:token-type:access_token"),
    JWT("urn:ietf:params:oauth:token-type:jwt");

    private final String urn;

    TokenType(String urn) {
        this.urn = urn;
    }

    public String urn() {
        return urn;
    }
}
