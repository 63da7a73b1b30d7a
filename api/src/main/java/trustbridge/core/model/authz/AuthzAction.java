package trustbridge.core.model.authz;

import java.util.Locale;

/**
 * Operations a subject may request on a federated resource.
 */
public enum AuthzAction {
    READ,
    WRITE,
    DECRYPT,
    DOWNLOAD;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
