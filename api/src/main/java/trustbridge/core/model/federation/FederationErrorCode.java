package trustbridge.core.model.federation;

/**
 * Machine-readable reasons attached to fail-closed results.
 */
public enum FederationErrorCode {
    NO_BILATERAL_TRUST,
    TOKEN_INVALID,
    CLASSIFICATION_EXCEEDS_TRUST,
    REMOTE_EVALUATION_UNAVAILABLE,
    LOCAL_EVALUATION_UNAVAILABLE,
    LOCAL_POLICY_DENIED,
    REMOTE_POLICY_DENIED
}
