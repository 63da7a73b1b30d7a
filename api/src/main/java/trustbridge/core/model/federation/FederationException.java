package trustbridge.core.model.federation;

/**
 * Base of the federation failure taxonomy.
 *
 * <p>Every subtype maps to a {@link FederationErrorCode}. Services translate these
 * into fail-closed results; none of them ever resolves to an allow.
 */
public class FederationException extends RuntimeException {

    private final FederationErrorCode code;

    public FederationException(FederationErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public FederationException(FederationErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public FederationErrorCode code() {
        return code;
    }

    /**
     * No enabled, unexpired trust edge exists for the requested direction.
     */
    public static class NoBilateralTrustException extends FederationException {
        public NoBilateralTrustException(String source, String target) {
            super(FederationErrorCode.NO_BILATERAL_TRUST, "No bilateral trust from " + source + " to " + target);
        }
    }

    /**
     * Signature failure, expiry or malformed token.
     */
    public static class TokenInvalidException extends FederationException {
        public TokenInvalidException(String message) {
            super(FederationErrorCode.TOKEN_INVALID, message);
        }

        public TokenInvalidException(String message, Throwable cause) {
            super(FederationErrorCode.TOKEN_INVALID, message, cause);
        }
    }

    /**
     * Resource classification is above the trust edge's ceiling.
     */
    public static class ClassificationExceedsTrustException extends FederationException {
        public ClassificationExceedsTrustException(String classification, Classification ceiling) {
            super(
                    FederationErrorCode.CLASSIFICATION_EXCEEDS_TRUST,
                    "Resource classification " + classification + " exceeds bilateral trust limit " + ceiling);
        }
    }

    /**
     * A peer could not produce a verdict: timeout, non-2xx, malformed response or open circuit.
     */
    public static class RemoteEvaluationUnavailableException extends FederationException {
        public RemoteEvaluationUnavailableException(String message) {
            super(FederationErrorCode.REMOTE_EVALUATION_UNAVAILABLE, message);
        }

        public RemoteEvaluationUnavailableException(String message, Throwable cause) {
            super(FederationErrorCode.REMOTE_EVALUATION_UNAVAILABLE, message, cause);
        }
    }

    /**
     * The peer's circuit breaker refused the call. No network I/O took place.
     */
    public static class CircuitOpenException extends RemoteEvaluationUnavailableException {
        private final String peerId;

        public CircuitOpenException(String peerId) {
            super("Circuit open for instance " + peerId);
            this.peerId = peerId;
        }

        public String peerId() {
            return peerId;
        }
    }

    /**
     * The local policy engine could not produce a verdict.
     */
    public static class LocalEvaluationUnavailableException extends FederationException {
        public LocalEvaluationUnavailableException(String message) {
            super(FederationErrorCode.LOCAL_EVALUATION_UNAVAILABLE, message);
        }

        public LocalEvaluationUnavailableException(String message, Throwable cause) {
            super(FederationErrorCode.LOCAL_EVALUATION_UNAVAILABLE, message, cause);
        }
    }
}
