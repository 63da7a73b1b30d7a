package trustbridge.core.model.federation;

/**
 * A peer answered with a body that does not match the expected shape.
 */
public class MalformedPeerResponseException extends RuntimeException {

    public MalformedPeerResponseException(String message) {
        super(message);
    }

    public MalformedPeerResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
