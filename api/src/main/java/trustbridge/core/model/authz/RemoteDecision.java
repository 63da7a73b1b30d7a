package trustbridge.core.model.authz;

/**
 * Verdict from the resource-owning instance.
 *
 * @param source where the verdict came from
 */
public record RemoteDecision(boolean allow, String reason, String instanceId, Source source) {

    public enum Source {
        /** The peer's federation evaluation endpoint. */
        FEDERATION_ENDPOINT,
        /** Local policy engine with translated attributes, used when the peer has no endpoint. */
        LOCAL_FALLBACK
    }
}
