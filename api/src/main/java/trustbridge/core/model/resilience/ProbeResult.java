package trustbridge.core.model.resilience;

import java.time.Instant;
import java.util.Optional;

/**
 * Result of an explicit health probe against a peer.
 */
public record ProbeResult(boolean success, long latencyMs, Optional<String> error, Instant timestamp) {}
