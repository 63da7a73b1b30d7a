package trustbridge.core.config;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import trustbridge.core.model.federation.Classification;
import trustbridge.core.model.federation.TrustLevel;

/**
 * Configuration mapping for federation membership, trust and decision settings.
 *
 * <p>Configuration prefix: {@code trustbridge.federation}
 *
 * <p>Example:
 * <pre>{@code
 * trustbridge.federation.local-instance=usa
 * trustbridge.federation.instances.gbr.base-url=https://gbr.coalition.example
 * trustbridge.federation.instances.gbr.country=GBR
 * trustbridge.federation.trusts[0].source=USA
 * trustbridge.federation.trusts[0].target=GBR
 * trustbridge.federation.trusts[0].max-classification=TOP_SECRET
 * }</pre>
 */
@ConfigMapping(prefix = "trustbridge.federation")
public interface FederationConfig {

    /**
     * Identifier of the instance this service runs as.
     *
     * @return local instance id (default: usa)
     */
    @WithDefault("usa")
    String localInstance();

    /**
     * Known peers keyed by instance id. The local instance is listed here too.
     */
    Map<String, Instance> instances();

    /**
     * Initial trust matrix. May later be replaced through the trust store.
     */
    List<Trust> trusts();

    /**
     * Token introspection settings.
     */
    IntrospectionConfig introspection();

    /**
     * Token exchange settings.
     */
    ExchangeConfig exchange();

    /**
     * Cross-instance authorization settings.
     */
    AuthzConfig authz();

    interface Instance {

        /** Upper-case code used in the trust matrix; defaults to the upper-cased id. */
        Optional<String> code();

        String baseUrl();

        /** Defaults to {@code <base-url>/oauth/introspect}. */
        Optional<String> introspectionUrl();

        /** Absent when the peer only supports introspection. */
        Optional<String> signingKeysUrl();

        @WithDefault("medium")
        TrustLevel trustLevel();

        String country();

        @WithDefault("true")
        boolean enabled();

        /** National clearance label to NATO-normalized label. */
        Map<String, String> clearanceMapping();
    }

    interface Trust {

        String source();

        String target();

        @WithDefault("medium")
        TrustLevel trustLevel();

        @WithDefault("SECRET")
        Classification maxClassification();

        Optional<List<String>> allowedScopes();

        @WithDefault("true")
        boolean enabled();

        Optional<Instant> establishedAt();

        Optional<Instant> expiresAt();
    }

    interface IntrospectionConfig {

        /**
         * How long an active introspection result is reused.
         *
         * @return cache TTL (default: 30 seconds, capped at 30 seconds)
         */
        @WithDefault("PT30S")
        Duration cacheTtl();

        /**
         * @return maximum cached results (default: 10000)
         */
        @WithDefault("10000")
        int maxCacheEntries();
    }

    interface ExchangeConfig {

        /**
         * Lifetime of issued exchange tokens.
         *
         * @return token TTL (default: 15 minutes, capped at 15 minutes)
         */
        @WithDefault("PT15M")
        Duration tokenTtl();

        /**
         * Issuer claim of exchange tokens; defaults to the local instance's base URL.
         */
        Optional<String> issuer();

        /**
         * PEM-encoded PKCS#8 RSA private key. When absent an ephemeral key pair is generated at startup.
         */
        Optional<String> signingKey();

        /**
         * @return key ID placed in the JWS header (default: trustbridge-exchange-1)
         */
        @WithDefault("trustbridge-exchange-1")
        String keyId();
    }

    interface AuthzConfig {

        /**
         * @return base URL of the local policy engine (default: http://localhost:8181)
         */
        @WithDefault("http://localhost:8181")
        String policyEngineUrl();

        /**
         * @return policy path under {@code /v1/data/} (default: dive/authorization)
         */
        @WithDefault("dive/authorization")
        String policyPath();

        /**
         * @return decision cache TTL (default: 60 seconds)
         */
        @WithDefault("PT60S")
        Duration decisionCacheTtl();

        /**
         * @return maximum cached decisions (default: 10000)
         */
        @WithDefault("10000")
        int maxCacheEntries();

        /**
         * Resources at or above this classification carry an enhanced audit obligation.
         *
         * @return threshold (default: SECRET)
         */
        @WithDefault("SECRET")
        Classification enhancedAuditThreshold();
    }
}
