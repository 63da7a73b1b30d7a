package trustbridge.adapter.out.storage.memory;

import java.net.URI;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import trustbridge.core.config.FederationConfig;
import trustbridge.core.model.federation.InstanceConfig;
import trustbridge.core.port.out.InstanceRegistry;

/**
 * Instance registry built once from {@code trustbridge.federation.instances}.
 */
@ApplicationScoped
public class ConfigInstanceRegistry implements InstanceRegistry {

    private static final Logger LOG = Logger.getLogger(ConfigInstanceRegistry.class);
    static final String DEFAULT_INTROSPECTION_PATH = "/oauth/introspect";

    private final List<InstanceConfig> instances;

    @Inject
    public ConfigInstanceRegistry(FederationConfig config) {
        this(config.instances().entrySet().stream()
                .map(entry -> toInstance(entry.getKey(), entry.getValue()))
                .toList());
        LOG.infov("Instance registry loaded: {0}", instances.stream().map(InstanceConfig::instanceCode).toList());
    }

    public ConfigInstanceRegistry(Collection<InstanceConfig> instances) {
        this.instances = List.copyOf(instances);
    }

    static InstanceConfig toInstance(String id, FederationConfig.Instance instance) {
        final var baseUrl = URI.create(instance.baseUrl());
        final var introspection = instance.introspectionUrl()
                .map(URI::create)
                .orElseGet(() -> URI.create(trimTrailingSlash(instance.baseUrl()) + DEFAULT_INTROSPECTION_PATH));
        return new InstanceConfig(
                id,
                instance.code().orElse(null),
                baseUrl,
                introspection,
                instance.signingKeysUrl().map(URI::create),
                instance.trustLevel(),
                instance.country(),
                instance.enabled(),
                Map.copyOf(instance.clearanceMapping()));
    }

    @Override
    public Optional<InstanceConfig> find(String idOrCode) {
        return instances.stream().filter(instance -> instance.matches(idOrCode)).findFirst();
    }

    @Override
    public List<InstanceConfig> findAll() {
        return instances;
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
