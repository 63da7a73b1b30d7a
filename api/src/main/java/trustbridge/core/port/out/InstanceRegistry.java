package trustbridge.core.port.out;

import java.util.List;
import java.util.Optional;

import trustbridge.core.model.federation.InstanceConfig;

/**
 * Port for the table of known federation peers.
 */
public interface InstanceRegistry {

    /**
     * Find an instance by id or code, regardless of its enabled flag.
     *
     * @param idOrCode instance id ({@code gbr}) or code ({@code GBR})
     * @return the instance if registered
     */
    Optional<InstanceConfig> find(String idOrCode);

    /**
     * All registered instances, enabled or not.
     */
    List<InstanceConfig> findAll();
}
