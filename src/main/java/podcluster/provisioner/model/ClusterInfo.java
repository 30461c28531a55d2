package podcluster.provisioner.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Connection details of every running node of a cluster. Built fresh per query.
 */
public record ClusterInfo(
        Map<String, List<InstanceInfo>> instances,
        String headInstanceId,
        String providerName,
        Map<String, Object> providerConfig,
        String sshUser) {

    public ClusterInfo {
        instances = Collections.unmodifiableMap(new LinkedHashMap<>(instances));
        providerConfig = providerConfig == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(providerConfig));
    }
}
