package podcluster.provisioner.model;

import java.util.Map;

/**
 * How to reach one node of a cluster.
 */
public record InstanceInfo(
        String instanceId,
        String internalIp,
        String externalIp,
        int sshPort,
        Map<String, String> tags) {

    /** The provider exposes no private addresses. */
    public static final String INTERNAL_IP_NOT_SUPPORTED = "NOT_SUPPORTED";

    public InstanceInfo {
        tags = Map.copyOf(tags);
    }
}
