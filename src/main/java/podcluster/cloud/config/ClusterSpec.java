package podcluster.cloud.config;

/**
 * Desired cluster as described in a cluster INI file.
 *
 * @param sshPublicKey public key text, or null when no key should be registered
 */
public record ClusterSpec(
        String clusterName,
        int nodes,
        String instanceType,
        String region,
        int diskSizeGb,
        String sshPublicKey) {

    public ClusterSpec {
        if (clusterName == null || clusterName.isBlank()) {
            throw new IllegalArgumentException("Cluster name is required");
        }
        if (nodes < 1) {
            throw new IllegalArgumentException("Cluster needs at least one node: " + nodes);
        }
        if (instanceType == null || instanceType.isBlank()) {
            throw new IllegalArgumentException("Instance type is required");
        }
        if (diskSizeGb < 1) {
            throw new IllegalArgumentException("Disk size must be positive: " + diskSizeGb);
        }
    }

    @Override
    public String toString() {
        return "[ClusterSpec] " + clusterName + " x" + nodes + " | " + instanceType
                + " | region=" + region + " disk=" + diskSizeGb + "GB";
    }
}
