package podcluster.provisioner.model;

/**
 * Canonical cluster node status understood by callers.
 */
public enum ClusterStatus {
    /** Being created, failing or being torn down */
    INIT,
    /** Running */
    UP,
    /** Stopped or gone */
    STOPPED
}
