package podcluster.provisioner.exception;

/**
 * An active pod never reported an SSH endpoint.
 */
public class ReadinessTimeoutException extends ProvisionException {

    private final String clusterName;
    private final String instanceId;

    public ReadinessTimeoutException(String clusterName, String instanceId, int attempts) {
        super("Failed to establish SSH connection to instance " + instanceId + " of cluster "
                + clusterName + " after " + attempts + " attempts");
        this.clusterName = clusterName;
        this.instanceId = instanceId;
    }

    public String clusterName() {
        return clusterName;
    }

    public String instanceId() {
        return instanceId;
    }
}
