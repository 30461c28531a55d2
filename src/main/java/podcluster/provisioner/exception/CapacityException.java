package podcluster.provisioner.exception;

/**
 * The cluster cannot be brought to the requested size: more pods exist than wanted,
 * pods being created never settled, or the wanted number never became active
 * within the poll budget.
 */
public class CapacityException extends ProvisionException {

    private final String clusterName;
    private final int observed;
    private final int desired;

    public CapacityException(String message, String clusterName, int observed, int desired) {
        super(message);
        this.clusterName = clusterName;
        this.observed = observed;
        this.desired = desired;
    }

    public static CapacityException overCapacity(String clusterName, int observed, int desired) {
        return new CapacityException("Cluster " + clusterName + " already has " + observed
                + " nodes, but " + desired + " are required.", clusterName, observed, desired);
    }

    public static CapacityException notConverged(String clusterName, int observed, int desired, int polls) {
        return new CapacityException("Failed to create the instances of cluster " + clusterName
                + " due to capacity issue: " + observed + "/" + desired + " active after " + polls + " polls.",
                clusterName, observed, desired);
    }

    public static CapacityException stillPending(String clusterName, int pending, int desired, int polls) {
        return new CapacityException("Cluster " + clusterName + " still has " + pending
                + " instance(s) being created after " + polls + " polls.", clusterName, pending, desired);
    }

    public String clusterName() {
        return clusterName;
    }

    public int observed() {
        return observed;
    }

    public int desired() {
        return desired;
    }
}
