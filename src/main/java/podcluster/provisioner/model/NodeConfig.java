package podcluster.provisioner.model;

import java.util.Objects;

/**
 * Per-node launch settings.
 */
public record NodeConfig(String instanceType, int diskSizeGb) {

    public NodeConfig {
        Objects.requireNonNull(instanceType, "instanceType is required");
        if (diskSizeGb < 1) {
            throw new IllegalArgumentException("diskSizeGb must be positive: " + diskSizeGb);
        }
    }
}
