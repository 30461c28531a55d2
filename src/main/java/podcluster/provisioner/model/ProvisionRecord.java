package podcluster.provisioner.model;

import java.util.List;

/**
 * Outcome of one reconciliation call.
 *
 * @param zone                always null, the provider has no zones
 * @param resumedInstanceIds  pods that were still being created when the call started
 *                            (only reported when nothing had to be launched)
 * @param createdInstanceIds  pods launched by this call, in launch order
 */
public record ProvisionRecord(
        String providerName,
        String clusterName,
        String region,
        String zone,
        String headInstanceId,
        List<String> resumedInstanceIds,
        List<String> createdInstanceIds) {

    public ProvisionRecord {
        resumedInstanceIds = List.copyOf(resumedInstanceIds);
        createdInstanceIds = List.copyOf(createdInstanceIds);
    }
}
