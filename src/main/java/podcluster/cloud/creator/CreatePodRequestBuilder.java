package podcluster.cloud.creator;

import podcluster.cloud.model.CreatePodRequest;
import podcluster.cloud.model.InstanceType;
import podcluster.cloud.model.Placement;

/**
 * Builds the POST /pods body from a decoded instance type and a region.
 */
public final class CreatePodRequestBuilder {

    static final String SOCKET = "PCIe";

    private CreatePodRequestBuilder() {
    }

    public static CreatePodRequest build(String name, InstanceType type, String cloudId,
                                         String region, int diskSizeGb) {
        Placement placement = Placement.fromRegion(region);

        var pod = new CreatePodRequest.PodSpec(
                name,
                cloudId,
                SOCKET,
                type.gpuType(),
                type.gpuCount(),
                diskSizeGb,
                placement.country(),
                placement.dataCenterId());

        return new CreatePodRequest(pod, new CreatePodRequest.ProviderSpec(type.provider()));
    }
}
