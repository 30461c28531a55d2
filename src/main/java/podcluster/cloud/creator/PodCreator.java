package podcluster.cloud.creator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import podcluster.cloud.catalog.InstanceCatalog;
import podcluster.cloud.client.PodApi;
import podcluster.cloud.model.CreatePodRequest;
import podcluster.cloud.model.InstanceType;
import podcluster.cloud.model.Pod;

/**
 * Launches single pods. The catalog is resolved up front so a bad instance type
 * fails before anything is sent to the provider.
 */
public class PodCreator {

    private static final Logger log = LoggerFactory.getLogger(PodCreator.class);

    private final PodApi api;
    private final InstanceCatalog catalog;

    public PodCreator(PodApi api, InstanceCatalog catalog) {
        this.api = api;
        this.catalog = catalog;
    }

    /**
     * Create one pod.
     *
     * @return the pod as acknowledged by the provider (carries the new id)
     */
    public Pod launch(String name, String instanceType, String region, int diskSizeGb) {
        InstanceCatalog.Offering offering = catalog.resolve(instanceType);
        InstanceType type = offering.type();

        CreatePodRequest request = CreatePodRequestBuilder.build(name, type, offering.cloudId(), region, diskSizeGb);
        Pod created = api.createPod(request);
        if (created == null || created.id() == null) {
            throw new IllegalStateException("Provider did not return an id for pod " + name);
        }
        log.info("Create sent: name={} id={} type={} region={}", name, created.id(), type, region);
        return created;
    }
}
