package podcluster.cloud.client;

import podcluster.cloud.model.CreatePodRequest;
import podcluster.cloud.model.Pod;
import podcluster.cloud.model.SshKey;

import java.util.List;

/**
 * Operations of the provider's pod API used by the provisioner.
 * All calls are synchronous and throw {@link ApiRequestException} on failure.
 */
public interface PodApi {

    /** GET /pods */
    List<Pod> listPods();

    /** GET /pods/{id} */
    Pod getPod(String podId);

    /** POST /pods */
    Pod createPod(CreatePodRequest request);

    /** DELETE /pods/{id} */
    void deletePod(String podId);

    /** GET /ssh_keys */
    List<SshKey> listSshKeys();

    /** POST /ssh_keys */
    void addSshKey(SshKey key);
}
