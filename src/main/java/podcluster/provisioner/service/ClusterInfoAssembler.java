package podcluster.provisioner.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import podcluster.cloud.manager.PodDirectory;
import podcluster.cloud.model.Pod;
import podcluster.provisioner.config.ProvisionerConfig;
import podcluster.provisioner.exception.ReadinessTimeoutException;
import podcluster.provisioner.model.ClusterInfo;
import podcluster.provisioner.model.InstanceInfo;
import podcluster.provisioner.model.SshEndpoint;
import podcluster.provisioner.poll.Poller;
import podcluster.util.Sleeper;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the active pods of a cluster into connection details.
 * <p>
 * The provider reports a pod ACTIVE before its SSH gateway exists, so pods without
 * an SSH endpoint are re-read until one appears. Assembly is all or nothing: one
 * pod that never gets an endpoint fails the whole call.
 */
public class ClusterInfoAssembler {

    private static final Logger log = LoggerFactory.getLogger(ClusterInfoAssembler.class);

    static final String PROVIDER_TAG = "provider";

    private final PodDirectory directory;
    private final Poller sshPoller;

    public ClusterInfoAssembler(PodDirectory directory, ProvisionerConfig config, Sleeper sleeper) {
        this.directory = directory;
        // the listed state is the first attempt, each retry re-fetches the pod
        this.sshPoller = new Poller(sleeper, config.sshRetryDelay(), config.sshMaxRetries() + 1);
    }

    public ClusterInfo assemble(String clusterName) {
        return assemble(clusterName, null);
    }

    /**
     * @throws ReadinessTimeoutException if an active pod never reports an SSH endpoint
     */
    public ClusterInfo assemble(String clusterName, Map<String, Object> providerConfig) {
        Map<String, Pod> running = directory.list(clusterName, ClusterReconciler.ACTIVE);

        Map<String, List<InstanceInfo>> instances = new LinkedHashMap<>();
        String headId = null;
        String sshUser = null;

        for (Pod listed : running.values()) {
            Pod pod = awaitSsh(clusterName, listed);
            SshEndpoint endpoint = SshEndpoint.parse(pod.sshConnection());

            instances.put(pod.id(), List.of(new InstanceInfo(
                    pod.id(),
                    InstanceInfo.INTERNAL_IP_NOT_SUPPORTED,
                    pod.ip(),
                    endpoint.port(),
                    pod.providerType() == null ? Map.of() : Map.of(PROVIDER_TAG, pod.providerType()))));

            if (pod.isHead()) {
                headId = pod.id();
                sshUser = endpoint.user();
            }
        }

        log.debug("Assembled cluster {}: {} instance(s), head={}", clusterName, instances.size(), headId);
        return new ClusterInfo(instances, headId, ClusterReconciler.PROVIDER_NAME, providerConfig, sshUser);
    }

    private Pod awaitSsh(String clusterName, Pod listed) {
        Poller.Outcome<Pod> outcome = sshPoller.await(
                listed,
                () -> directory.get(listed.id()),
                Pod::hasSshConnection,
                pod -> log.info("SSH connection to {} is not ready, waiting {} s...",
                        pod.name(), sshPoller.interval().toSeconds()));
        if (!outcome.satisfied()) {
            throw new ReadinessTimeoutException(clusterName, listed.id(), sshPoller.maxAttempts() - 1);
        }
        if (outcome.attempts() > 1) {
            log.info("SSH connection to {} is ready", listed.name());
        }
        return outcome.last();
    }
}
