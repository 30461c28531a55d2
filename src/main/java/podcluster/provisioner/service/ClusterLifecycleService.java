package podcluster.provisioner.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import podcluster.cloud.client.PodApi;
import podcluster.cloud.manager.PodDirectory;
import podcluster.cloud.model.Pod;
import podcluster.cloud.model.PodStatus;
import podcluster.provisioner.exception.ProvisionException;
import podcluster.provisioner.model.ClusterStatus;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Status queries and teardown of a cluster. Stop and resume are not offered by the provider.
 */
public class ClusterLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(ClusterLifecycleService.class);

    private static final Map<PodStatus, ClusterStatus> STATUS_MAP = new EnumMap<>(PodStatus.class);

    static {
        STATUS_MAP.put(PodStatus.PROVISIONING, ClusterStatus.INIT);
        STATUS_MAP.put(PodStatus.PENDING, ClusterStatus.INIT);
        STATUS_MAP.put(PodStatus.ERROR, ClusterStatus.INIT);
        STATUS_MAP.put(PodStatus.DELETING, ClusterStatus.INIT);
        STATUS_MAP.put(PodStatus.ACTIVE, ClusterStatus.UP);
        STATUS_MAP.put(PodStatus.STOPPED, ClusterStatus.STOPPED);
        STATUS_MAP.put(PodStatus.TERMINATED, ClusterStatus.STOPPED);
        // not up, not gone: treat as still initializing
        STATUS_MAP.put(PodStatus.UNKNOWN, ClusterStatus.INIT);
    }

    private final PodDirectory directory;
    private final PodApi api;

    public ClusterLifecycleService(PodDirectory directory, PodApi api) {
        this.directory = directory;
        this.api = api;
    }

    /** Canonical status of a provider status. */
    public static ClusterStatus toClusterStatus(PodStatus status) {
        ClusterStatus mapped = STATUS_MAP.get(status);
        if (mapped == null) {
            throw new IllegalArgumentException("Unmapped pod status: " + status);
        }
        return mapped;
    }

    /** Status of every pod of the cluster, keyed by pod id. */
    public Map<String, ClusterStatus> query(String clusterName) {
        return query(clusterName, false);
    }

    /**
     * @param nonTerminatedOnly leave out pods the provider reports as TERMINATED
     */
    public Map<String, ClusterStatus> query(String clusterName, boolean nonTerminatedOnly) {
        Map<String, ClusterStatus> statuses = new LinkedHashMap<>();
        for (Pod pod : directory.list(clusterName).values()) {
            if (nonTerminatedOnly && pod.status() == PodStatus.TERMINATED) {
                continue;
            }
            statuses.put(pod.id(), toClusterStatus(pod.status()));
        }
        return statuses;
    }

    /**
     * Delete the pods of a cluster, or only its workers.
     * Stops at the first failed deletion; the caller retries the whole termination.
     *
     * @throws ProvisionException naming the pod that could not be deleted
     */
    public void terminate(String clusterName, boolean workerOnly) {
        Map<String, Pod> pods = directory.list(clusterName);
        int deleted = 0;
        for (Pod pod : pods.values()) {
            if (workerOnly && pod.isHead()) {
                continue;
            }
            log.debug("Terminating instance {} ({})", pod.id(), pod.name());
            try {
                api.deletePod(pod.id());
            } catch (RuntimeException e) {
                throw new ProvisionException("Failed to terminate instance " + pod.id()
                        + " of cluster " + clusterName + ": " + e.getMessage(), e);
            }
            deleted++;
        }
        log.info("Terminated {} instance(s) of cluster {}{}", deleted, clusterName, workerOnly ? " (workers only)" : "");
    }

    public void stop(String clusterName, boolean workerOnly) {
        throw new UnsupportedOperationException("Stopping is not supported by the provider (cluster " + clusterName + ")");
    }

    public void resume(String clusterName) {
        throw new UnsupportedOperationException("Resuming is not supported by the provider (cluster " + clusterName + ")");
    }
}
