package podcluster.cloud.manager;

import podcluster.cloud.client.PodApi;
import podcluster.cloud.model.Pod;
import podcluster.cloud.model.PodStatus;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Point-in-time view of the pods that belong to a cluster.
 * <p>
 * The provider has no cluster primitive, so membership is decided by name: a pod
 * belongs to cluster {@code c} iff it is named exactly {@code c-head} or {@code c-worker}.
 * Filtering happens client side on the full pod list. Every call re-reads the provider.
 */
public class PodDirectory {

    private final PodApi api;

    public PodDirectory(PodApi api) {
        this.api = api;
    }

    /** All pods of the cluster, in provider order, keyed by id. */
    public Map<String, Pod> list(String clusterName) {
        return list(clusterName, null);
    }

    /**
     * Pods of the cluster whose status is in {@code statusFilter}.
     *
     * @param statusFilter accepted statuses, or null for any status
     */
    public Map<String, Pod> list(String clusterName, Set<PodStatus> statusFilter) {
        String head = headName(clusterName);
        String worker = workerName(clusterName);

        Map<String, Pod> result = new LinkedHashMap<>();
        for (Pod pod : api.listPods()) {
            if (statusFilter != null && !statusFilter.contains(pod.status())) {
                continue;
            }
            if (head.equals(pod.name()) || worker.equals(pod.name())) {
                result.put(pod.id(), pod);
            }
        }
        return result;
    }

    /** Fresh details of a single pod. */
    public Pod get(String podId) {
        return api.getPod(podId);
    }

    /** First pod whose name marks it as head. */
    public static Optional<String> findHead(Map<String, Pod> pods) {
        return findHead(pods.values());
    }

    public static Optional<String> findHead(Collection<Pod> pods) {
        for (Pod pod : pods) {
            if (pod.isHead()) {
                return Optional.of(pod.id());
            }
        }
        return Optional.empty();
    }

    public static String headName(String clusterName) {
        return clusterName + Pod.HEAD_SUFFIX;
    }

    public static String workerName(String clusterName) {
        return clusterName + Pod.WORKER_SUFFIX;
    }
}
