package podcluster.provisioner.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import podcluster.cloud.creator.PodCreator;
import podcluster.cloud.manager.PodDirectory;
import podcluster.cloud.model.Pod;
import podcluster.cloud.model.PodStatus;
import podcluster.provisioner.config.ProvisionerConfig;
import podcluster.provisioner.exception.CapacityException;
import podcluster.provisioner.model.NodeConfig;
import podcluster.provisioner.model.NodeRole;
import podcluster.provisioner.model.ProvisionRecord;
import podcluster.provisioner.poll.Poller;
import podcluster.util.Sleeper;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Brings a named cluster to a target number of active pods.
 * <p>
 * One call runs these phases in order:
 * <ol>
 * <li>wait until no pod of the cluster is still being created</li>
 * <li>fail if more pods exist than wanted</li>
 * <li>count active pods and find the head</li>
 * <li>launch the shortfall sequentially, head first if there is none</li>
 * <li>wait until the target number of pods is active</li>
 * </ol>
 * Pods are never deleted here. If a launch fails, the pods created so far stay up
 * and the caller must terminate the cluster. Calls for the same cluster must not
 * run concurrently.
 */
public class ClusterReconciler {

    private static final Logger log = LoggerFactory.getLogger(ClusterReconciler.class);

    public static final String PROVIDER_NAME = "primeintellect";

    static final Set<PodStatus> PENDING = EnumSet.of(PodStatus.PROVISIONING, PodStatus.PENDING);
    static final Set<PodStatus> ACTIVE = EnumSet.of(PodStatus.ACTIVE);

    private final PodDirectory directory;
    private final PodCreator creator;
    private final Poller pendingPoller;
    private final Poller convergePoller;

    public ClusterReconciler(PodDirectory directory, PodCreator creator, ProvisionerConfig config, Sleeper sleeper) {
        this.directory = directory;
        this.creator = creator;
        this.pendingPoller = new Poller(sleeper, config.pollInterval(), config.pendingMaxPolls());
        this.convergePoller = new Poller(sleeper, config.pollInterval(), config.convergeMaxPolls());
    }

    /**
     * Reconcile the cluster to {@code targetCount} active pods.
     *
     * @throws CapacityException if more pods exist than wanted, pending pods do not settle
     *                           within the drain budget, or the target is not reached in time
     * @throws podcluster.cloud.client.ApiRequestException if a provider call fails
     */
    public ProvisionRecord reconcile(String clusterName, int targetCount, NodeConfig nodeConfig, String region) {
        if (targetCount < 1) {
            throw new IllegalArgumentException("targetCount must be positive: " + targetCount);
        }
        log.info("Reconciling cluster {} to {} node(s) of {} in {}",
                clusterName, targetCount, nodeConfig.instanceType(), region);

        // 1. drain pods still being created
        Map<String, Pod> inFlight = directory.list(clusterName, PENDING);
        List<String> resumed = new ArrayList<>(inFlight.keySet());
        Poller.Outcome<Map<String, Pod>> drained = pendingPoller.await(
                () -> directory.list(clusterName, PENDING),
                Map::isEmpty,
                pods -> log.info("Waiting for {} instances to be ready: {}", pods.size(), statuses(pods)));
        if (!drained.satisfied()) {
            throw CapacityException.stillPending(clusterName, drained.last().size(), targetCount, drained.attempts());
        }

        // 2. capacity check
        Map<String, Pod> pending = directory.list(clusterName, PENDING);
        if (pending.size() > targetCount) {
            throw CapacityException.overCapacity(clusterName, pending.size(), targetCount);
        }

        // 3. census
        Map<String, Pod> active = directory.list(clusterName, ACTIVE);
        String headId = PodDirectory.findHead(active).orElse(null);

        // 4. shortfall
        int toStart = targetCount - active.size();
        if (toStart < 0) {
            throw CapacityException.overCapacity(clusterName, active.size(), targetCount);
        }
        if (toStart == 0) {
            if (headId == null) {
                headId = active.keySet().iterator().next();
                log.warn("Cluster {} has no pod named as head, using {} as head", clusterName, headId);
            }
            log.info("Cluster {} already has {} nodes, no need to start more.", clusterName, active.size());
            return record(clusterName, region, headId, resumed, List.of());
        }

        // 5. launch
        List<String> created = new ArrayList<>();
        for (int i = 0; i < toStart; i++) {
            NodeRole role = headId == null ? NodeRole.HEAD : NodeRole.WORKER;
            Pod pod = launch(clusterName, role, nodeConfig, region, created);
            created.add(pod.id());
            log.info("Launched instance {} as {}", pod.id(), role);
            if (headId == null) {
                headId = pod.id();
            }
        }

        // 6. converge
        Poller.Outcome<Map<String, Pod>> outcome = convergePoller.await(
                () -> activeAndLog(clusterName, targetCount),
                pods -> pods.size() == targetCount,
                pods -> { });
        if (!outcome.satisfied()) {
            int observed = outcome.last().size();
            log.warn("Cluster {} did not converge: {}/{} active after {} polls",
                    clusterName, observed, targetCount, outcome.attempts());
            throw CapacityException.notConverged(clusterName, observed, targetCount, outcome.attempts());
        }

        return record(clusterName, region, headId, List.of(), created);
    }

    private Pod launch(String clusterName, NodeRole role, NodeConfig nodeConfig, String region, List<String> created) {
        try {
            return creator.launch(role.podName(clusterName), nodeConfig.instanceType(), region, nodeConfig.diskSizeGb());
        } catch (RuntimeException e) {
            log.warn("Launch of {} for cluster {} failed after creating {}: {}",
                    role, clusterName, created, e.getMessage());
            throw e;
        }
    }

    private Map<String, Pod> activeAndLog(String clusterName, int targetCount) {
        Map<String, Pod> pods = directory.list(clusterName, ACTIVE);
        log.info("Waiting for instances to be ready: ({}/{}).", pods.size(), targetCount);
        return pods;
    }

    private static List<PodStatus> statuses(Map<String, Pod> pods) {
        return pods.values().stream().map(Pod::status).toList();
    }

    private static ProvisionRecord record(String clusterName, String region, String headId,
                                          List<String> resumed, List<String> created) {
        return new ProvisionRecord(PROVIDER_NAME, clusterName, region, null, headId, resumed, created);
    }
}
