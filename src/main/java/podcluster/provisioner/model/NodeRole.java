package podcluster.provisioner.model;

import podcluster.cloud.manager.PodDirectory;

/**
 * Role of a node, encoded only in the pod name.
 */
public enum NodeRole {
    HEAD,
    WORKER;

    public String podName(String clusterName) {
        return this == HEAD ? PodDirectory.headName(clusterName) : PodDirectory.workerName(clusterName);
    }
}
