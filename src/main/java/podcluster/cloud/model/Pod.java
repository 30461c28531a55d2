package podcluster.cloud.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single rented compute pod as returned by GET /pods.
 * Cluster membership and role are encoded in {@code name} only.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Pod(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("status") PodStatus status,
        @JsonProperty("ip") String ip,
        @JsonProperty("sshConnection") String sshConnection,
        @JsonProperty("providerType") String providerType) {

    public static final String HEAD_SUFFIX = "-head";
    public static final String WORKER_SUFFIX = "-worker";

    public boolean isHead() {
        return name != null && name.endsWith(HEAD_SUFFIX);
    }

    public boolean hasSshConnection() {
        return sshConnection != null && !sshConnection.isBlank();
    }
}
