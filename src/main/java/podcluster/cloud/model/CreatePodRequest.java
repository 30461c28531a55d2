package podcluster.cloud.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of POST /pods.
 */
public record CreatePodRequest(
        @JsonProperty("pod") PodSpec pod,
        @JsonProperty("provider") ProviderSpec provider) {

    public record PodSpec(
            @JsonProperty("name") String name,
            @JsonProperty("cloudId") String cloudId,
            @JsonProperty("socket") String socket,
            @JsonProperty("gpuType") String gpuType,
            @JsonProperty("gpuCount") int gpuCount,
            @JsonProperty("diskSize") int diskSize,
            @JsonProperty("country") String country,
            @JsonProperty("dataCenterId") String dataCenterId) {
    }

    public record ProviderSpec(@JsonProperty("type") String type) {
    }
}
