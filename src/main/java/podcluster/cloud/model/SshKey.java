package podcluster.cloud.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * SSH public key registered with the provider account.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SshKey(
        @JsonProperty("name") String name,
        @JsonProperty("publicKey") String publicKey) {
}
