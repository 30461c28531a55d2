package podcluster.cloud.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import podcluster.cloud.model.CreatePodRequest;
import podcluster.cloud.model.Pod;
import podcluster.cloud.model.SshKey;

import java.io.IOException;
import java.util.List;

/**
 * {@link PodApi} over HTTP. List endpoints wrap their results in a {@code data}
 * envelope; single-object endpoints may or may not, both shapes are accepted.
 */
public class PodApiClient implements PodApi {

    private static final TypeReference<List<Pod>> POD_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<SshKey>> KEY_LIST = new TypeReference<>() {
    };

    private final RestRequester requester;
    private final ObjectMapper mapper;

    public PodApiClient(RestRequester requester, ObjectMapper mapper) {
        this.requester = requester;
        this.mapper = mapper;
    }

    @Override
    public List<Pod> listPods() {
        JsonNode response = requester.request(HttpVerb.GET, "/pods");
        return convert(data(response), POD_LIST, "/pods");
    }

    @Override
    public Pod getPod(String podId) {
        String path = "/pods/" + podId;
        JsonNode response = requester.request(HttpVerb.GET, path);
        JsonNode node = response.has("data") && response.get("data").isObject() ? response.get("data") : response;
        return convert(node, Pod.class, path);
    }

    @Override
    public Pod createPod(CreatePodRequest request) {
        JsonNode response = requester.request(HttpVerb.POST, "/pods", request);
        JsonNode node = response.has("data") && response.get("data").isObject() ? response.get("data") : response;
        return convert(node, Pod.class, "/pods");
    }

    @Override
    public void deletePod(String podId) {
        requester.request(HttpVerb.DELETE, "/pods/" + podId);
    }

    @Override
    public List<SshKey> listSshKeys() {
        JsonNode response = requester.request(HttpVerb.GET, "/ssh_keys");
        return convert(data(response), KEY_LIST, "/ssh_keys");
    }

    @Override
    public void addSshKey(SshKey key) {
        requester.request(HttpVerb.POST, "/ssh_keys", key);
    }

    private static JsonNode data(JsonNode response) {
        JsonNode data = response.get("data");
        if (data == null || !data.isArray()) {
            throw new IllegalStateException("Expected a 'data' array in response: " + response);
        }
        return data;
    }

    private <T> T convert(JsonNode node, Class<T> type, String path) {
        try {
            return mapper.treeToValue(node, type);
        } catch (IOException e) {
            throw new IllegalStateException("Unexpected response shape from " + path + ": " + e.getMessage(), e);
        }
    }

    private <T> T convert(JsonNode node, TypeReference<T> type, String path) {
        try {
            return mapper.readValue(mapper.treeAsTokens(node), type);
        } catch (IOException e) {
            throw new IllegalStateException("Unexpected response shape from " + path + ": " + e.getMessage(), e);
        }
    }
}
