package podcluster.provisioner.service;

import podcluster.cloud.client.ApiRequestException;
import podcluster.cloud.client.PodApi;

import java.util.Optional;

/**
 * Checks that the configured credentials can reach the pod API.
 */
public class ProviderCheck {

    static final String FORBIDDEN_HINT = "Please check that your API key has the correct permissions, "
            + "generate a new one at https://app.primeintellect.ai/dashboard/tokens, "
            + "or run 'prime login' to configure a new API key.";

    private final PodApi api;

    public ProviderCheck(PodApi api) {
        this.api = api;
    }

    /**
     * Cheapest authenticated call: list pods.
     *
     * @return empty when access works, otherwise a message telling the user what to fix
     */
    public Optional<String> check() {
        try {
            api.listPods();
            return Optional.empty();
        } catch (ApiRequestException e) {
            if (e.isForbidden()) {
                return Optional.of(FORBIDDEN_HINT);
            }
            return Optional.of("Cannot reach the pod API: " + e.getMessage());
        }
    }
}
