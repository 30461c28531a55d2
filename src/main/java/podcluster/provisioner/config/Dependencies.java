package podcluster.provisioner.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import podcluster.cloud.auth.Credentials;
import podcluster.cloud.auth.CredentialsLoader;
import podcluster.cloud.catalog.InstanceCatalog;
import podcluster.cloud.client.PodApi;
import podcluster.cloud.client.PodApiClient;
import podcluster.cloud.client.RateLimitRetry;
import podcluster.cloud.client.RestRequester;
import podcluster.cloud.creator.PodCreator;
import podcluster.cloud.manager.PodDirectory;
import podcluster.cloud.manager.SshKeyManager;
import podcluster.provisioner.service.ClusterInfoAssembler;
import podcluster.provisioner.service.ClusterLifecycleService;
import podcluster.provisioner.service.ClusterReconciler;
import podcluster.provisioner.service.ProviderCheck;
import podcluster.util.Sleeper;

import java.net.http.HttpClient;

/**
 * Manual dependency injection container.
 * Creates and wires the API client, catalog and provisioning services.
 *
 * <pre>
 * Dependencies deps = Dependencies.create(ProvisionerConfig.fromEnv());
 * ProvisionRecord rec = deps.reconciler().reconcile("demo", 2, nodeConfig, "PLACEHOLDER");
 * ClusterInfo info = deps.assembler().assemble("demo");
 * </pre>
 */
public final class Dependencies {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final ProvisionerConfig config;
    private final SshKeyManager sshKeyManager;
    private final ClusterReconciler reconciler;
    private final ClusterInfoAssembler assembler;
    private final ClusterLifecycleService lifecycle;
    private final ProviderCheck providerCheck;

    private Dependencies(ProvisionerConfig config, PodApi api, InstanceCatalog catalog, Sleeper sleeper) {
        this.config = config;

        PodDirectory directory = new PodDirectory(api);
        PodCreator creator = new PodCreator(api, catalog);
        this.sshKeyManager = new SshKeyManager(api);

        this.reconciler = new ClusterReconciler(directory, creator, config, sleeper);
        this.assembler = new ClusterInfoAssembler(directory, config, sleeper);
        this.lifecycle = new ClusterLifecycleService(directory, api);
        this.providerCheck = new ProviderCheck(api);

        log.info("Dependencies initialized with config: {}, catalog of {} instance types", config, catalog.size());
    }

    /**
     * Wire everything against the real provider API.
     * Loads credentials and the bundled catalog once.
     */
    public static Dependencies create(ProvisionerConfig config) {
        ObjectMapper mapper = objectMapper();
        Credentials credentials = new CredentialsLoader(mapper).load(config.credentialsPath());

        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(config.requestTimeout())
                .build();
        RestRequester requester = new RestRequester(http, mapper, config.apiBaseUrl(), credentials.apiKey(),
                config.requestTimeout(),
                RateLimitRetry.config(config.requestMaxAttempts(), config.initialBackoff(), config.maxBackoffFactor()));

        return new Dependencies(config, new PodApiClient(requester, mapper), InstanceCatalog.fromClasspath(), Sleeper.SYSTEM);
    }

    /**
     * Wire the services around an existing API (fakes in tests, alternative transports).
     */
    public static Dependencies create(ProvisionerConfig config, PodApi api, InstanceCatalog catalog, Sleeper sleeper) {
        return new Dependencies(config, api, catalog, sleeper);
    }

    public static ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    // Getters
    public ProvisionerConfig config() {
        return config;
    }

    public SshKeyManager sshKeyManager() {
        return sshKeyManager;
    }

    public ClusterReconciler reconciler() {
        return reconciler;
    }

    public ClusterInfoAssembler assembler() {
        return assembler;
    }

    public ClusterLifecycleService lifecycle() {
        return lifecycle;
    }

    public ProviderCheck providerCheck() {
        return providerCheck;
    }
}
