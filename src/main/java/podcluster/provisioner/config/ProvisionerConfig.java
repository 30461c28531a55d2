package podcluster.provisioner.config;

import podcluster.cloud.auth.CredentialsLoader;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for the provisioner.
 * All settings have defaults matching the provider's observed behaviour.
 */
public final class ProvisionerConfig {

    // API settings
    private String apiEndpoint = "https://api.primeintellect.ai";
    private Path credentialsPath = CredentialsLoader.DEFAULT_PATH;
    private Duration requestTimeout = Duration.ofSeconds(60);

    // Rate limit backoff
    private int requestMaxAttempts = 6;
    private Duration initialBackoff = Duration.ofSeconds(10);
    private int maxBackoffFactor = 10;

    // Reconciliation polling
    private Duration pollInterval = Duration.ofSeconds(5);
    /** 0 means wait for pending pods without limit */
    private int pendingMaxPolls = 0;
    private int convergeMaxPolls = 192;

    // SSH readiness
    private int sshMaxRetries = 6;
    private Duration sshRetryDelay = Duration.ofSeconds(10);

    // Launch defaults
    private int defaultDiskSizeGb = 120;

    private ProvisionerConfig() {
    }

    public static ProvisionerConfig defaults() {
        return new ProvisionerConfig();
    }

    public static ProvisionerConfig fromEnv() {
        ProvisionerConfig config = new ProvisionerConfig();

        String endpoint = System.getenv("PODCLUSTER_API_ENDPOINT");
        if (endpoint != null && !endpoint.isBlank()) {
            config.apiEndpoint = endpoint.trim();
        }

        String credentials = System.getenv("PODCLUSTER_CREDENTIALS_PATH");
        if (credentials != null && !credentials.isBlank()) {
            config.credentialsPath = Path.of(credentials.trim());
        }

        String poll = System.getenv("PODCLUSTER_POLL_INTERVAL_SECONDS");
        if (poll != null && !poll.isBlank()) {
            config.pollInterval = Duration.ofSeconds(Long.parseLong(poll.trim()));
        }

        return config;
    }

    // Getters
    /** Base URL of the versioned REST API. */
    public String apiBaseUrl() {
        String base = apiEndpoint.endsWith("/") ? apiEndpoint.substring(0, apiEndpoint.length() - 1) : apiEndpoint;
        return base + "/api/v1";
    }

    public Path credentialsPath() {
        return credentialsPath;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    public int requestMaxAttempts() {
        return requestMaxAttempts;
    }

    public Duration initialBackoff() {
        return initialBackoff;
    }

    public int maxBackoffFactor() {
        return maxBackoffFactor;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public int pendingMaxPolls() {
        return pendingMaxPolls;
    }

    public int convergeMaxPolls() {
        return convergeMaxPolls;
    }

    public int sshMaxRetries() {
        return sshMaxRetries;
    }

    public Duration sshRetryDelay() {
        return sshRetryDelay;
    }

    public int defaultDiskSizeGb() {
        return defaultDiskSizeGb;
    }

    // Fluent setters for testing/customization
    public ProvisionerConfig withApiEndpoint(String endpoint) {
        this.apiEndpoint = endpoint;
        return this;
    }

    public ProvisionerConfig withPendingMaxPolls(int polls) {
        this.pendingMaxPolls = polls;
        return this;
    }

    public ProvisionerConfig withConvergeMaxPolls(int polls) {
        this.convergeMaxPolls = polls;
        return this;
    }

    public ProvisionerConfig withDefaultDiskSizeGb(int gb) {
        this.defaultDiskSizeGb = gb;
        return this;
    }

    @Override
    public String toString() {
        return "ProvisionerConfig{" +
                "apiEndpoint='" + apiEndpoint + '\'' +
                ", pollInterval=" + pollInterval +
                ", convergeMaxPolls=" + convergeMaxPolls +
                ", requestMaxAttempts=" + requestMaxAttempts +
                ", sshMaxRetries=" + sshMaxRetries +
                '}';
    }
}
