package podcluster.cloud.auth;

/**
 * Provider API credentials. {@link #toString()} never reveals the key.
 */
public record Credentials(String apiKey) {

    public Credentials {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("API key is missing or empty");
        }
    }

    @Override
    public String toString() {
        return "Credentials{apiKey=***}";
    }
}
