package podcluster.cloud.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads the API key.
 * <p>
 * The {@value #API_KEY_ENV} environment variable wins; otherwise the key is read
 * from the {@code api_key} field of the credentials JSON file
 * (by default {@code ~/.prime/config.json}).
 */
public final class CredentialsLoader {

    private static final Logger log = LoggerFactory.getLogger(CredentialsLoader.class);

    public static final String API_KEY_ENV = "PRIME_API_KEY";
    public static final Path DEFAULT_PATH = Path.of(System.getProperty("user.home"), ".prime", "config.json");

    private final ObjectMapper mapper;
    private final Map<String, String> env;

    public CredentialsLoader(ObjectMapper mapper) {
        this(mapper, System.getenv());
    }

    CredentialsLoader(ObjectMapper mapper, Map<String, String> env) {
        this.mapper = mapper;
        this.env = env;
    }

    public Credentials load(Path file) {
        String fromEnv = env.get(API_KEY_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) {
            log.debug("Using API key from {}", API_KEY_ENV);
            return new Credentials(fromEnv.trim());
        }

        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Credentials not found: " + file + " does not exist");
        }
        try {
            JsonNode root = mapper.readTree(file.toFile());
            JsonNode key = root.path("api_key");
            if (!key.isTextual() || key.asText().isBlank()) {
                throw new IllegalArgumentException("API key is missing or empty in " + file);
            }
            log.debug("Loaded API key from {}", file);
            return new Credentials(key.asText().trim());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read credentials from " + file, e);
        }
    }
}
