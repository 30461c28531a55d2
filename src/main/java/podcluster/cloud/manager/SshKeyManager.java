package podcluster.cloud.manager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import podcluster.cloud.client.PodApi;
import podcluster.cloud.model.SshKey;

import java.util.Arrays;
import java.util.UUID;

/**
 * Makes sure a local public key is registered with the provider account.
 */
public class SshKeyManager {

    private static final Logger log = LoggerFactory.getLogger(SshKeyManager.class);

    static final String KEY_NAME_PREFIX = "skypilot-";

    private final PodApi api;

    public SshKeyManager(PodApi api) {
        this.api = api;
    }

    /**
     * Return the registered key matching {@code publicKey}, registering it first if needed.
     * Keys match when their algorithm and key material (the first two tokens) are equal;
     * the trailing comment is ignored.
     */
    public SshKey getOrAdd(String publicKey) {
        if (publicKey == null || publicKey.isBlank()) {
            throw new IllegalArgumentException("SSH public key is empty");
        }
        String[] wanted = identity(publicKey);
        for (SshKey key : api.listSshKeys()) {
            if (key.publicKey() != null && Arrays.equals(identity(key.publicKey()), wanted)) {
                log.debug("SSH key already registered as {}", key.name());
                return new SshKey(key.name(), publicKey);
            }
        }

        SshKey added = new SshKey(KEY_NAME_PREFIX + keySuffix(), publicKey);
        api.addSshKey(added);
        log.info("Registered SSH key {}", added.name());
        return added;
    }

    static String[] identity(String publicKey) {
        String[] tokens = publicKey.strip().split("\\s+");
        return Arrays.copyOf(tokens, Math.min(2, tokens.length));
    }

    static String keySuffix() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
