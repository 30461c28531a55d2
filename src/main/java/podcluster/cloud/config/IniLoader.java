package podcluster.cloud.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;

/**
 * Loads a cluster description from an INI file.
 * <pre>
 * [CLUSTER]
 * name = my-cluster
 * nodes = 2
 * instance_type = runpod__1xA100_80GB__secure__8
 * region = United States - US-TX-3
 * disk_size = 120
 *
 * [SSH]
 * public_key_path = ~/.ssh/id_ed25519.pub
 * </pre>
 * {@code region} defaults to {@value #DEFAULT_REGION}, {@code disk_size} to the configured default.
 * The [SSH] section is optional; {@code public_key} takes precedence over {@code public_key_path}.
 */
public final class IniLoader {

    public static final String DEFAULT_REGION = "PLACEHOLDER";

    private IniLoader() {
    }

    public static ClusterSpec load(File file, int defaultDiskSizeGb) {
        Ini ini;
        try {
            ini = new Ini(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read cluster file " + file, e);
        }

        Profile.Section cluster = ini.get("CLUSTER");
        if (cluster == null) {
            throw new IllegalArgumentException("Missing [CLUSTER] section in " + file);
        }
        Profile.Section ssh = ini.get("SSH"); // optional

        String keyText = opt(ssh, "public_key", null);
        String keyPath = opt(ssh, "public_key_path", null);
        if (keyText == null && keyPath != null) {
            keyText = readKey(keyPath);
        }

        return new ClusterSpec(
                required(cluster, "name", file),
                parseInt(required(cluster, "nodes", file), "nodes"),
                required(cluster, "instance_type", file),
                opt(cluster, "region", DEFAULT_REGION),
                parseInt(opt(cluster, "disk_size", String.valueOf(defaultDiskSizeGb)), "disk_size"),
                keyText);
    }

    // ===== helpers =====
    private static String required(Profile.Section s, String key, File file) {
        String v = opt(s, key, null);
        if (v == null) {
            throw new IllegalArgumentException("Missing '" + key + "' in [" + s.getName() + "] of " + file);
        }
        return v;
    }

    private static String opt(Profile.Section s, String key, String def) {
        String v = s == null ? null : s.get(key);
        return (v == null || v.isBlank()) ? def : v.trim();
    }

    private static int parseInt(String value, String key) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + key + "' is not a number: " + value, e);
        }
    }

    private static String readKey(String path) {
        String expanded = path.startsWith("~") ? System.getProperty("user.home") + path.substring(1) : path;
        try {
            return Files.readString(new File(expanded).toPath()).trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read public key " + expanded, e);
        }
    }
}
