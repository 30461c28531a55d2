package podcluster.cloud.model;

import java.util.Objects;

/**
 * Catalog instance type decoded from {@code "{provider}__{gpuSpec}__..."}.
 * <p>
 * {@code gpuSpec} is either {@code CPU_NODE} or {@code "{count}x{gpuType}"}.
 * CPU nodes are launched as one unit of gpu type {@code CPU_NODE}.
 */
public record InstanceType(String name, String provider, String gpuType, int gpuCount) {

    public static final String CPU_NODE = "CPU_NODE";
    private static final String SEPARATOR = "__";

    public InstanceType {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(provider, "provider is required");
        Objects.requireNonNull(gpuType, "gpuType is required");
        if (gpuCount < 1) {
            throw new IllegalArgumentException("gpuCount must be positive: " + gpuCount);
        }
    }

    /**
     * Parse a catalog instance type name.
     *
     * @throws IllegalArgumentException if the name does not follow the catalog format
     */
    public static InstanceType parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Instance type is empty");
        }
        String[] parts = name.split(SEPARATOR, 4);
        if (parts.length < 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new IllegalArgumentException("Malformed instance type: " + name);
        }
        String provider = parts[0];
        String gpuSpec = parts[1];

        if (gpuSpec.contains(CPU_NODE)) {
            return new InstanceType(name, provider, CPU_NODE, 1);
        }

        int x = gpuSpec.indexOf('x');
        if (x <= 0 || x == gpuSpec.length() - 1) {
            throw new IllegalArgumentException("Malformed gpu spec '" + gpuSpec + "' in " + name);
        }
        try {
            int count = Integer.parseInt(gpuSpec.substring(0, x));
            return new InstanceType(name, provider, gpuSpec.substring(x + 1), count);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed gpu count '" + gpuSpec + "' in " + name, e);
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
