package podcluster.cloud.model;

/**
 * Where a pod should be placed. Both fields are null when unconstrained.
 */
public record Placement(String country, String dataCenterId) {

    /** Region sentinel meaning "any country, any data center". */
    public static final String ANY_REGION = "PLACEHOLDER";

    private static final String REGION_SEPARATOR = " - ";

    public static Placement unconstrained() {
        return new Placement(null, null);
    }

    /**
     * Decode a catalog region name of the form {@code "Country - DataCenter"}.
     * A region without a data center part yields an empty data center id.
     */
    public static Placement fromRegion(String region) {
        if (region == null || ANY_REGION.equals(region)) {
            return unconstrained();
        }
        String[] parts = region.split(REGION_SEPARATOR, 2);
        return new Placement(parts[0], parts.length > 1 ? parts[1] : "");
    }
}
