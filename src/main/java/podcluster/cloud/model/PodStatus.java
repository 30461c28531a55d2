package podcluster.cloud.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Pod status as reported by the provider.
 */
public enum PodStatus {
    /** Creation accepted, resources not allocated yet */
    PROVISIONING,
    /** Resources allocated, pod still booting */
    PENDING,
    /** Pod is running (SSH may still be unassigned) */
    ACTIVE,
    STOPPED,
    ERROR,
    DELETING,
    TERMINATED,
    /** A status this client does not know yet */
    UNKNOWN;

    @JsonCreator
    public static PodStatus fromJson(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
