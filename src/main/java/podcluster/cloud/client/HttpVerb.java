package podcluster.cloud.client;

/**
 * HTTP methods the provider API is called with.
 */
public enum HttpVerb {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE;

    /** Whether the request payload travels as a JSON body (otherwise as query parameters or not at all). */
    boolean hasJsonBody() {
        return this == POST || this == PUT || this == PATCH;
    }
}
