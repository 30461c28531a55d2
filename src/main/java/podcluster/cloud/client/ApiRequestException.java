package podcluster.cloud.client;

/**
 * A provider API call that did not succeed.
 * <p>
 * Raised for every non-2xx response (including a rate limit that outlasted the
 * retry budget) and for transport failures, where {@link #statusCode()} is -1.
 */
public class ApiRequestException extends RuntimeException {

    public static final int NO_STATUS = -1;

    private final String method;
    private final String url;
    private final int statusCode;
    private final String reason;

    public ApiRequestException(String method, String url, int statusCode, String reason) {
        super("API request failed: " + method + " " + url + ": " + statusCode + " " + reason);
        this.method = method;
        this.url = url;
        this.statusCode = statusCode;
        this.reason = reason;
    }

    public ApiRequestException(String method, String url, String reason, Throwable cause) {
        super("API request failed: " + method + " " + url + ": " + reason, cause);
        this.method = method;
        this.url = url;
        this.statusCode = NO_STATUS;
        this.reason = reason;
    }

    public String method() {
        return method;
    }

    public String url() {
        return url;
    }

    public int statusCode() {
        return statusCode;
    }

    public String reason() {
        return reason;
    }

    public boolean isForbidden() {
        return statusCode == 403;
    }
}
