package podcluster.cloud.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Issues authenticated JSON requests against the provider API.
 * <p>
 * A 429 response is retried with exponential backoff until the attempt budget is
 * spent; a 429 on the last attempt is reported like any other failure. Every other
 * non-2xx status fails immediately, so authentication and validation errors are
 * never masked as transient.
 */
public class RestRequester {

    private static final Logger log = LoggerFactory.getLogger(RestRequester.class);

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final String apiKey;
    private final Duration requestTimeout;
    private final Retry retry;

    /**
     * @param requestTimeout per-request timeout
     * @param retryConfig    rate limit policy, see {@link RateLimitRetry}
     */
    public RestRequester(HttpClient http, ObjectMapper mapper, String baseUrl, String apiKey,
                         Duration requestTimeout, RetryConfig retryConfig) {
        this.http = http;
        this.mapper = mapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.requestTimeout = requestTimeout;
        this.retry = Retry.of("provider-rate-limit", retryConfig);
        this.retry.getEventPublisher().onRetry(event -> log.warn("Rate limited, retrying in {} ms (retry {}/{})",
                event.getWaitInterval().toMillis(), event.getNumberOfRetryAttempts(),
                retryConfig.getMaxAttempts() - 1));
    }

    public JsonNode request(HttpVerb verb, String path) {
        return request(verb, path, null);
    }

    /**
     * Send a request and return the parsed response body.
     *
     * @param verb HTTP method
     * @param path path relative to the API base, starting with '/'
     * @param body query parameters for GET (a {@code Map}), JSON body for POST/PUT/PATCH, ignored for DELETE
     * @return parsed body, or an empty object node when the body is empty
     * @throws ApiRequestException on a non-2xx status, an exhausted rate limit budget or a transport error
     */
    public JsonNode request(HttpVerb verb, String path, Object body) {
        String url = urlFor(verb, path, body);
        HttpRequest request = buildRequest(verb, url, body);

        HttpResponse<String> response = retry.executeSupplier(() -> send(verb, url, request));
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return parse(verb, url, response.body());
        }
        log.debug("Failed response body for {} {}: {}", verb, url, response.body());
        throw new ApiRequestException(verb.name(), url, status, reasonPhrase(status));
    }

    /** Retry instance shared by all requests of this client, for event subscribers. */
    Retry retry() {
        return retry;
    }

    private String urlFor(HttpVerb verb, String path, Object body) {
        if (verb == HttpVerb.GET && body instanceof Map<?, ?> params && !params.isEmpty()) {
            return baseUrl + path + "?" + queryString(params);
        }
        return baseUrl + path;
    }

    private HttpRequest buildRequest(HttpVerb verb, String url, Object body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + apiKey)
                .header("Content-Type", "application/json");

        if (verb.hasJsonBody()) {
            builder.method(verb.name(), HttpRequest.BodyPublishers.ofString(toJson(verb, url, body)));
        } else {
            builder.method(verb.name(), HttpRequest.BodyPublishers.noBody());
        }
        return builder.build();
    }

    private HttpResponse<String> send(HttpVerb verb, String url, HttpRequest request) {
        try {
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            log.debug("{} {} -> {}", verb, url, response.statusCode());
            return response;
        } catch (IOException e) {
            throw new ApiRequestException(verb.name(), url, e.toString(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiRequestException(verb.name(), url, "interrupted", e);
        }
    }

    private String toJson(HttpVerb verb, String url, Object body) {
        if (body == null) {
            return "{}";
        }
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ApiRequestException(verb.name(), url, "cannot serialize request body", e);
        }
    }

    private JsonNode parse(HttpVerb verb, String url, String body) {
        if (body == null || body.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ApiRequestException(verb.name(), url, "malformed JSON response", e);
        }
    }

    private static String queryString(Map<?, ?> params) {
        StringJoiner joiner = new StringJoiner("&");
        params.forEach((k, v) -> {
            if (v != null) {
                joiner.add(URLEncoder.encode(String.valueOf(k), StandardCharsets.UTF_8)
                        + "=" + URLEncoder.encode(String.valueOf(v), StandardCharsets.UTF_8));
            }
        });
        return joiner.toString();
    }

    static String reasonPhrase(int status) {
        return switch (status) {
            case 400 -> "Bad Request";
            case 401 -> "Unauthorized";
            case 402 -> "Payment Required";
            case 403 -> "Forbidden";
            case 404 -> "Not Found";
            case 409 -> "Conflict";
            case 422 -> "Unprocessable Entity";
            case 429 -> "Too Many Requests";
            case 500 -> "Internal Server Error";
            case 502 -> "Bad Gateway";
            case 503 -> "Service Unavailable";
            case 504 -> "Gateway Timeout";
            default -> "HTTP " + status;
        };
    }
}
