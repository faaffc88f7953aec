package io.ipamsync.clients.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.ipamsync.clients.ApiException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Base for the JSON REST drivers. Sends requests with fixed headers and a per-request
 * timeout, maps non-2xx responses and transport errors to {@link ApiException}.
 * <p>
 * {@link HttpClient} is thread-safe, so one instance can serve concurrent callers.
 */
@Slf4j
public abstract class JsonHttpClient implements AutoCloseable {

    private static final int MAX_ERROR_BODY_LENGTH = 200;

    protected final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final String baseUrl;
    private final String hostname;
    private final Map<String, String> headers;
    private final Duration requestTimeout;
    private volatile boolean closed = false;

    protected JsonHttpClient(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl,
                             Map<String, String> headers, Duration requestTimeout) {
        if (baseUrl == null || baseUrl.trim().isEmpty()) {
            throw new IllegalArgumentException("Endpoint URL cannot be null or empty");
        }
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = stripTrailingSlash(baseUrl.trim());
        this.hostname = URI.create(this.baseUrl).getHost();
        if (this.hostname == null) {
            throw new IllegalArgumentException("Endpoint URL has no host: " + baseUrl);
        }
        this.headers = Map.copyOf(headers);
        this.requestTimeout = requestTimeout;
    }

    public String getHostname() {
        return hostname;
    }

    protected String getBaseUrl() {
        return baseUrl;
    }

    protected JsonNode get(String path) throws ApiException {
        return execute("GET", URI.create(baseUrl + path), null);
    }

    protected JsonNode get(URI uri) throws ApiException {
        return execute("GET", uri, null);
    }

    protected JsonNode send(String method, String path, Object body) throws ApiException {
        return execute(method, URI.create(baseUrl + path), body);
    }

    /**
     * Read the {@code results} array shared by the NAM, Netbox and FortiOS list responses.
     * A missing array reads as an empty list.
     */
    protected <T> List<T> readResults(JsonNode response, TypeReference<List<T>> type) throws ApiException {
        JsonNode results = response.path("results");
        if (!results.isArray()) {
            return new ArrayList<>();
        }
        try {
            return objectMapper.convertValue(results, type);
        } catch (IllegalArgumentException e) {
            throw new ApiException("Unexpected results format from " + hostname + ": " + e.getMessage(), e);
        }
    }

    private JsonNode execute(String method, URI uri, Object body) throws ApiException {
        if (closed) {
            throw new IllegalStateException("Client for " + hostname + " is closed");
        }

        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(requestTimeout);
        headers.forEach(requestBuilder::header);

        if (body != null) {
            requestBuilder.method(method, HttpRequest.BodyPublishers.ofString(toJson(body)));
        } else {
            requestBuilder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        log.debug("{} {}", method, uri);
        HttpResponse<String> response;
        try {
            response = httpClient.send(requestBuilder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ApiException(String.format("%s %s timed out after %dms", method, uri.getPath(),
                requestTimeout.toMillis()), e);
        } catch (IOException e) {
            throw new ApiException(String.format("%s %s failed: %s", method, uri.getPath(), e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiException(String.format("%s %s interrupted", method, uri.getPath()), e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new ApiException(String.format("%s %s returned HTTP %d: %s", method, uri.getPath(), status,
                abbreviate(response.body())), status);
        }
        return parse(response.body(), status);
    }

    private JsonNode parse(String responseBody, int status) throws ApiException {
        if (responseBody == null || responseBody.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new ApiException("Invalid JSON in response from " + hostname + ": " + e.getOriginalMessage(), status);
        }
    }

    private String toJson(Object body) throws ApiException {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ApiException("Failed to serialize request body for " + hostname, e);
        }
    }

    /**
     * Drop the handle. Further calls fail with {@link IllegalStateException}.
     */
    @Override
    public void close() {
        if (!closed) {
            closed = true;
            log.debug("Closed client for {}", hostname);
        }
    }

    protected static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > MAX_ERROR_BODY_LENGTH ? text.substring(0, MAX_ERROR_BODY_LENGTH) + "..." : text;
    }
}
