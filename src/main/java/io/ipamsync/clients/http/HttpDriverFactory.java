package io.ipamsync.clients.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.ipamsync.clients.DriverFactory;
import io.ipamsync.clients.FortiOSClient;
import io.ipamsync.clients.NamClient;
import io.ipamsync.clients.NetboxClient;
import io.ipamsync.clients.NsxClient;
import io.ipamsync.config.SyncConfig;
import io.ipamsync.models.ApiEndpoint;
import lombok.extern.slf4j.Slf4j;

import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;

/**
 * Builds JDK HttpClient backed drivers with the sync's User-Agent, credentials and request timeout.
 */
@Slf4j
public class HttpDriverFactory implements DriverFactory {

    private static final String CONTENT_TYPE_JSON = "application/json";

    private final ObjectMapper objectMapper;
    private final String userAgent;
    private final Duration requestTimeout;

    public HttpDriverFactory(SyncConfig config, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.userAgent = config.getUserAgent();
        this.requestTimeout = Duration.ofMillis(config.getRequestTimeoutMs());
    }

    /**
     * Directory client for the configured NAM instance.
     */
    public NamClient openDirectory(String url, String token) {
        log.info("Initializing NAM directory client for {}", url);
        return new NamHttpClient(newHttpClient(), objectMapper, url, headers("Bearer " + token), requestTimeout);
    }

    @Override
    public NetboxClient openIpam(ApiEndpoint endpoint) {
        requireEndpoint(endpoint);
        return new NetboxHttpClient(newHttpClient(), objectMapper, endpoint.getUrl(),
            headers("Token " + endpoint.getKey()), requestTimeout);
    }

    @Override
    public FortiOSClient openFirewall(ApiEndpoint endpoint) {
        requireEndpoint(endpoint);
        return new FortiOSHttpClient(newHttpClient(), objectMapper, endpoint.getUrl(),
            headers("Bearer " + endpoint.getKey()), requestTimeout);
    }

    @Override
    public NsxClient openSecurityPlatform(ApiEndpoint endpoint) {
        requireEndpoint(endpoint);
        String credentials = endpoint.getUser() + ":" + endpoint.getPass();
        String encoded = Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
        return new NsxHttpClient(newHttpClient(), objectMapper, endpoint.getUrl(),
            headers("Basic " + encoded), requestTimeout);
    }

    private HttpClient newHttpClient() {
        return HttpClient.newBuilder()
            .connectTimeout(requestTimeout)
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();
    }

    private Map<String, String> headers(String authorization) {
        return Map.of(
            "User-Agent", userAgent,
            "Content-Type", CONTENT_TYPE_JSON,
            "Accept", CONTENT_TYPE_JSON,
            "Authorization", authorization
        );
    }

    private static void requireEndpoint(ApiEndpoint endpoint) {
        if (endpoint == null) {
            throw new IllegalArgumentException("Endpoint cannot be null");
        }
    }
}
