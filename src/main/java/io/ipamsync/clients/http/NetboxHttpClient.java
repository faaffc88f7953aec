package io.ipamsync.clients.http;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.ipamsync.clients.ApiException;
import io.ipamsync.clients.NetboxClient;
import io.ipamsync.models.NetboxPrefix;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.ipamsync.config.Constants.NETBOX_PREFIXES_PATH;

/**
 * Netbox IPAM handle for one integrator.
 */
@Slf4j
public class NetboxHttpClient extends JsonHttpClient implements NetboxClient {

    private static final TypeReference<List<NetboxPrefix>> PREFIX_LIST = new TypeReference<>() {};
    private static final String API_SUFFIX = "/api";

    public NetboxHttpClient(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl,
                            Map<String, String> headers, Duration requestTimeout) {
        super(httpClient, objectMapper, stripApiSuffix(baseUrl), headers, requestTimeout);
    }

    @Override
    public List<NetboxPrefix> getPrefixes(String query) throws ApiException {
        String queryString = extractQueryString(query);
        URI next = URI.create(getBaseUrl() + NETBOX_PREFIXES_PATH + (queryString.isEmpty() ? "" : "?" + queryString));

        List<NetboxPrefix> prefixes = new ArrayList<>();
        Set<URI> visited = new HashSet<>();
        while (next != null && visited.add(next)) {
            JsonNode page = get(next);
            prefixes.addAll(readResults(page, PREFIX_LIST));
            String nextLink = page.path("next").asText(null);
            next = nextLink != null && !nextLink.isBlank() ? URI.create(nextLink) : null;
        }

        log.debug("Fetched {} prefixes from {} in {} page(s)", prefixes.size(), getHostname(), visited.size());
        return prefixes;
    }

    /**
     * Integrator queries are stored as full IPAM URLs; only the query string is kept.
     */
    static String extractQueryString(String query) {
        if (query == null) {
            return "";
        }
        int index = query.indexOf('?');
        return index >= 0 ? query.substring(index + 1) : "";
    }

    private static String stripApiSuffix(String url) {
        if (url == null) {
            return null;
        }
        String stripped = stripTrailingSlash(url.trim());
        return stripped.endsWith(API_SUFFIX) ? stripped.substring(0, stripped.length() - API_SUFFIX.length()) : stripped;
    }
}
