package io.ipamsync.clients.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.net.UrlEscapers;
import io.ipamsync.clients.ApiException;
import io.ipamsync.clients.NsxClient;
import io.ipamsync.models.SecurityGroup;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static io.ipamsync.config.Constants.NSX_GLOBAL_GROUPS_PATH;
import static io.ipamsync.config.Constants.NSX_LOCAL_GROUPS_PATH;

/**
 * VMware NSX policy API handle. Groups are addressed by display name; a global manager
 * uses the global-infra tree instead of infra.
 */
public class NsxHttpClient extends JsonHttpClient implements NsxClient {

    private static final String LEGACY_API_PATH = "/api/v1";

    public NsxHttpClient(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl,
                         Map<String, String> headers, Duration requestTimeout) {
        super(httpClient, objectMapper, baseUrl != null ? baseUrl.replace(LEGACY_API_PATH, "") : null,
            headers, requestTimeout);
    }

    @Override
    public Optional<SecurityGroup> getGroup(String name, boolean globalManager) throws ApiException {
        JsonNode response;
        try {
            response = get(groupPath(name, globalManager));
        } catch (ApiException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }
        if (response.isMissingNode() || response.isNull()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.treeToValue(response, SecurityGroup.class));
        } catch (JsonProcessingException e) {
            throw new ApiException("Unexpected group format from " + getHostname() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void patchGroup(String name, SecurityGroup group, boolean globalManager) throws ApiException {
        send("PATCH", groupPath(name, globalManager), group);
    }

    private static String groupPath(String name, boolean globalManager) {
        String base = globalManager ? NSX_GLOBAL_GROUPS_PATH : NSX_LOCAL_GROUPS_PATH;
        return base + UrlEscapers.urlPathSegmentEscaper().escape(name);
    }
}
