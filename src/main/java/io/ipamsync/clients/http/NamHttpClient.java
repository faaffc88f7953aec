package io.ipamsync.clients.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.net.UrlEscapers;
import io.ipamsync.clients.ApiException;
import io.ipamsync.clients.NamClient;
import io.ipamsync.enums.SyncPriority;
import io.ipamsync.models.Integrator;
import lombok.extern.slf4j.Slf4j;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static io.ipamsync.config.Constants.NAM_INTEGRATORS_PATH;

/**
 * NAM directory client. Lives for the whole process, unlike the per-integrator handles.
 */
@Slf4j
public class NamHttpClient extends JsonHttpClient implements NamClient {

    private static final TypeReference<List<Integrator>> INTEGRATOR_LIST = new TypeReference<>() {};

    public NamHttpClient(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl,
                         Map<String, String> headers, Duration requestTimeout) {
        super(httpClient, objectMapper, baseUrl, headers, requestTimeout);
    }

    @Override
    public List<Integrator> getIntegrators(SyncPriority priority) throws ApiException {
        JsonNode response = get(NAM_INTEGRATORS_PATH + "?expand=1&sync_priority=" + priority.getValue());
        List<Integrator> integrators = readResults(response, INTEGRATOR_LIST);
        log.debug("Fetched {} integrators with priority {} from {}", integrators.size(), priority.getValue(), getHostname());
        return integrators;
    }

    @Override
    public Integrator getIntegrator(String id) throws ApiException {
        String path = NAM_INTEGRATORS_PATH + "/" + UrlEscapers.urlPathSegmentEscaper().escape(id) + "?expand=1";
        JsonNode response = get(path);
        if (response.isMissingNode() || response.isNull()) {
            throw new ApiException("Integrator " + id + " not found on " + getHostname(), 404);
        }
        try {
            return objectMapper.treeToValue(response, Integrator.class);
        } catch (JsonProcessingException e) {
            throw new ApiException("Unexpected integrator format from " + getHostname() + ": " + e.getMessage(), e);
        }
    }
}
