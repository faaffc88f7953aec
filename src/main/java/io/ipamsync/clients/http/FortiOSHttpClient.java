package io.ipamsync.clients.http;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;
import io.ipamsync.clients.ApiException;
import io.ipamsync.clients.FortiOSClient;
import io.ipamsync.enums.AddressFamily;
import io.ipamsync.models.FirewallAddress;
import io.ipamsync.models.FirewallAddressGroup;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static io.ipamsync.config.Constants.FORTIOS_CMDB_PATH;

/**
 * FortiOS CMDB REST handle for one FortiGate.
 */
public class FortiOSHttpClient extends JsonHttpClient implements FortiOSClient {

    private static final TypeReference<List<FirewallAddress>> ADDRESS_LIST = new TypeReference<>() {};
    private static final TypeReference<List<FirewallAddressGroup>> GROUP_LIST = new TypeReference<>() {};
    private static final String API_SUFFIX = "/api/v2";

    // Address names contain '/', which must be escaped inside a path segment
    private static final Escaper PATH_ESCAPER = UrlEscapers.urlPathSegmentEscaper();
    private static final Escaper QUERY_ESCAPER = UrlEscapers.urlFormParameterEscaper();

    public FortiOSHttpClient(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl,
                             Map<String, String> headers, Duration requestTimeout) {
        super(httpClient, objectMapper, stripApiSuffix(baseUrl), headers, requestTimeout);
    }

    @Override
    public List<FirewallAddress> getAddresses(AddressFamily family, String vdom) throws ApiException {
        List<FirewallAddress> addresses = readResults(get(collectionPath(family.getAddressPath(), vdom)), ADDRESS_LIST);
        addresses.forEach(address -> address.setFamily(family));
        return addresses;
    }

    @Override
    public void addAddress(AddressFamily family, FirewallAddress address, String vdom) throws ApiException {
        send("POST", collectionPath(family.getAddressPath(), vdom), address);
    }

    @Override
    public int getAddressReferenceCount(AddressFamily family, String name, String vdom) throws ApiException {
        JsonNode response = get(objectPath(family.getAddressPath(), name, vdom) + "&with_meta=1");
        List<FirewallAddress> results = readResults(response, ADDRESS_LIST);
        if (results.isEmpty()) {
            throw new ApiException(family.getLabel() + " address '" + name + "' not found in vdom " + vdom, 404);
        }
        Integer referenceCount = results.get(0).getReferenceCount();
        if (referenceCount == null) {
            throw new ApiException("No reference count returned for " + family.getLabel() + " address '" + name + "'",
                ApiException.NO_RESPONSE);
        }
        return referenceCount;
    }

    @Override
    public void deleteAddress(AddressFamily family, String name, String vdom) throws ApiException {
        send("DELETE", objectPath(family.getAddressPath(), name, vdom), null);
    }

    @Override
    public List<FirewallAddressGroup> getAddressGroups(AddressFamily family, String vdom) throws ApiException {
        return readResults(get(collectionPath(family.getGroupPath(), vdom)), GROUP_LIST);
    }

    @Override
    public void addAddressGroup(AddressFamily family, FirewallAddressGroup group, String vdom) throws ApiException {
        send("POST", collectionPath(family.getGroupPath(), vdom), group);
    }

    @Override
    public void updateAddressGroup(AddressFamily family, String name, FirewallAddressGroup group, String vdom)
            throws ApiException {
        send("PUT", objectPath(family.getGroupPath(), name, vdom), group);
    }

    private static String collectionPath(String table, String vdom) {
        return FORTIOS_CMDB_PATH + table + "?vdom=" + QUERY_ESCAPER.escape(vdom);
    }

    private static String objectPath(String table, String name, String vdom) {
        return FORTIOS_CMDB_PATH + table + "/" + PATH_ESCAPER.escape(name) + "?vdom=" + QUERY_ESCAPER.escape(vdom);
    }

    private static String stripApiSuffix(String url) {
        if (url == null) {
            return null;
        }
        String stripped = stripTrailingSlash(url.trim());
        return stripped.endsWith(API_SUFFIX) ? stripped.substring(0, stripped.length() - API_SUFFIX.length()) : stripped;
    }
}
