package io.ipamsync.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Sync binding between one IPAM query and its firewall / security platform targets,
 * as stored in the NAM directory. Fetched fresh on every run.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Integrator {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("enabled")
    private boolean enabled;

    @JsonProperty("sync_priority")
    private String syncPriority;

    @JsonProperty("query")
    private String query;

    @JsonProperty("netbox_endpoint")
    private ApiEndpoint netboxEndpoint;

    @JsonProperty("create_fg_group")
    private boolean createFgGroup;

    @JsonProperty("fg_group_name")
    private String fgGroupName;

    @JsonProperty("fortigate_endpoints")
    private List<FortigateEndpoint> fortigateEndpoints = new ArrayList<>();

    @JsonProperty("create_nsx_group")
    private boolean createNsxGroup;

    @JsonProperty("nsx_group_name")
    private String nsxGroupName;

    @JsonProperty("nsx_group_scope")
    private String nsxGroupScope;

    @JsonProperty("nsx_group_tag")
    private String nsxGroupTag;

    @JsonProperty("nsx_endpoints")
    private List<ApiEndpoint> nsxEndpoints = new ArrayList<>();

    /**
     * Firewall deployment runs when group creation is requested and at least one FortiGate is bound.
     */
    @JsonIgnore
    public boolean isFirewallSyncRequested() {
        return createFgGroup && fortigateEndpoints != null && !fortigateEndpoints.isEmpty();
    }

    /**
     * Address groups are only managed when a group name is configured as well.
     */
    @JsonIgnore
    public boolean isFirewallGroupManaged() {
        return createFgGroup && fgGroupName != null && !fgGroupName.isBlank();
    }

    @JsonIgnore
    public boolean isSecurityGroupSyncRequested() {
        return createNsxGroup && nsxEndpoints != null && !nsxEndpoints.isEmpty();
    }
}
