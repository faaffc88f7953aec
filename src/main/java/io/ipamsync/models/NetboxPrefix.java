package io.ipamsync.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.ipamsync.enums.AddressFamily;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Prefix record as returned by the IPAM prefixes endpoint. Never modified by the sync.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NetboxPrefix {

    @JsonProperty("id")
    private Long id;

    @JsonProperty("prefix")
    private String prefix;

    @JsonProperty("display")
    private String display;

    @JsonProperty("family")
    private Family family;

    @JsonProperty("vlan")
    private Vlan vlan;

    public NetboxPrefix(String prefix, int family, String vlanName) {
        this.prefix = prefix;
        this.display = prefix;
        this.family = new Family(family, family == 6 ? "IPv6" : "IPv4");
        this.vlan = vlanName != null ? new Vlan(vlanName) : null;
    }

    @JsonIgnore
    public AddressFamily getAddressFamily() {
        return family != null ? AddressFamily.fromValue(family.getValue()) : null;
    }

    @JsonIgnore
    public String getVlanName() {
        return vlan != null ? vlan.getName() : null;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Family {
        @JsonProperty("value")
        private Integer value;

        @JsonProperty("label")
        private String label;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Vlan {
        @JsonProperty("name")
        private String name;
    }
}
