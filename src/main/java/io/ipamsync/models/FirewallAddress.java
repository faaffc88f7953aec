package io.ipamsync.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.ipamsync.enums.AddressFamily;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * FortiOS firewall address object. IPv4 objects carry {@code subnet} ("network mask"),
 * IPv6 objects carry {@code ip6} (CIDR).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FirewallAddress {

    @JsonProperty("name")
    private String name;

    @JsonProperty("comment")
    private String comment;

    @JsonProperty("subnet")
    private String subnet;

    @JsonProperty("ip6")
    private String ip6;

    @JsonProperty("color")
    private Integer color;

    // Number of objects referencing this address, only returned when queried with meta
    @JsonProperty(value = "q_ref", access = JsonProperty.Access.WRITE_ONLY)
    private Integer referenceCount;

    @JsonIgnore
    private AddressFamily family;
}
