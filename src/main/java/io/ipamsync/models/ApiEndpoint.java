package io.ipamsync.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Connection details for one IPAM, firewall or security platform endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiEndpoint {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("url")
    private String url;

    @ToString.Exclude
    @JsonProperty("key")
    private String key;

    @JsonProperty("user")
    private String user;

    @ToString.Exclude
    @JsonProperty("pass")
    private String pass;

    @JsonProperty("type")
    private String type; // "global" marks an NSX global manager

    @JsonProperty("enabled")
    private boolean enabled;
}
