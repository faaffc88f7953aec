package io.ipamsync.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A FortiGate endpoint bound to an integrator together with the vdoms to sync.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FortigateEndpoint {

    @JsonProperty("endpoint")
    private ApiEndpoint endpoint;

    @JsonProperty("vdoms")
    private List<Vdom> vdoms = new ArrayList<>();
}
