package io.ipamsync.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

import static io.ipamsync.config.Constants.IP_ADDRESS_EXPRESSION;

/**
 * NSX group expression. Only IPAddressExpression entries carry {@code ip_addresses};
 * other expression types (conditions, conjunctions) are kept as read.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class IpAddressExpression {

    @JsonProperty("resource_type")
    private String resourceType;

    @JsonProperty("ip_addresses")
    private List<String> ipAddresses;

    public static IpAddressExpression of(List<String> ipAddresses) {
        return new IpAddressExpression(IP_ADDRESS_EXPRESSION, new ArrayList<>(ipAddresses));
    }
}
