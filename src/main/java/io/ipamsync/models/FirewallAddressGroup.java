package io.ipamsync.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

import static io.ipamsync.config.Constants.ADDRESS_GROUP_COLOR;
import static io.ipamsync.config.Constants.MANAGED_COMMENT;

/**
 * FortiOS address group (addrgrp / addrgrp6).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FirewallAddressGroup {

    @JsonProperty("name")
    private String name;

    @JsonProperty("comment")
    private String comment;

    @JsonProperty("color")
    private Integer color;

    @Builder.Default
    @JsonProperty("member")
    private List<GroupMember> member = new ArrayList<>();

    /**
     * Group payload as written by the sync: fixed comment and color, given members.
     */
    public static FirewallAddressGroup managed(String name, List<GroupMember> members) {
        return FirewallAddressGroup.builder()
            .name(name)
            .comment(MANAGED_COMMENT)
            .color(ADDRESS_GROUP_COLOR)
            .member(new ArrayList<>(members))
            .build();
    }
}
