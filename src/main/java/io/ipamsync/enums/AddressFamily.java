package io.ipamsync.enums;

/**
 * IP address family of a prefix, with the per-family naming and FortiOS path conventions.
 *
 * IPV4 and IPV6 objects live in separate FortiOS tables (firewall/address vs firewall/address6),
 * so every firewall call is parameterized by family instead of duplicated.
 */
public enum AddressFamily {
    IPV4(4, "IPv4", "netbox_", "grp_", "firewall/address", "firewall/addrgrp"),
    IPV6(6, "IPv6", "netbox6_", "grp6_", "firewall/address6", "firewall/addrgrp6");

    private final int value;
    private final String label;
    private final String addressPrefix;
    private final String groupPrefix;
    private final String addressPath;
    private final String groupPath;

    AddressFamily(int value, String label, String addressPrefix, String groupPrefix,
                  String addressPath, String groupPath) {
        this.value = value;
        this.label = label;
        this.addressPrefix = addressPrefix;
        this.groupPrefix = groupPrefix;
        this.addressPath = addressPath;
        this.groupPath = groupPath;
    }

    public int getValue() {
        return value;
    }

    public String getLabel() {
        return label;
    }

    public String getAddressPath() {
        return addressPath;
    }

    public String getGroupPath() {
        return groupPath;
    }

    public String addressName(String prefixText) {
        return addressPrefix + prefixText;
    }

    public String groupName(String groupKey) {
        return groupPrefix + groupKey;
    }

    public static AddressFamily fromValue(Integer value) {
        if (value == null) return null;
        for (AddressFamily family : values()) {
            if (family.value == value) {
                return family;
            }
        }
        return null;
    }
}
