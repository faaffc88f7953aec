package io.ipamsync.projection;

import com.google.common.net.InetAddresses;
import io.ipamsync.enums.AddressFamily;
import io.ipamsync.models.FirewallAddress;
import io.ipamsync.models.GroupMember;
import io.ipamsync.models.NetboxPrefix;
import lombok.extern.slf4j.Slf4j;

import java.net.InetAddress;
import java.net.Inet4Address;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static io.ipamsync.config.Constants.ADDRESS_COLOR;

/**
 * Maps IPAM prefixes to FortiOS firewall address objects.
 *
 * <ul>
 *   <li>IPv4: name {@code netbox_<prefix>}, subnet {@code "<network> <dotted mask>"}</li>
 *   <li>IPv6: name {@code netbox6_<display>}, ip6 is the prefix as-is</li>
 * </ul>
 * The comment is the lowercased VLAN name, or absent when the prefix has no named VLAN.
 * Output order follows input order.
 */
@Slf4j
public final class PrefixMapper {

    private static final int IPV4_BITS = 32;

    private PrefixMapper() {
        // Utility class - prevent instantiation
    }

    public static List<FirewallAddress> project(List<NetboxPrefix> prefixes, AddressFamily family) {
        List<FirewallAddress> addresses = new ArrayList<>();
        if (prefixes == null) {
            return addresses;
        }
        for (NetboxPrefix prefix : prefixes) {
            if (prefix == null || prefix.getAddressFamily() != family) {
                continue;
            }
            FirewallAddress address = family == AddressFamily.IPV4 ? toAddress(prefix) : toAddress6(prefix);
            if (address != null) {
                addresses.add(address);
            }
        }
        return addresses;
    }

    /**
     * Group members for the given addresses, first occurrence of each name wins.
     */
    public static List<GroupMember> uniqueMembers(List<FirewallAddress> addresses) {
        Set<String> names = new LinkedHashSet<>();
        for (FirewallAddress address : addresses) {
            names.add(address.getName());
        }
        List<GroupMember> members = new ArrayList<>(names.size());
        for (String name : names) {
            members.add(new GroupMember(name));
        }
        return members;
    }

    private static FirewallAddress toAddress(NetboxPrefix prefix) {
        String cidr = prefix.getPrefix();
        String subnet = toSubnet(cidr);
        if (subnet == null) {
            log.warn("Skipping IPv4 prefix with invalid CIDR '{}' (id: {})", cidr, prefix.getId());
            return null;
        }
        return FirewallAddress.builder()
            .name(AddressFamily.IPV4.addressName(cidr))
            .comment(comment(prefix))
            .subnet(subnet)
            .color(ADDRESS_COLOR)
            .family(AddressFamily.IPV4)
            .build();
    }

    private static FirewallAddress toAddress6(NetboxPrefix prefix) {
        String cidr = prefix.getPrefix();
        if (cidr == null || cidr.isBlank()) {
            log.warn("Skipping IPv6 prefix without CIDR (id: {})", prefix.getId());
            return null;
        }
        String display = prefix.getDisplay() != null && !prefix.getDisplay().isBlank() ? prefix.getDisplay() : cidr;
        return FirewallAddress.builder()
            .name(AddressFamily.IPV6.addressName(display))
            .comment(comment(prefix))
            .ip6(cidr)
            .family(AddressFamily.IPV6)
            .build();
    }

    /**
     * "10.0.0.0/8" becomes "10.0.0.0 255.0.0.0"; null when the CIDR is not a valid IPv4 prefix.
     */
    static String toSubnet(String cidr) {
        if (cidr == null) {
            return null;
        }
        int slash = cidr.indexOf('/');
        if (slash <= 0) {
            return null;
        }
        String network = cidr.substring(0, slash);
        int length;
        try {
            length = Integer.parseInt(cidr.substring(slash + 1));
        } catch (NumberFormatException e) {
            return null;
        }
        if (length < 0 || length > IPV4_BITS || !InetAddresses.isInetAddress(network)) {
            return null;
        }
        InetAddress address = InetAddresses.forString(network);
        if (!(address instanceof Inet4Address)) {
            return null;
        }
        return network + " " + toDottedMask(length);
    }

    private static String toDottedMask(int prefixLength) {
        int mask = prefixLength == 0 ? 0 : -1 << (IPV4_BITS - prefixLength);
        return InetAddresses.fromInteger(mask).getHostAddress();
    }

    private static String comment(NetboxPrefix prefix) {
        String vlanName = prefix.getVlanName();
        return vlanName != null && !vlanName.isEmpty() ? vlanName.toLowerCase(Locale.ROOT) : null;
    }
}
