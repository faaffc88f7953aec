package io.ipamsync.projection;

import io.ipamsync.enums.AddressFamily;
import io.ipamsync.models.FirewallAddress;
import io.ipamsync.models.GroupMember;
import io.ipamsync.models.NetboxPrefix;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class PrefixMapperTest {

    // =================================================================
    // IPV4 PROJECTION TESTS
    // =================================================================

    @Test
    void testProject_Ipv4WithVlan() {
        // Given
        List<NetboxPrefix> prefixes = List.of(new NetboxPrefix("192.168.1.0/24", 4, "Production"));

        // When
        List<FirewallAddress> addresses = PrefixMapper.project(prefixes, AddressFamily.IPV4);

        // Then
        assertThat(addresses).hasSize(1);
        FirewallAddress address = addresses.get(0);
        assertThat(address.getName()).isEqualTo("netbox_192.168.1.0/24");
        assertThat(address.getSubnet()).isEqualTo("192.168.1.0 255.255.255.0");
        assertThat(address.getComment()).isEqualTo("production");
        assertThat(address.getColor()).isEqualTo(0);
        assertThat(address.getIp6()).isNull();
        assertThat(address.getFamily()).isEqualTo(AddressFamily.IPV4);
    }

    @Test
    void testProject_Ipv4MaskDerivedFromPrefixLength() {
        // Given
        List<NetboxPrefix> prefixes = List.of(
            new NetboxPrefix("10.0.0.0/8", 4, null),
            new NetboxPrefix("172.16.0.0/12", 4, null),
            new NetboxPrefix("10.1.2.3/32", 4, null),
            new NetboxPrefix("0.0.0.0/0", 4, null),
            new NetboxPrefix("10.20.30.0/27", 4, null));

        // When
        List<FirewallAddress> addresses = PrefixMapper.project(prefixes, AddressFamily.IPV4);

        // Then
        assertThat(addresses).extracting(FirewallAddress::getSubnet).containsExactly(
            "10.0.0.0 255.0.0.0",
            "172.16.0.0 255.240.0.0",
            "10.1.2.3 255.255.255.255",
            "0.0.0.0 0.0.0.0",
            "10.20.30.0 255.255.255.224");
    }

    @Test
    void testProject_NoVlanGivesNoComment() {
        // Given
        List<NetboxPrefix> prefixes = List.of(
            new NetboxPrefix("10.0.0.0/24", 4, null),
            new NetboxPrefix("10.0.1.0/24", 4, ""));

        // When
        List<FirewallAddress> addresses = PrefixMapper.project(prefixes, AddressFamily.IPV4);

        // Then
        assertThat(addresses).extracting(FirewallAddress::getComment).containsOnlyNulls();
    }

    @Test
    void testProject_InvalidIpv4CidrIsSkipped() {
        // Given
        List<NetboxPrefix> prefixes = List.of(
            new NetboxPrefix("10.0.0.0", 4, null),
            new NetboxPrefix("10.0.0.0/33", 4, null),
            new NetboxPrefix("not-an-ip/24", 4, null),
            new NetboxPrefix("2001:db8::/32", 4, null),
            new NetboxPrefix("10.0.0.0/abc", 4, null),
            new NetboxPrefix("10.9.0.0/16", 4, null));

        // When
        List<FirewallAddress> addresses = PrefixMapper.project(prefixes, AddressFamily.IPV4);

        // Then
        assertThat(addresses).extracting(FirewallAddress::getName).containsExactly("netbox_10.9.0.0/16");
    }

    // =================================================================
    // IPV6 PROJECTION TESTS
    // =================================================================

    @Test
    void testProject_Ipv6WithoutVlan() {
        // Given
        List<NetboxPrefix> prefixes = List.of(new NetboxPrefix("2001:db8::/32", 6, null));

        // When
        List<FirewallAddress> addresses = PrefixMapper.project(prefixes, AddressFamily.IPV6);

        // Then
        assertThat(addresses).hasSize(1);
        FirewallAddress address = addresses.get(0);
        assertThat(address.getName()).isEqualTo("netbox6_2001:db8::/32");
        assertThat(address.getIp6()).isEqualTo("2001:db8::/32");
        assertThat(address.getComment()).isNull();
        assertThat(address.getSubnet()).isNull();
        assertThat(address.getColor()).isNull();
    }

    @Test
    void testProject_Ipv6NameUsesDisplay() {
        // Given
        NetboxPrefix prefix = new NetboxPrefix("2001:0db8:0000::/48", 6, "Lab");
        prefix.setDisplay("2001:db8::/48");

        // When
        List<FirewallAddress> addresses = PrefixMapper.project(List.of(prefix), AddressFamily.IPV6);

        // Then
        assertThat(addresses).hasSize(1);
        assertThat(addresses.get(0).getName()).isEqualTo("netbox6_2001:db8::/48");
        assertThat(addresses.get(0).getIp6()).isEqualTo("2001:0db8:0000::/48");
        assertThat(addresses.get(0).getComment()).isEqualTo("lab");
    }

    // =================================================================
    // FILTERING AND EDGE CASES
    // =================================================================

    @Test
    void testProject_FiltersByFamily() {
        // Given
        List<NetboxPrefix> prefixes = List.of(
            new NetboxPrefix("10.0.0.0/24", 4, null),
            new NetboxPrefix("2001:db8::/32", 6, null),
            new NetboxPrefix("10.0.1.0/24", 4, null),
            new NetboxPrefix("2001:db8:1::/48", 6, null));

        // When
        List<FirewallAddress> v4 = PrefixMapper.project(prefixes, AddressFamily.IPV4);
        List<FirewallAddress> v6 = PrefixMapper.project(prefixes, AddressFamily.IPV6);

        // Then
        assertThat(v4).extracting(FirewallAddress::getName)
            .containsExactly("netbox_10.0.0.0/24", "netbox_10.0.1.0/24");
        assertThat(v6).extracting(FirewallAddress::getName)
            .containsExactly("netbox6_2001:db8::/32", "netbox6_2001:db8:1::/48");
    }

    @Test
    void testProject_UnknownFamilyIsIgnored() {
        // Given
        NetboxPrefix noFamily = new NetboxPrefix();
        noFamily.setPrefix("10.0.0.0/24");

        // When
        List<FirewallAddress> addresses = PrefixMapper.project(List.of(noFamily), AddressFamily.IPV4);

        // Then
        assertThat(addresses).isEmpty();
    }

    @Test
    void testProject_EmptyAndNullInput() {
        assertThat(PrefixMapper.project(new ArrayList<>(), AddressFamily.IPV4)).isNotNull().isEmpty();
        assertThat(PrefixMapper.project(null, AddressFamily.IPV6)).isNotNull().isEmpty();
    }

    // =================================================================
    // GROUP MEMBER TESTS
    // =================================================================

    @Test
    void testUniqueMembers_KeepsFirstOccurrenceInOrder() {
        // Given
        List<FirewallAddress> addresses = PrefixMapper.project(List.of(
            new NetboxPrefix("10.0.1.0/24", 4, null),
            new NetboxPrefix("10.0.0.0/24", 4, null),
            new NetboxPrefix("10.0.1.0/24", 4, "Duplicate")), AddressFamily.IPV4);

        // When
        List<GroupMember> members = PrefixMapper.uniqueMembers(addresses);

        // Then
        assertThat(members).extracting(GroupMember::getName)
            .containsExactly("netbox_10.0.1.0/24", "netbox_10.0.0.0/24");
    }
}
