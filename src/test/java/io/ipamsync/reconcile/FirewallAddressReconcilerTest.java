package io.ipamsync.reconcile;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.ipamsync.clients.ApiException;
import io.ipamsync.clients.FortiOSClient;
import io.ipamsync.enums.AddressFamily;
import io.ipamsync.enums.OutcomeStatus;
import io.ipamsync.enums.SyncOperation;
import io.ipamsync.models.ApiEndpoint;
import io.ipamsync.models.FirewallAddress;
import io.ipamsync.models.FirewallAddressGroup;
import io.ipamsync.models.GroupMember;
import io.ipamsync.models.Integrator;
import io.ipamsync.models.NetboxPrefix;
import io.ipamsync.models.Vdom;
import io.ipamsync.projection.PrefixMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FirewallAddressReconcilerTest {

    private static final String VDOM = "root";
    private static final String GROUP = "grp_servers";

    @Mock
    private FortiOSClient firewall;

    private FirewallAddressReconciler reconciler;
    private Integrator integrator;
    private final Vdom vdom = new Vdom(VDOM);
    private final Logger reconcilerLog = (Logger) LoggerFactory.getLogger(FirewallAddressReconciler.class);
    private ListAppender<ILoggingEvent> logEvents;

    @BeforeEach
    void setUp() {
        reconciler = new FirewallAddressReconciler();
        integrator = createIntegrator("servers");
        when(firewall.getHostname()).thenReturn("fw01.example.net");
        logEvents = new ListAppender<>();
        logEvents.start();
        reconcilerLog.addAppender(logEvents);
        reconcilerLog.setLevel(Level.DEBUG);
    }

    @AfterEach
    void tearDown() {
        reconcilerLog.detachAppender(logEvents);
        reconcilerLog.setLevel(null);
    }

    // =================================================================
    // OBSERVED STATE FETCH TESTS
    // =================================================================

    @Test
    void testReconcile_GroupFetchFailureAbortsScope() throws Exception {
        // Given
        when(firewall.getAddressGroups(AddressFamily.IPV4, VDOM)).thenThrow(new ApiException("timeout", 0));
        when(firewall.getAddresses(AddressFamily.IPV4, VDOM)).thenReturn(new ArrayList<>());

        // When
        ReconcileReport report = reconciler.reconcileAddresses(firewall, vdom, integrator, AddressFamily.IPV4,
            desired("10.0.0.0/24"));

        // Then
        assertThat(report.isAborted()).isTrue();
        assertThat(report.getOutcomes()).isEmpty();
        verify(firewall, never()).addAddress(any(), any(), anyString());
        verify(firewall, never()).addAddressGroup(any(), any(), anyString());
    }

    @Test
    void testReconcile_AddressFetchFailureAbortsScope() throws Exception {
        // Given
        when(firewall.getAddressGroups(AddressFamily.IPV4, VDOM)).thenReturn(new ArrayList<>());
        when(firewall.getAddresses(AddressFamily.IPV4, VDOM)).thenThrow(new ApiException("HTTP 500", 500));

        // When
        ReconcileReport report = reconciler.reconcileAddresses(firewall, vdom, integrator, AddressFamily.IPV4,
            desired("10.0.0.0/24"));

        // Then
        assertThat(report.isAborted()).isTrue();
        verify(firewall, never()).addAddress(any(), any(), anyString());
    }

    // =================================================================
    // ADDRESS CREATION TESTS
    // =================================================================

    @Test
    void testReconcile_CreatesOnlyMissingAddresses() throws Exception {
        // Given
        List<FirewallAddress> desired = desired("10.0.0.0/24", "10.0.1.0/24");
        when(firewall.getAddressGroups(AddressFamily.IPV4, VDOM)).thenReturn(List.of(
            FirewallAddressGroup.managed(GROUP, PrefixMapper.uniqueMembers(desired))));
        when(firewall.getAddresses(AddressFamily.IPV4, VDOM)).thenReturn(List.of(address("netbox_10.0.0.0/24")));

        // When
        ReconcileReport report = reconciler.reconcileAddresses(firewall, vdom, integrator, AddressFamily.IPV4, desired);

        // Then
        ArgumentCaptor<FirewallAddress> captor = ArgumentCaptor.forClass(FirewallAddress.class);
        verify(firewall).addAddress(eq(AddressFamily.IPV4), captor.capture(), eq(VDOM));
        assertThat(captor.getValue().getName()).isEqualTo("netbox_10.0.1.0/24");
        assertThat(captor.getValue().getSubnet()).isEqualTo("10.0.1.0 255.255.255.0");
        assertThat(report.count(SyncOperation.CREATE_ADDRESS, OutcomeStatus.SUCCEEDED)).isEqualTo(1);
        verify(firewall, never()).updateAddressGroup(any(), anyString(), any(), anyString());
    }

    @Test
    void testReconcile_CreateFailureDoesNotBlockOtherAddresses() throws Exception {
        // Given
        List<FirewallAddress> desired = desired("10.0.0.0/24", "10.0.1.0/24");
        integrator.setFgGroupName(null);
        when(firewall.getAddressGroups(AddressFamily.IPV4, VDOM)).thenReturn(new ArrayList<>());
        when(firewall.getAddresses(AddressFamily.IPV4, VDOM)).thenReturn(new ArrayList<>());
        doThrow(new ApiException("duplicate", 500)).doNothing().when(firewall)
            .addAddress(eq(AddressFamily.IPV4), any(FirewallAddress.class), eq(VDOM));

        // When
        ReconcileReport report = reconciler.reconcileAddresses(firewall, vdom, integrator, AddressFamily.IPV4, desired);

        // Then
        verify(firewall, times(2)).addAddress(eq(AddressFamily.IPV4), any(FirewallAddress.class), eq(VDOM));
        assertThat(report.getOutcomes()).extracting(SyncOutcome::getTarget, SyncOutcome::getStatus).containsExactly(
            tuple("netbox_10.0.0.0/24", OutcomeStatus.FAILED),
            tuple("netbox_10.0.1.0/24", OutcomeStatus.SUCCEEDED));
    }

    // =================================================================
    // ADDRESS GROUP TESTS
    // =================================================================

    @Test
    void testReconcile_CreatesMissingGroupAfterAddresses() throws Exception {
        // Given
        NetboxPrefix duplicate = new NetboxPrefix("10.0.0.0/24", 4, "Other");
        List<FirewallAddress> desired = PrefixMapper.project(List.of(
            new NetboxPrefix("10.0.0.0/24", 4, null),
            new NetboxPrefix("10.0.1.0/24", 4, null),
            duplicate), AddressFamily.IPV4);
        when(firewall.getAddressGroups(AddressFamily.IPV4, VDOM)).thenReturn(new ArrayList<>());
        when(firewall.getAddresses(AddressFamily.IPV4, VDOM)).thenReturn(List.of(
            address("netbox_10.0.0.0/24"), address("netbox_10.0.1.0/24")));

        // When
        ReconcileReport report = reconciler.reconcileAddresses(firewall, vdom, integrator, AddressFamily.IPV4, desired);

        // Then
        ArgumentCaptor<FirewallAddressGroup> captor = ArgumentCaptor.forClass(FirewallAddressGroup.class);
        verify(firewall).addAddressGroup(eq(AddressFamily.IPV4), captor.capture(), eq(VDOM));
        FirewallAddressGroup created = captor.getValue();
        assertThat(created.getName()).isEqualTo(GROUP);
        assertThat(created.getComment()).isEqualTo("Managed by NAM");
        assertThat(created.getColor()).isEqualTo(3);
        assertThat(created.getMember()).extracting(GroupMember::getName)
            .containsExactly("netbox_10.0.0.0/24", "netbox_10.0.1.0/24");
        assertThat(report.count(SyncOperation.CREATE_GROUP, OutcomeStatus.SUCCEEDED)).isEqualTo(1);
    }

    @Test
    void testReconcile_AddressesCreatedBeforeGroup() throws Exception {
        // Given
        List<FirewallAddress> desired = desired("10.0.0.0/24");
        when(firewall.getAddressGroups(AddressFamily.IPV4, VDOM)).thenReturn(new ArrayList<>());
        when(firewall.getAddresses(AddressFamily.IPV4, VDOM)).thenReturn(new ArrayList<>());

        // When
        reconciler.reconcileAddresses(firewall, vdom, integrator, AddressFamily.IPV4, desired);

        // Then
        InOrder inOrder = inOrder(firewall);
        inOrder.verify(firewall).addAddress(eq(AddressFamily.IPV4), any(FirewallAddress.class), eq(VDOM));
        inOrder.verify(firewall).addAddressGroup(eq(AddressFamily.IPV4), any(FirewallAddressGroup.class), eq(VDOM));
    }

    @Test
    void testReconcile_UnchangedGroupIsNotUpdated() throws Exception {
        // Given
        List<FirewallAddress> desired = desired("10.0.0.0/24");
        FirewallAddressGroup existing = FirewallAddressGroup.builder()
            .name(GROUP)
            .member(List.of(new GroupMember("netbox_10.0.0.0/24")))
            .build();
        when(firewall.getAddressGroups(AddressFamily.IPV4, VDOM)).thenReturn(List.of(existing));
        when(firewall.getAddresses(AddressFamily.IPV4, VDOM)).thenReturn(List.of(address("netbox_10.0.0.0/24")));

        // When
        ReconcileReport report = reconciler.reconcileAddresses(firewall, vdom, integrator, AddressFamily.IPV4, desired);

        // Then
        verify(firewall, never()).updateAddressGroup(any(), anyString(), any(), anyString());
        verify(firewall, never()).deleteAddress(any(), anyString(), anyString());
        assertThat(report.getOutcomes()).isEmpty();
    }

    @Test
    void testReconcile_UpdatesGroupAndDeletesUnreferencedAddress() throws Exception {
        // Given - existing {a1, a2}, desired {a1, a3, a4}
        List<FirewallAddress> desired = desired("10.0.1.0/24", "10.0.3.0/24", "10.0.4.0/24");
        when(firewall.getAddressGroups(AddressFamily.IPV4, VDOM)).thenReturn(List.of(
            existingGroup("netbox_10.0.1.0/24", "netbox_10.0.2.0/24")));
        when(firewall.getAddresses(AddressFamily.IPV4, VDOM)).thenReturn(addresses(desired, "netbox_10.0.2.0/24"));
        when(firewall.getAddressReferenceCount(AddressFamily.IPV4, "netbox_10.0.2.0/24", VDOM)).thenReturn(0);

        // When
        ReconcileReport report = reconciler.reconcileAddresses(firewall, vdom, integrator, AddressFamily.IPV4, desired);

        // Then
        ArgumentCaptor<FirewallAddressGroup> captor = ArgumentCaptor.forClass(FirewallAddressGroup.class);
        InOrder inOrder = inOrder(firewall);
        inOrder.verify(firewall).updateAddressGroup(eq(AddressFamily.IPV4), eq(GROUP), captor.capture(), eq(VDOM));
        inOrder.verify(firewall).deleteAddress(AddressFamily.IPV4, "netbox_10.0.2.0/24", VDOM);
        assertThat(captor.getValue().getMember()).extracting(GroupMember::getName)
            .containsExactly("netbox_10.0.1.0/24", "netbox_10.0.3.0/24", "netbox_10.0.4.0/24");
        assertThat(report.count(SyncOperation.UPDATE_GROUP, OutcomeStatus.SUCCEEDED)).isEqualTo(1);
        assertThat(report.count(SyncOperation.DELETE_ADDRESS, OutcomeStatus.SUCCEEDED)).isEqualTo(1);
    }

    @Test
    void testReconcile_ReferencedAddressIsKept() throws Exception {
        // Given
        List<FirewallAddress> desired = desired("10.0.1.0/24");
        when(firewall.getAddressGroups(AddressFamily.IPV4, VDOM)).thenReturn(List.of(
            existingGroup("netbox_10.0.1.0/24", "netbox_10.0.2.0/24")));
        when(firewall.getAddresses(AddressFamily.IPV4, VDOM)).thenReturn(addresses(desired, "netbox_10.0.2.0/24"));
        when(firewall.getAddressReferenceCount(AddressFamily.IPV4, "netbox_10.0.2.0/24", VDOM)).thenReturn(2);

        // When
        ReconcileReport report = reconciler.reconcileAddresses(firewall, vdom, integrator, AddressFamily.IPV4, desired);

        // Then
        verify(firewall, never()).deleteAddress(any(), anyString(), anyString());
        assertThat(report.count(SyncOperation.DELETE_ADDRESS, OutcomeStatus.SKIPPED)).isEqualTo(1);
        assertThat(messagesContaining("Keeping IPv4 address 'netbox_10.0.2.0/24'"))
            .singleElement().asString()
            .contains("'Servers'", "'fw01.example.net'", "vdom 'root'", "referenced by 2");
    }

    @Test
    void testReconcile_ReferenceCountFailureLeavesAddressInPlace() throws Exception {
        // Given
        List<FirewallAddress> desired = desired("10.0.1.0/24");
        when(firewall.getAddressGroups(AddressFamily.IPV4, VDOM)).thenReturn(List.of(
            existingGroup("netbox_10.0.1.0/24", "netbox_10.0.2.0/24", "netbox_10.0.3.0/24")));
        when(firewall.getAddresses(AddressFamily.IPV4, VDOM)).thenReturn(
            addresses(desired, "netbox_10.0.2.0/24", "netbox_10.0.3.0/24"));
        when(firewall.getAddressReferenceCount(AddressFamily.IPV4, "netbox_10.0.2.0/24", VDOM))
            .thenThrow(new ApiException("timeout", 0));
        when(firewall.getAddressReferenceCount(AddressFamily.IPV4, "netbox_10.0.3.0/24", VDOM)).thenReturn(0);

        // When
        ReconcileReport report = reconciler.reconcileAddresses(firewall, vdom, integrator, AddressFamily.IPV4, desired);

        // Then
        verify(firewall, never()).deleteAddress(AddressFamily.IPV4, "netbox_10.0.2.0/24", VDOM);
        verify(firewall).deleteAddress(AddressFamily.IPV4, "netbox_10.0.3.0/24", VDOM);
        assertThat(report.count(SyncOperation.DELETE_ADDRESS, OutcomeStatus.SKIPPED)).isEqualTo(1);
        assertThat(report.count(SyncOperation.DELETE_ADDRESS, OutcomeStatus.SUCCEEDED)).isEqualTo(1);
        assertThat(messagesContaining("Keeping IPv4 address 'netbox_10.0.2.0/24'"))
            .singleElement().asString()
            .contains("'Servers'", "'fw01.example.net'", "vdom 'root'", "reference count unavailable");
    }

    @Test
    void testReconcile_FailedUpdateSkipsDeletes() throws Exception {
        // Given
        List<FirewallAddress> desired = desired("10.0.1.0/24");
        when(firewall.getAddressGroups(AddressFamily.IPV4, VDOM)).thenReturn(List.of(
            existingGroup("netbox_10.0.1.0/24", "netbox_10.0.2.0/24")));
        when(firewall.getAddresses(AddressFamily.IPV4, VDOM)).thenReturn(addresses(desired, "netbox_10.0.2.0/24"));
        doThrow(new ApiException("HTTP 500", 500)).when(firewall)
            .updateAddressGroup(eq(AddressFamily.IPV4), eq(GROUP), any(FirewallAddressGroup.class), eq(VDOM));

        // When
        ReconcileReport report = reconciler.reconcileAddresses(firewall, vdom, integrator, AddressFamily.IPV4, desired);

        // Then
        verify(firewall, never()).getAddressReferenceCount(any(), anyString(), anyString());
        verify(firewall, never()).deleteAddress(any(), anyString(), anyString());
        assertThat(report.count(SyncOperation.UPDATE_GROUP, OutcomeStatus.FAILED)).isEqualTo(1);
    }

    @Test
    void testReconcile_DeleteFailureIsRecorded() throws Exception {
        // Given
        List<FirewallAddress> desired = desired("10.0.1.0/24");
        when(firewall.getAddressGroups(AddressFamily.IPV4, VDOM)).thenReturn(List.of(
            existingGroup("netbox_10.0.1.0/24", "netbox_10.0.2.0/24")));
        when(firewall.getAddresses(AddressFamily.IPV4, VDOM)).thenReturn(addresses(desired, "netbox_10.0.2.0/24"));
        when(firewall.getAddressReferenceCount(AddressFamily.IPV4, "netbox_10.0.2.0/24", VDOM)).thenReturn(0);
        doThrow(new ApiException("HTTP 424", 424)).when(firewall)
            .deleteAddress(AddressFamily.IPV4, "netbox_10.0.2.0/24", VDOM);

        // When
        ReconcileReport report = reconciler.reconcileAddresses(firewall, vdom, integrator, AddressFamily.IPV4, desired);

        // Then
        assertThat(report.count(SyncOperation.DELETE_ADDRESS, OutcomeStatus.FAILED)).isEqualTo(1);
        assertThat(report.isAborted()).isFalse();
    }

    @Test
    void testReconcile_GroupNotManagedWithoutGroupName() throws Exception {
        // Given
        integrator.setFgGroupName("  ");
        when(firewall.getAddressGroups(AddressFamily.IPV4, VDOM)).thenReturn(new ArrayList<>());
        when(firewall.getAddresses(AddressFamily.IPV4, VDOM)).thenReturn(new ArrayList<>());

        // When
        reconciler.reconcileAddresses(firewall, vdom, integrator, AddressFamily.IPV4, desired("10.0.0.0/24"));

        // Then
        verify(firewall).addAddress(eq(AddressFamily.IPV4), any(FirewallAddress.class), eq(VDOM));
        verify(firewall, never()).addAddressGroup(any(), any(), anyString());
        verify(firewall, never()).updateAddressGroup(any(), anyString(), any(), anyString());
    }

    @Test
    void testReconcile_Ipv6UsesSeparateGroup() throws Exception {
        // Given
        List<FirewallAddress> desired = PrefixMapper.project(
            List.of(new NetboxPrefix("2001:db8::/32", 6, null)), AddressFamily.IPV6);
        when(firewall.getAddressGroups(AddressFamily.IPV6, VDOM)).thenReturn(List.of(
            FirewallAddressGroup.builder().name(GROUP).build()));
        when(firewall.getAddresses(AddressFamily.IPV6, VDOM)).thenReturn(new ArrayList<>());

        // When
        reconciler.reconcileAddresses(firewall, vdom, integrator, AddressFamily.IPV6, desired);

        // Then
        ArgumentCaptor<FirewallAddressGroup> captor = ArgumentCaptor.forClass(FirewallAddressGroup.class);
        verify(firewall).addAddress(eq(AddressFamily.IPV6), any(FirewallAddress.class), eq(VDOM));
        verify(firewall).addAddressGroup(eq(AddressFamily.IPV6), captor.capture(), eq(VDOM));
        assertThat(captor.getValue().getName()).isEqualTo("grp6_servers");
        assertThat(captor.getValue().getMember()).extracting(GroupMember::getName)
            .containsExactly("netbox6_2001:db8::/32");
    }

    private List<String> messagesContaining(String text) {
        return logEvents.list.stream()
            .map(ILoggingEvent::getFormattedMessage)
            .filter(message -> message.contains(text))
            .collect(Collectors.toList());
    }

    private static Integrator createIntegrator(String groupKey) {
        Integrator integrator = new Integrator();
        integrator.setId("int-1");
        integrator.setName("Servers");
        integrator.setEnabled(true);
        integrator.setQuery("https://netbox.example.net/ipam/prefixes/?tag=servers");
        integrator.setNetboxEndpoint(ApiEndpoint.builder().name("netbox").url("https://netbox.example.net").build());
        integrator.setCreateFgGroup(true);
        integrator.setFgGroupName(groupKey);
        return integrator;
    }

    private static List<FirewallAddress> desired(String... cidrs) {
        List<NetboxPrefix> prefixes = new ArrayList<>();
        for (String cidr : cidrs) {
            prefixes.add(new NetboxPrefix(cidr, 4, null));
        }
        return PrefixMapper.project(prefixes, AddressFamily.IPV4);
    }

    private static FirewallAddress address(String name) {
        return FirewallAddress.builder().name(name).build();
    }

    private static List<FirewallAddress> addresses(List<FirewallAddress> desired, String... extra) {
        List<FirewallAddress> result = desired.stream()
            .map(a -> address(a.getName()))
            .collect(Collectors.toCollection(ArrayList::new));
        for (String name : extra) {
            result.add(address(name));
        }
        return result;
    }

    private static FirewallAddressGroup existingGroup(String... members) {
        List<GroupMember> list = new ArrayList<>();
        for (String member : members) {
            list.add(new GroupMember(member));
        }
        return FirewallAddressGroup.builder().name(GROUP).member(list).build();
    }
}
