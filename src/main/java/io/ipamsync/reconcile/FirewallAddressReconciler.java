package io.ipamsync.reconcile;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import io.ipamsync.clients.ApiException;
import io.ipamsync.clients.FortiOSClient;
import io.ipamsync.diff.DiffResult;
import io.ipamsync.diff.SetDiff;
import io.ipamsync.enums.AddressFamily;
import io.ipamsync.enums.SyncOperation;
import io.ipamsync.models.FirewallAddress;
import io.ipamsync.models.FirewallAddressGroup;
import io.ipamsync.models.Integrator;
import io.ipamsync.models.Vdom;
import io.ipamsync.projection.PrefixMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converges the address objects and the managed address group of one FortiGate vdom
 * towards the desired addresses of an integrator, for one address family.
 *
 * <p>Observed state is read once per call. Addresses are created before the group is
 * created or updated, and addresses dropped from the group are deleted only after the
 * group update succeeded and only when nothing else references them.
 *
 * <p>Stateless; safe to call concurrently for different vdoms and families.
 */
@Slf4j
public class FirewallAddressReconciler {

    public ReconcileReport reconcileAddresses(FortiOSClient firewall, Vdom vdom, Integrator integrator,
                                              AddressFamily family, List<FirewallAddress> desired) {
        String host = firewall.getHostname();
        String scope = vdom.getName();
        String label = family.getLabel();
        ReconcileReport report = new ReconcileReport(host + "/" + scope + "/" + label);

        List<FirewallAddressGroup> groups = null;
        List<FirewallAddress> addresses = null;
        try {
            groups = firewall.getAddressGroups(family, scope);
        } catch (ApiException e) {
            log.warn("Reconcile - Failed getting {} address groups from '{}' on '{}' vdom '{}': {}",
                label, integrator.getName(), host, scope, e.getMessage());
        }
        try {
            addresses = firewall.getAddresses(family, scope);
        } catch (ApiException e) {
            log.warn("Reconcile - Failed getting {} addresses from '{}' on '{}' vdom '{}': {}",
                label, integrator.getName(), host, scope, e.getMessage());
        }
        if (groups == null || addresses == null) {
            log.error("Reconcile - Missing {} addresses or groups from '{}' on '{}' vdom '{}'",
                label, integrator.getName(), host, scope);
            report.markAborted();
            return report;
        }

        createMissingAddresses(firewall, scope, integrator, family, desired, addresses, report);

        if (integrator.isFirewallGroupManaged()) {
            String groupName = family.groupName(integrator.getFgGroupName());
            FirewallAddressGroup desiredGroup = FirewallAddressGroup.managed(groupName,
                PrefixMapper.uniqueMembers(desired));
            Optional<FirewallAddressGroup> existingGroup = groups.stream()
                .filter(group -> groupName.equals(group.getName()))
                .findFirst();

            if (existingGroup.isEmpty()) {
                createGroup(firewall, scope, integrator, family, desiredGroup, report);
            } else {
                updateGroup(firewall, scope, integrator, family, existingGroup.get(), desiredGroup, report);
            }
        }

        log.debug("Reconcile - {}", report);
        return report;
    }

    private void createMissingAddresses(FortiOSClient firewall, String scope, Integrator integrator,
                                        AddressFamily family, List<FirewallAddress> desired,
                                        List<FirewallAddress> existing, ReconcileReport report) {
        Set<String> existingNames = existing.stream()
            .map(FirewallAddress::getName)
            .collect(Collectors.toCollection(HashSet::new));

        for (FirewallAddress address : desired) {
            if (existingNames.contains(address.getName())) {
                continue;
            }
            try {
                firewall.addAddress(family, address, scope);
                existingNames.add(address.getName());
                report.succeeded(SyncOperation.CREATE_ADDRESS, address.getName());
                log.info("Reconcile - Created {} address '{}' from '{}' on '{}' vdom '{}'",
                    family.getLabel(), address.getName(), integrator.getName(), firewall.getHostname(), scope);
            } catch (ApiException e) {
                report.failed(SyncOperation.CREATE_ADDRESS, address.getName(), e.getMessage());
                log.error("Reconcile - Failed to create {} address '{}' from '{}' on '{}' vdom '{}': {}",
                    family.getLabel(), address.getName(), integrator.getName(), firewall.getHostname(), scope,
                    e.getMessage());
            }
        }
    }

    private void createGroup(FortiOSClient firewall, String scope, Integrator integrator, AddressFamily family,
                             FirewallAddressGroup group, ReconcileReport report) {
        try {
            firewall.addAddressGroup(family, group, scope);
            report.succeeded(SyncOperation.CREATE_GROUP, group.getName());
            log.info("Reconcile - Created {} address group '{}' with {} members from '{}' on '{}' vdom '{}'",
                family.getLabel(), group.getName(), group.getMember().size(), integrator.getName(),
                firewall.getHostname(), scope);
        } catch (ApiException e) {
            report.failed(SyncOperation.CREATE_GROUP, group.getName(), e.getMessage());
            log.error("Reconcile - Creation of {} address group '{}' failed from '{}' on '{}' vdom '{}': {}",
                family.getLabel(), group.getName(), integrator.getName(), firewall.getHostname(), scope,
                e.getMessage());
        }
    }

    private void updateGroup(FortiOSClient firewall, String scope, Integrator integrator, AddressFamily family,
                             FirewallAddressGroup existing, FirewallAddressGroup desired, ReconcileReport report) {
        DiffResult changes = SetDiff.groupDiff(existing, desired);
        if (!changes.hasChanges()) {
            log.debug("Reconcile - {} address group '{}' on '{}' vdom '{}' is up to date",
                family.getLabel(), desired.getName(), firewall.getHostname(), scope);
            return;
        }

        Map<String, Object> meta = changeMetadata(firewall, scope, integrator, desired.getName(), changes);
        try {
            firewall.updateAddressGroup(family, desired.getName(), desired, scope);
            report.succeeded(SyncOperation.UPDATE_GROUP, desired.getName());
            log.info("Reconcile - Updated {} address group from '{}' on '{}' vdom '{}' {}",
                family.getLabel(), integrator.getName(), firewall.getHostname(), scope, meta);
        } catch (ApiException e) {
            report.failed(SyncOperation.UPDATE_GROUP, desired.getName(), e.getMessage());
            log.error("Reconcile - Update of {} address group failed from '{}' on '{}' vdom '{}' {}: {}",
                family.getLabel(), integrator.getName(), firewall.getHostname(), scope, meta, e.getMessage());
            return;
        }

        for (String removed : changes.getRemoved()) {
            deleteIfUnreferenced(firewall, scope, integrator, family, removed, report);
        }
    }

    /**
     * Deletes an address dropped from the group when its reference count is zero.
     * When the count cannot be read the address is left in place.
     */
    private void deleteIfUnreferenced(FortiOSClient firewall, String scope, Integrator integrator,
                                      AddressFamily family, String name, ReconcileReport report) {
        int references;
        try {
            references = firewall.getAddressReferenceCount(family, name, scope);
        } catch (ApiException e) {
            report.skipped(SyncOperation.DELETE_ADDRESS, name, "reference count unavailable: " + e.getMessage());
            log.debug("Reconcile - Keeping {} address '{}' for '{}' on '{}' vdom '{}', reference count unavailable: {}",
                family.getLabel(), name, integrator.getName(), firewall.getHostname(), scope, e.getMessage());
            return;
        }
        if (references != 0) {
            report.skipped(SyncOperation.DELETE_ADDRESS, name, "referenced by " + references + " object(s)");
            log.debug("Reconcile - Keeping {} address '{}' for '{}' on '{}' vdom '{}', referenced by {} object(s)",
                family.getLabel(), name, integrator.getName(), firewall.getHostname(), scope, references);
            return;
        }

        try {
            firewall.deleteAddress(family, name, scope);
            report.succeeded(SyncOperation.DELETE_ADDRESS, name);
            log.info("Reconcile - Removed {} address '{}' from '{}' on '{}' vdom '{}'",
                family.getLabel(), name, integrator.getName(), firewall.getHostname(), scope);
        } catch (ApiException e) {
            report.failed(SyncOperation.DELETE_ADDRESS, name, e.getMessage());
            log.error("Reconcile - Remove of {} address '{}' failed from '{}' on '{}' vdom '{}': {}",
                family.getLabel(), name, integrator.getName(), firewall.getHostname(), scope, e.getMessage());
        }
    }

    private static Map<String, Object> changeMetadata(FortiOSClient firewall, String scope, Integrator integrator,
                                                      String groupName, DiffResult changes) {
        String ipamServer = integrator.getNetboxEndpoint() != null
            ? Strings.nullToEmpty(integrator.getNetboxEndpoint().getName()) : "";
        return ImmutableMap.<String, Object>builder()
            .put("name", groupName)
            .put("type", "UPDATE")
            .put("src", ImmutableMap.of(
                "system", "netbox",
                "server", ipamServer,
                "query", Strings.nullToEmpty(integrator.getQuery())))
            .put("dst", ImmutableMap.of(
                "system", "fortigate",
                "server", Strings.nullToEmpty(firewall.getHostname()),
                "vdom", Strings.nullToEmpty(scope)))
            .put("changes", ImmutableMap.of(
                "added", changes.getAdded(),
                "removed", changes.getRemoved()))
            .build();
    }
}
