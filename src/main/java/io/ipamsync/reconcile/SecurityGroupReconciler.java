package io.ipamsync.reconcile;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.ipamsync.clients.ApiException;
import io.ipamsync.clients.NsxClient;
import io.ipamsync.diff.DiffResult;
import io.ipamsync.diff.SetDiff;
import io.ipamsync.enums.SyncOperation;
import io.ipamsync.models.Integrator;
import io.ipamsync.models.IpAddressExpression;
import io.ipamsync.models.NetboxPrefix;
import io.ipamsync.models.SecurityGroup;
import io.ipamsync.models.Tag;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static io.ipamsync.config.Constants.MANAGED_COMMENT;
import static io.ipamsync.config.Constants.SECURITY_GROUP_PREFIX;

/**
 * Pushes an integrator's prefixes to VMware NSX as a security group holding IP addresses by value.
 * The group is replaced as a whole; the diff only decides whether a replace is needed.
 */
@Slf4j
public class SecurityGroupReconciler {

    /**
     * Desired group for an integrator: {@code nsg-<name>}, every distinct prefix CIDR in one expression,
     * and a single tag when both scope and tag are configured.
     */
    public SecurityGroup buildSecurityGroup(Integrator integrator, List<NetboxPrefix> prefixes) {
        List<String> ipAddresses = cidrs(prefixes);

        List<Tag> tags = new ArrayList<>();
        if (isPresent(integrator.getNsxGroupScope()) && isPresent(integrator.getNsxGroupTag())) {
            tags.add(new Tag(integrator.getNsxGroupScope(), integrator.getNsxGroupTag()));
        }

        return SecurityGroup.builder()
            .displayName(SECURITY_GROUP_PREFIX + integrator.getNsxGroupName())
            .description(MANAGED_COMMENT)
            .expression(ipAddresses.isEmpty() ? null : List.of(IpAddressExpression.of(ipAddresses)))
            .tags(tags)
            .build();
    }

    public ReconcileReport reconcileSecurityGroup(NsxClient nsx, Integrator integrator, SecurityGroup desired,
                                                  List<NetboxPrefix> prefixes, boolean globalManager) {
        String name = desired.getDisplayName();
        String host = nsx.getHostname();
        String owner = integrator.getName();
        ReconcileReport report = new ReconcileReport(host + "/" + name);

        Optional<SecurityGroup> existing;
        try {
            existing = nsx.getGroup(name, globalManager);
        } catch (ApiException e) {
            log.warn("Reconcile - Failed getting security group '{}' for '{}' from '{}', creating it: {}",
                name, owner, host, e.getMessage());
            existing = Optional.empty();
        }

        if (existing.isEmpty()) {
            log.info("Reconcile - Security group '{}' for '{}' not found on '{}'", name, owner, host);
            patch(nsx, owner, desired, globalManager, SyncOperation.CREATE_SECURITY_GROUP, report);
            return report;
        }

        DiffResult changes = SetDiff.listDiff(observedAddresses(existing.get()), cidrs(prefixes));
        if (changes.hasChanges()) {
            log.debug("Reconcile - Security group '{}' for '{}' on '{}' changes: added {}, removed {}",
                name, owner, host, changes.getAdded(), changes.getRemoved());
            patch(nsx, owner, desired, globalManager, SyncOperation.UPDATE_SECURITY_GROUP, report);
        } else {
            log.debug("Reconcile - Security group '{}' for '{}' on '{}' is up to date", name, owner, host);
        }
        return report;
    }

    private void patch(NsxClient nsx, String owner, SecurityGroup group, boolean globalManager,
                       SyncOperation operation, ReconcileReport report) {
        String verb = operation == SyncOperation.CREATE_SECURITY_GROUP ? "create" : "update";
        try {
            nsx.patchGroup(group.getDisplayName(), group, globalManager);
            report.succeeded(operation, group.getDisplayName());
            log.info("Reconcile - {} security group '{}' for '{}' on '{}'",
                operation == SyncOperation.CREATE_SECURITY_GROUP ? "Created" : "Updated",
                group.getDisplayName(), owner, nsx.getHostname());
        } catch (ApiException e) {
            report.failed(operation, group.getDisplayName(), e.getMessage());
            log.error("Reconcile - Failed to {} security group '{}' for '{}' on '{}': {}",
                verb, group.getDisplayName(), owner, nsx.getHostname(), e.getMessage());
        }
    }

    private static List<String> observedAddresses(SecurityGroup group) {
        List<String> observed = new ArrayList<>();
        if (group.getExpression() != null) {
            for (IpAddressExpression expression : group.getExpression()) {
                if (expression != null && expression.getIpAddresses() != null) {
                    observed.addAll(expression.getIpAddresses());
                }
            }
        }
        return observed;
    }

    /**
     * Prefix CIDRs in first-seen order, each once.
     */
    private static List<String> cidrs(List<NetboxPrefix> prefixes) {
        if (prefixes == null) {
            return ImmutableList.of();
        }
        return prefixes.stream()
            .filter(Objects::nonNull)
            .map(NetboxPrefix::getPrefix)
            .filter(Objects::nonNull)
            .collect(ImmutableSet.toImmutableSet())
            .asList();
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
