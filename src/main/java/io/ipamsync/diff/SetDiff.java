package io.ipamsync.diff;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import io.ipamsync.models.FirewallAddressGroup;
import io.ipamsync.models.GroupMember;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Membership differences between an existing and a desired collection.
 * Results keep the iteration order of their source collection, but callers should treat them as sets.
 */
public final class SetDiff {

    private SetDiff() {
        // Utility class - prevent instantiation
    }

    /**
     * Compare two address groups by member name.
     *
     * @throws IllegalArgumentException if either group is null
     */
    public static DiffResult groupDiff(FirewallAddressGroup existing, FirewallAddressGroup desired) {
        if (existing == null || desired == null) {
            throw new IllegalArgumentException("Address group(s) cannot be null");
        }
        return diff(memberNames(existing), memberNames(desired));
    }

    /**
     * Compare two flat lists of raw values (IP addresses / CIDRs) by string equality.
     */
    public static DiffResult listDiff(Collection<String> existing, Collection<String> desired) {
        return diff(distinct(existing), distinct(desired));
    }

    private static DiffResult diff(Set<String> existing, Set<String> desired) {
        return new DiffResult(
            ImmutableList.copyOf(Sets.difference(desired, existing)),
            ImmutableList.copyOf(Sets.difference(existing, desired)));
    }

    private static Set<String> memberNames(FirewallAddressGroup group) {
        Set<String> names = new LinkedHashSet<>();
        if (group.getMember() != null) {
            for (GroupMember member : group.getMember()) {
                if (member != null && member.getName() != null) {
                    names.add(member.getName());
                }
            }
        }
        return names;
    }

    private static Set<String> distinct(Collection<String> values) {
        Set<String> result = new LinkedHashSet<>();
        if (values != null) {
            values.stream().filter(Objects::nonNull).forEach(result::add);
        }
        return result;
    }
}
