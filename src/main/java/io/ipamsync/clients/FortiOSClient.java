package io.ipamsync.clients;

import io.ipamsync.enums.AddressFamily;
import io.ipamsync.models.FirewallAddress;
import io.ipamsync.models.FirewallAddressGroup;

import java.util.List;

/**
 * Handle to one FortiGate. Every call is scoped to a vdom and selects the
 * IPv4 or IPv6 object table by family.
 * <p>
 * Implementations must allow concurrent calls: vdoms of one FortiGate are
 * reconciled in parallel through the same handle.
 */
public interface FortiOSClient extends AutoCloseable {

    // =================================================================
    // ADDRESS OPERATIONS
    // =================================================================

    List<FirewallAddress> getAddresses(AddressFamily family, String vdom) throws ApiException;

    void addAddress(AddressFamily family, FirewallAddress address, String vdom) throws ApiException;

    /**
     * Number of objects referencing the named address.
     *
     * @throws ApiException if the address is missing or the count cannot be read
     */
    int getAddressReferenceCount(AddressFamily family, String name, String vdom) throws ApiException;

    void deleteAddress(AddressFamily family, String name, String vdom) throws ApiException;

    // =================================================================
    // ADDRESS GROUP OPERATIONS
    // =================================================================

    List<FirewallAddressGroup> getAddressGroups(AddressFamily family, String vdom) throws ApiException;

    void addAddressGroup(AddressFamily family, FirewallAddressGroup group, String vdom) throws ApiException;

    void updateAddressGroup(AddressFamily family, String name, FirewallAddressGroup group, String vdom) throws ApiException;

    String getHostname();

    @Override
    void close();
}
