package io.ipamsync.clients;

import io.ipamsync.models.SecurityGroup;

import java.util.Optional;

/**
 * Handle to one VMware NSX manager (local or global).
 */
public interface NsxClient extends AutoCloseable {

    /**
     * @return the group, or empty if the manager reports it as not found
     * @throws ApiException on any other failure
     */
    Optional<SecurityGroup> getGroup(String name, boolean globalManager) throws ApiException;

    /**
     * Create or replace the whole group.
     */
    void patchGroup(String name, SecurityGroup group, boolean globalManager) throws ApiException;

    String getHostname();

    @Override
    void close();
}
