package io.ipamsync.clients;

import io.ipamsync.models.NetboxPrefix;

import java.util.List;

/**
 * Handle to one IPAM endpoint.
 */
public interface NetboxClient extends AutoCloseable {

    /**
     * Get all prefixes matching an integrator query, following pagination.
     *
     * @param query stored integrator query; only the part after '?' is used
     */
    List<NetboxPrefix> getPrefixes(String query) throws ApiException;

    String getHostname();

    @Override
    void close();
}
