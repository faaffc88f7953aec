package io.ipamsync.clients;

import io.ipamsync.enums.SyncPriority;
import io.ipamsync.models.Integrator;

import java.util.List;

/**
 * Directory of integrators (NAM).
 */
public interface NamClient {

    /**
     * Get all integrators of the given sync priority, with endpoints expanded
     */
    List<Integrator> getIntegrators(SyncPriority priority) throws ApiException;

    /**
     * Get one integrator by id, with endpoints expanded
     */
    Integrator getIntegrator(String id) throws ApiException;
}
