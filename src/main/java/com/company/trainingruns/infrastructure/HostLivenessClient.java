package com.company.trainingruns.infrastructure;

import com.company.trainingruns.domain.enums.HostState;

/**
 * Asks the compute-infrastructure layer whether a host still exists.
 */
public interface HostLivenessClient {

    /**
     * @return the host's current state, {@link HostState#NOT_FOUND} if the provider
     *         does not know the id
     * @throws com.company.trainingruns.exception.ExternalServiceException on timeout or API error
     */
    HostState describeHost(String hostId);
}
