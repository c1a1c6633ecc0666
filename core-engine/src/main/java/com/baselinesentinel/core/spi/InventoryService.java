package com.baselinesentinel.core.spi;

import com.baselinesentinel.core.model.DeploymentRecord;

import java.time.Instant;
import java.util.List;

/**
 * Cluster inventory lookup, consulted only when a run found anomalies.
 */
public interface InventoryService {

    /**
     * List deployments created within {@code [since, until]} that currently
     * have at least one available replica.
     *
     * @param since horizon start
     * @param until horizon end
     * @return matching deployments, empty if none
     * @throws InventoryException if the inventory cannot be queried
     */
    List<DeploymentRecord> listRecentDeployments(Instant since, Instant until);
}
