package com.baselinesentinel.runner;

import com.baselinesentinel.core.model.DeploymentRecord;
import com.baselinesentinel.core.spi.InventoryException;
import com.baselinesentinel.core.spi.InventoryService;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link InventoryService} that lists Deployments through the Kubernetes API.
 *
 * <p>
 * A Deployment is reported when it has at least one available replica and
 * its creation timestamp falls within the requested horizon. Results are
 * ordered newest first.
 * </p>
 */
public final class KubernetesInventoryService implements InventoryService {

    private static final Logger LOG = LoggerFactory.getLogger(KubernetesInventoryService.class);

    private final KubernetesClient client;
    private final String namespace;

    /**
     * @param client    fabric8 client, owned by the caller
     * @param namespace namespace to list; blank means every namespace
     */
    public KubernetesInventoryService(KubernetesClient client, String namespace) {
        this.client = Objects.requireNonNull(client, "KubernetesClient must not be null");
        this.namespace = namespace == null ? "" : namespace.trim();
    }

    @Override
    public List<DeploymentRecord> listRecentDeployments(Instant since, Instant until) {
        List<Deployment> items;
        try {
            items = namespace.isEmpty()
                    ? client.apps().deployments().inAnyNamespace().list().getItems()
                    : client.apps().deployments().inNamespace(namespace).list().getItems();
        } catch (KubernetesClientException e) {
            throw new InventoryException("Failed to list deployments"
                    + (namespace.isEmpty() ? "" : " in namespace " + namespace), e);
        }
        List<DeploymentRecord> recent = select(items, since, until);
        LOG.debug("{} of {} deployment(s) created within [{}, {}]", recent.size(), items.size(), since, until);
        return recent;
    }

    /**
     * Keep available Deployments created within {@code [since, until]}.
     */
    static List<DeploymentRecord> select(List<Deployment> deployments, Instant since, Instant until) {
        return deployments.stream()
                .map(KubernetesInventoryService::toRecord)
                .flatMap(Optional::stream)
                .filter(r -> r.getAvailableReplicas() > 0)
                .filter(r -> !r.getCreatedAt().isBefore(since) && !r.getCreatedAt().isAfter(until))
                .sorted(Comparator.comparing(DeploymentRecord::getCreatedAt).reversed())
                .toList();
    }

    private static Optional<DeploymentRecord> toRecord(Deployment deployment) {
        if (deployment.getMetadata() == null || deployment.getMetadata().getCreationTimestamp() == null) {
            return Optional.empty();
        }
        Instant created;
        try {
            created = Instant.parse(deployment.getMetadata().getCreationTimestamp());
        } catch (DateTimeParseException e) {
            LOG.debug("Ignoring deployment {} with unparseable creation timestamp '{}'",
                    deployment.getMetadata().getName(), deployment.getMetadata().getCreationTimestamp());
            return Optional.empty();
        }
        Integer available = deployment.getStatus() != null ? deployment.getStatus().getAvailableReplicas() : null;
        return Optional.of(new DeploymentRecord(
                deployment.getMetadata().getName(),
                deployment.getMetadata().getNamespace(),
                created,
                available == null ? 0 : available));
    }
}
