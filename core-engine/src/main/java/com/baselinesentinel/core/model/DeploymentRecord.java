package com.baselinesentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A recently created deployment that is serving traffic.
 *
 * @since 1.0.0
 */
public final class DeploymentRecord {

    private final String name;
    private final String namespace;
    private final Instant createdAt;
    private final int availableReplicas;

    public DeploymentRecord(String name, String namespace, Instant createdAt, int availableReplicas) {
        this.name = Objects.requireNonNull(name, "Deployment name must not be null");
        this.namespace = namespace;
        this.createdAt = Objects.requireNonNull(createdAt, "Deployment creation time must not be null");
        this.availableReplicas = availableReplicas;
    }

    public String getName() {
        return name;
    }

    public String getNamespace() {
        return namespace;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public int getAvailableReplicas() {
        return availableReplicas;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DeploymentRecord that))
            return false;
        return availableReplicas == that.availableReplicas
                && name.equals(that.name)
                && Objects.equals(namespace, that.namespace)
                && createdAt.equals(that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, namespace, createdAt, availableReplicas);
    }

    @Override
    public String toString() {
        return "DeploymentRecord{name='" + name + "', namespace='" + namespace
                + "', createdAt=" + createdAt + ", availableReplicas=" + availableReplicas + '}';
    }
}
