package com.baselinesentinel.runner;

import com.baselinesentinel.core.model.DeploymentRecord;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the deployment selection of {@link KubernetesInventoryService}.
 */
class KubernetesInventoryServiceTest {

    private static final Instant SINCE = Instant.parse("2024-01-08T06:00:00Z");
    private static final Instant UNTIL = Instant.parse("2024-01-15T07:00:00Z");

    @Test
    @DisplayName("Should keep available deployments created inside the horizon, newest first")
    void selectsRecentAvailable() {
        List<Deployment> items = List.of(
                deployment("orders", "2024-01-10T10:00:00Z", 2),
                deployment("payments", "2024-01-14T09:30:00Z", 1),
                deployment("old", "2023-12-01T00:00:00Z", 3),
                deployment("future", "2024-01-15T07:00:01Z", 1),
                deployment("scaled-down", "2024-01-12T00:00:00Z", 0));

        List<DeploymentRecord> selected = KubernetesInventoryService.select(items, SINCE, UNTIL);

        assertThat(selected).extracting(DeploymentRecord::getName).containsExactly("payments", "orders");
        assertThat(selected.get(0).getNamespace()).isEqualTo("prod");
        assertThat(selected.get(0).getAvailableReplicas()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should treat both horizon bounds as inclusive")
    void inclusiveBounds() {
        List<Deployment> items = List.of(
                deployment("at-start", SINCE.toString(), 1),
                deployment("at-end", UNTIL.toString(), 1));

        assertThat(KubernetesInventoryService.select(items, SINCE, UNTIL))
                .extracting(DeploymentRecord::getName)
                .containsExactly("at-end", "at-start");
    }

    @Test
    @DisplayName("Should ignore deployments without status or timestamp")
    void ignoresIncomplete() {
        Deployment noStatus = new DeploymentBuilder()
                .withNewMetadata().withName("pending").withNamespace("prod")
                .withCreationTimestamp("2024-01-12T00:00:00Z").endMetadata()
                .build();
        Deployment noTimestamp = new DeploymentBuilder()
                .withNewMetadata().withName("odd").withNamespace("prod").endMetadata()
                .withNewStatus().withAvailableReplicas(1).endStatus()
                .build();

        assertThat(KubernetesInventoryService.select(List.of(noStatus, noTimestamp), SINCE, UNTIL)).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Deployment deployment(String name, String created, int available) {
        return new DeploymentBuilder()
                .withNewMetadata()
                .withName(name)
                .withNamespace("prod")
                .withCreationTimestamp(created)
                .endMetadata()
                .withNewStatus()
                .withAvailableReplicas(available)
                .endStatus()
                .build();
    }
}
