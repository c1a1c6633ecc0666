package com.baselinesentinel.core.engine;

import com.baselinesentinel.core.model.AnomalyRecord;
import com.baselinesentinel.core.model.AnomalyReport;
import com.baselinesentinel.core.model.AnomalyType;
import com.baselinesentinel.core.model.DeploymentRecord;
import com.baselinesentinel.core.model.EntityKey;
import com.baselinesentinel.core.model.TimeWindow;
import com.baselinesentinel.core.model.WindowPair;
import com.baselinesentinel.core.spi.InventoryException;
import com.baselinesentinel.core.spi.InventoryService;
import com.baselinesentinel.core.spi.MetricFetchException;
import com.baselinesentinel.core.spi.NotificationException;
import com.baselinesentinel.core.spi.NotificationSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DomainAnomalyOrchestrator}.
 */
class DomainAnomalyOrchestratorTest {

    private static final Instant CURRENT = Instant.parse("2024-01-15T06:00:00Z");
    private static final Instant PAST = Instant.parse("2024-01-08T06:00:00Z");

    private ExecutorService executor;
    private RecordingInventory inventory;
    private RecordingSink sink;
    private DomainAnomalyOrchestrator orchestrator;
    private WindowPair windows;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(3);
        inventory = new RecordingInventory();
        sink = new RecordingSink();
        orchestrator = new DomainAnomalyOrchestrator(inventory, sink, executor);
        windows = new WindowPair(
                TimeWindow.of(CURRENT, CURRENT.plus(Duration.ofHours(1))),
                TimeWindow.of(PAST, PAST.plus(Duration.ofHours(1))));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Should keep healthy domains when another domain fails")
    void shouldIsolateDomainFailures() {
        AnomalyReport report = orchestrator.runAll(windows, List.of(
                domain("database", anomaly("database", "db-1")),
                failing("cache"),
                domain("application")));

        assertThat(report.getByDomain()).containsOnlyKeys("database", "cache", "application");
        assertThat(report.anomaliesFor("database")).hasSize(1);
        assertThat(report.anomaliesFor("cache")).isEmpty();
        assertThat(report.anomaliesFor("application")).isEmpty();
        assertThat(report.totalAnomalies()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep the given domain order in the report")
    void shouldPreserveDomainOrder() {
        AnomalyReport report = orchestrator.runAll(windows, List.of(
                domain("cache"), domain("application"), domain("database")));

        assertThat(report.getByDomain().keySet()).containsExactly("cache", "application", "database");
    }

    @Test
    @DisplayName("Should skip inventory and sink when nothing is anomalous")
    void shouldNotEscalateEmptyReport() {
        AnomalyReport report = orchestrator.runAll(windows, List.of(domain("database"), failing("cache")));

        assertThat(report.isEmpty()).isTrue();
        assertThat(report.getWindow()).isEqualTo(windows);
        assertThat(inventory.calls).isEmpty();
        assertThat(sink.published).isEmpty();
    }

    @Test
    @DisplayName("Should look up deployments over the whole horizon and publish once")
    void shouldEscalateNonEmptyReport() {
        inventory.deployments = List.of(new DeploymentRecord("orders", "prod", CURRENT, 3));

        AnomalyReport report = orchestrator.runAll(windows, List.of(domain("database", anomaly("database", "db-1"))));

        assertThat(inventory.calls).containsExactly(List.of(PAST, CURRENT.plus(Duration.ofHours(1))));
        assertThat(report.getDeployments()).extracting(DeploymentRecord::getName).containsExactly("orders");
        assertThat(sink.published).containsExactly(report);
    }

    @Test
    @DisplayName("Should still publish when the inventory fails and survive a failing sink")
    void shouldSurviveCollaboratorFailures() {
        inventory.failure = new InventoryException("forbidden", null);
        sink.failure = new NotificationException("broker down", null);

        AnomalyReport report = orchestrator.runAll(windows, List.of(domain("database", anomaly("database", "db-1"))));

        assertThat(report.totalAnomalies()).isEqualTo(1);
        assertThat(report.getDeployments()).isEmpty();
        assertThat(sink.attempts).isEqualTo(1);
    }

    @Test
    @DisplayName("Should return an empty report for no domains")
    void shouldHandleNoDomains() {
        AnomalyReport report = orchestrator.runAll(windows, List.of());

        assertThat(report.getByDomain()).isEmpty();
        assertThat(report.isEmpty()).isTrue();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static DomainFetcher domain(String name, AnomalyRecord... records) {
        return new DomainFetcher() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public List<AnomalyRecord> fetch(WindowPair windows) {
                return List.of(records);
            }
        };
    }

    private static DomainFetcher failing(String name) {
        return new DomainFetcher() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public List<AnomalyRecord> fetch(WindowPair windows) throws MetricFetchException {
                throw new MetricFetchException("timeout querying " + name);
            }
        };
    }

    private static AnomalyRecord anomaly(String domain, String entity) {
        return AnomalyRecord.builder()
                .domain(domain)
                .type(AnomalyType.BASELINE_GROWTH)
                .entity(EntityKey.of(entity))
                .metric("cpu")
                .currentValue(90)
                .pastValue(40.0)
                .percentChange(125.0)
                .threshold(50)
                .build();
    }

    private static class RecordingInventory implements InventoryService {
        final List<List<Instant>> calls = new CopyOnWriteArrayList<>();
        List<DeploymentRecord> deployments = List.of();
        RuntimeException failure;

        @Override
        public List<DeploymentRecord> listRecentDeployments(Instant since, Instant until) {
            calls.add(List.of(since, until));
            if (failure != null) {
                throw failure;
            }
            return deployments;
        }
    }

    private static class RecordingSink implements NotificationSink {
        final List<AnomalyReport> published = new ArrayList<>();
        int attempts;
        RuntimeException failure;

        @Override
        public void publish(AnomalyReport report) {
            attempts++;
            if (failure != null) {
                throw failure;
            }
            published.add(report);
        }
    }
}
