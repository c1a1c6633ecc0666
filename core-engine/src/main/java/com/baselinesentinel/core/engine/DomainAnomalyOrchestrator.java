package com.baselinesentinel.core.engine;

import com.baselinesentinel.core.model.AnomalyRecord;
import com.baselinesentinel.core.model.AnomalyReport;
import com.baselinesentinel.core.model.DeploymentRecord;
import com.baselinesentinel.core.model.TimeWindow;
import com.baselinesentinel.core.model.WindowPair;
import com.baselinesentinel.core.spi.InventoryService;
import com.baselinesentinel.core.spi.NotificationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs every domain pipeline of one invocation and merges the results.
 *
 * <h3>Flow</h3>
 * <ol>
 * <li>All domains are submitted to the executor at once; they have no
 * ordering dependency.</li>
 * <li>Results are merged into one {@link AnomalyReport} in the order the
 * domains were given. A domain that fails contributes an empty list.</li>
 * <li>An empty report ends the run. Otherwise recent deployments are looked
 * up over {@code [past.start, current.end]}, attached, and the report is
 * published.</li>
 * </ol>
 *
 * <p>
 * Collaborator failures never escape {@link #runAll}: inventory failures
 * leave the deployment list empty, sink failures are logged.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Holds no per-run state; concurrent {@code runAll} calls are safe as long
 * as the collaborators are.
 * </p>
 *
 * @since 1.0.0
 */
public final class DomainAnomalyOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(DomainAnomalyOrchestrator.class);

    private final InventoryService inventory;
    private final NotificationSink sink;
    private final ExecutorService executor;

    /**
     * @param inventory deployment lookup, consulted only for non-empty reports
     * @param sink      receives non-empty reports
     * @param executor  runs the domain pipelines; owned by the caller
     */
    public DomainAnomalyOrchestrator(InventoryService inventory, NotificationSink sink,
            ExecutorService executor) {
        this.inventory = Objects.requireNonNull(inventory, "InventoryService must not be null");
        this.sink = Objects.requireNonNull(sink, "NotificationSink must not be null");
        this.executor = Objects.requireNonNull(executor, "ExecutorService must not be null");
    }

    /**
     * @param windows  current and past window
     * @param fetchers domain pipelines
     * @return merged report; every domain is present, possibly empty
     */
    public AnomalyReport runAll(WindowPair windows, List<DomainFetcher> fetchers) {
        Objects.requireNonNull(windows, "Window pair must not be null");
        Objects.requireNonNull(fetchers, "Domain fetchers must not be null");
        long started = System.nanoTime();
        LOG.info("Detection run over current={} past={} for {} domain(s)",
                windows.getCurrent(), windows.getPast(), fetchers.size());

        List<Future<List<AnomalyRecord>>> futures = new ArrayList<>(fetchers.size());
        for (DomainFetcher fetcher : fetchers) {
            futures.add(submit(fetcher, windows));
        }

        AnomalyReport.Builder builder = AnomalyReport.builder().window(windows);
        for (int i = 0; i < fetchers.size(); i++) {
            String domain = fetchers.get(i).getName();
            builder.domain(domain, collect(domain, futures.get(i)));
        }
        AnomalyReport report = builder.build();

        long elapsedMs = (System.nanoTime() - started) / 1_000_000;
        if (report.isEmpty()) {
            LOG.info("No anomalies found across {} domain(s) in {} ms", fetchers.size(), elapsedMs);
            return report;
        }
        LOG.info("Found {} anomaly(ies) across domains {} in {} ms",
                report.totalAnomalies(), report.getByDomain().keySet(), elapsedMs);

        report = report.withDeployments(recentDeployments(windows.lookbackHorizon()));
        publish(report);
        return report;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Future<List<AnomalyRecord>> submit(DomainFetcher fetcher, WindowPair windows) {
        try {
            return executor.submit(() -> fetcher.fetch(windows));
        } catch (RejectedExecutionException e) {
            LOG.warn("Domain [{}] could not be scheduled: {}", fetcher.getName(), e.getMessage());
            return null;
        }
    }

    private List<AnomalyRecord> collect(String domain, Future<List<AnomalyRecord>> future) {
        if (future == null) {
            return List.of();
        }
        try {
            List<AnomalyRecord> records = future.get();
            return records != null ? records : List.of();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.warn("Domain [{}] failed, reporting no anomalies: {}", domain, cause.toString());
            LOG.debug("Domain [{}] failure detail", domain, cause);
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            LOG.warn("Interrupted while waiting for domain [{}]", domain);
            return List.of();
        }
    }

    private List<DeploymentRecord> recentDeployments(TimeWindow horizon) {
        try {
            List<DeploymentRecord> deployments = inventory.listRecentDeployments(
                    horizon.getStart(), horizon.getEnd());
            LOG.info("{} deployment(s) created within {}", deployments.size(), horizon);
            return deployments;
        } catch (RuntimeException e) {
            LOG.warn("Deployment inventory lookup failed: {}", e.getMessage());
            return List.of();
        }
    }

    private void publish(AnomalyReport report) {
        try {
            sink.publish(report);
        } catch (RuntimeException e) {
            LOG.error("Failed to publish anomaly report", e);
        }
    }
}
