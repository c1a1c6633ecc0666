package com.baselinesentinel.runner;

import com.baselinesentinel.core.config.ConfigLoader;
import com.baselinesentinel.core.config.DomainSettings;
import com.baselinesentinel.core.config.SentinelConfig;
import com.baselinesentinel.core.engine.DomainAnomalyOrchestrator;
import com.baselinesentinel.core.engine.SentinelEngine;
import com.baselinesentinel.core.spi.InventoryService;
import com.baselinesentinel.core.spi.MetricSource;
import com.baselinesentinel.core.spi.NotificationSink;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.elasticache.ElastiCacheClient;
import software.amazon.awssdk.services.rds.RdsClient;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main entry point of the baseline sentinel.
 *
 * <h3>Modes</h3>
 * <ul>
 * <li>default: long-running service. Starts the HTTP server, schedules the
 * daily run and blocks until the JVM shuts down.</li>
 * <li>{@code --once}: run detection a single time and exit, for use from an
 * external cron.</li>
 * </ul>
 *
 * <h3>Configuration</h3>
 * <p>
 * Process settings come from environment variables via {@link RunnerConfig};
 * detection settings come from the YAML file loaded by {@link ConfigLoader}.
 * Each domain names its metric source: {@code prometheus}, {@code rds} or
 * {@code elasticache}.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineSentinelApp {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineSentinelApp.class);

    static final String SOURCE_PROMETHEUS = DomainSettings.DEFAULT_SOURCE;
    static final String SOURCE_RDS = "rds";
    static final String SOURCE_ELASTICACHE = "elasticache";

    private BaselineSentinelApp() {
    }

    public static void main(String[] args) throws InterruptedException {
        boolean once = Arrays.asList(args).contains("--once");

        // 1. Load configuration
        RunnerConfig config = RunnerConfig.fromEnvironment();
        LOG.info("Starting baseline sentinel with config: {}", config);

        SentinelConfig sentinelConfig = ConfigLoader.load(config.getSentinelConfigPath());
        if (sentinelConfig.enabledDomains().isEmpty()) {
            throw new IllegalStateException(
                    "No enabled domains defined. Provide them via "
                            + ConfigLoader.ENV_CONFIG_PATH
                            + " or a classpath " + ConfigLoader.DEFAULT_RESOURCE + " file.");
        }
        LOG.info("Loaded {} enabled domain(s)", sentinelConfig.enabledDomains().size());

        // 2. Collaborators
        List<AutoCloseable> resources = new ArrayList<>();
        InventoryService inventory = inventory(config, resources);
        NotificationSink sink = sink(config, resources);
        ExecutorService domainPool = domainPool(sentinelConfig.enabledDomains().size());

        // 3. Engine
        SentinelEngine engine = new SentinelEngine(sentinelConfig,
                sources(config, sentinelConfig, resources),
                new DomainAnomalyOrchestrator(inventory, sink, domainPool));

        if (once) {
            try {
                engine.run(Clock.systemUTC().instant());
            } finally {
                domainPool.shutdownNow();
                closeAll(resources);
            }
            return;
        }

        // 4. Scheduler and HTTP server, with shutdown hook
        SentinelScheduler scheduler = new SentinelScheduler(engine,
                sentinelConfig.getWindow().zoneId(),
                config.getScheduleTime(),
                config.getScheduleIntervalDays(),
                Clock.systemUTC());
        HealthServer httpServer = new HealthServer(scheduler::trigger, config.getTriggerApiKey());
        httpServer.start(config.getHttpPort());

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            httpServer.stop();
            scheduler.close();
            domainPool.shutdownNow();
            closeAll(resources);
            stopped.countDown();
        }, "sentinel-shutdown"));

        scheduler.start();
        httpServer.markReady();
        stopped.await();
    }

    // ---------------------------------------------------------------
    // Wiring
    // ---------------------------------------------------------------

    /**
     * Build the metric sources the enabled domains name. AWS clients are
     * only created when a domain uses them.
     */
    static Map<String, MetricSource> sources(RunnerConfig config, SentinelConfig sentinelConfig,
            List<AutoCloseable> resources) {
        Set<String> used = new LinkedHashSet<>();
        for (DomainSettings domain : sentinelConfig.enabledDomains()) {
            used.add(domain.getSource());
        }

        Map<String, MetricSource> sources = new LinkedHashMap<>();
        if (used.contains(SOURCE_PROMETHEUS)) {
            sources.put(SOURCE_PROMETHEUS, PrometheusMetricSource.from(config));
        }
        if (!used.contains(SOURCE_RDS) && !used.contains(SOURCE_ELASTICACHE)) {
            return sources;
        }

        Region region = Region.of(config.getAwsRegion());
        CloudWatchClient cloudWatch = CloudWatchClient.builder().region(region).build();
        resources.add(cloudWatch);
        if (used.contains(SOURCE_RDS)) {
            RdsClient rds = RdsClient.builder().region(region).build();
            resources.add(rds);
            sources.put(SOURCE_RDS, new RdsMetricSource(cloudWatch, rds, config.getRdsClusterIdentifiers()));
        }
        if (used.contains(SOURCE_ELASTICACHE)) {
            ElastiCacheClient elastiCache = ElastiCacheClient.builder().region(region).build();
            resources.add(elastiCache);
            RedisKeyspaceScanner scanner = RedisKeyspaceScanner.jedis(
                    (int) config.getMetricsQueryTimeout().toMillis(), config.getRedisScanLimit());
            sources.put(SOURCE_ELASTICACHE, new ElastiCacheMetricSource(cloudWatch, elastiCache,
                    config.getElastiCacheReplicationGroups(), scanner));
        }
        LOG.info("Metric sources {} in region {}", sources.keySet(), region);
        return sources;
    }

    static InventoryService inventory(RunnerConfig config, List<AutoCloseable> resources) {
        if (!config.isInventoryEnabled()) {
            LOG.info("Deployment inventory disabled");
            return (since, until) -> List.of();
        }
        KubernetesClient client = new KubernetesClientBuilder().build();
        resources.add(client);
        return new KubernetesInventoryService(client, config.getKubernetesNamespace());
    }

    static NotificationSink sink(RunnerConfig config, List<AutoCloseable> resources) {
        switch (config.getReportSink()) {
            case KAFKA:
                KafkaReportSink kafka = KafkaReportSink.from(config);
                resources.add(kafka);
                return kafka;
            case LOG:
            default:
                return new LoggingReportSink();
        }
    }

    static ExecutorService domainPool(int domains) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, domains), r -> {
            Thread t = new Thread(r, "domain-fetch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private static void closeAll(List<AutoCloseable> resources) {
        for (AutoCloseable resource : resources) {
            try {
                resource.close();
            } catch (Exception e) {
                LOG.warn("Failed to close {}: {}", resource.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
