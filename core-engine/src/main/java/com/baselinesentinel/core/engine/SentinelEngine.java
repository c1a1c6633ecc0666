package com.baselinesentinel.core.engine;

import com.baselinesentinel.core.config.DomainSettings;
import com.baselinesentinel.core.config.SentinelConfig;
import com.baselinesentinel.core.model.AnomalyReport;
import com.baselinesentinel.core.model.WindowPair;
import com.baselinesentinel.core.spi.MetricSource;
import com.baselinesentinel.core.window.TimeWindowResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Entry point of one detection run: resolve windows, run every enabled
 * domain, return the merged report.
 *
 * <p>
 * Domains and their checks are built once from the configuration; each
 * {@link #run(Instant)} call is independent of the others.
 * </p>
 *
 * @since 1.0.0
 */
public final class SentinelEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelEngine.class);

    private final SentinelConfig config;
    private final DomainAnomalyOrchestrator orchestrator;
    private final List<DomainFetcher> domains;

    /**
     * @param config       validated configuration
     * @param sources      metric sources by the name domains refer to
     * @param orchestrator runs and merges the domains
     * @throws IllegalStateException if a domain names an unknown source
     */
    public SentinelEngine(SentinelConfig config, Map<String, MetricSource> sources,
            DomainAnomalyOrchestrator orchestrator) {
        this.config = Objects.requireNonNull(config, "SentinelConfig must not be null");
        Objects.requireNonNull(sources, "Metric sources must not be null");
        this.orchestrator = Objects.requireNonNull(orchestrator, "Orchestrator must not be null");

        Duration step = config.getWindow().stepDuration();
        List<DomainFetcher> built = new ArrayList<>();
        for (DomainSettings settings : config.enabledDomains()) {
            MetricSource source = sources.get(settings.getSource());
            if (source == null) {
                throw new IllegalStateException("Domain '" + settings.getName() + "' uses unknown source '"
                        + settings.getSource() + "'. Available: " + new TreeSet<>(sources.keySet()));
            }
            built.add(MetricDomain.from(settings, source, step));
        }
        this.domains = Collections.unmodifiableList(built);
        LOG.info("Sentinel engine ready with domains {}", built.stream().map(DomainFetcher::getName).toList());
    }

    /**
     * @param now instant the run is anchored at
     * @return merged report
     */
    public AnomalyReport run(Instant now) {
        return orchestrator.runAll(resolveWindows(now), domains);
    }

    public WindowPair resolveWindows(Instant now) {
        return TimeWindowResolver.resolve(now, config.getWindow());
    }

    public List<DomainFetcher> getDomains() {
        return domains;
    }
}
