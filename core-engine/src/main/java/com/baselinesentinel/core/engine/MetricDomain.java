package com.baselinesentinel.core.engine;

import com.baselinesentinel.core.config.DomainSettings;
import com.baselinesentinel.core.detection.AnomalyCheck;
import com.baselinesentinel.core.detection.CheckFactory;
import com.baselinesentinel.core.model.AnomalyRecord;
import com.baselinesentinel.core.model.WindowPair;
import com.baselinesentinel.core.spi.MetricFetchException;
import com.baselinesentinel.core.spi.MetricSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A configured domain whose checks all query the same metric source.
 *
 * <p>
 * Checks run in configuration order. The first failing query fails the whole
 * domain; the orchestrator then reports it with no anomalies.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricDomain implements DomainFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(MetricDomain.class);

    private final String name;
    private final List<AnomalyCheck> checks;
    private final MetricSource source;
    private final Duration step;

    /**
     * @throws IllegalArgumentException if a check cannot work with
     *                                  {@code source}
     */
    public MetricDomain(String name, List<AnomalyCheck> checks, MetricSource source, Duration step) {
        this.name = Objects.requireNonNull(name, "Domain name must not be null");
        this.checks = List.copyOf(Objects.requireNonNull(checks, "Checks must not be null"));
        this.source = Objects.requireNonNull(source, "MetricSource must not be null");
        this.step = Objects.requireNonNull(step, "Step must not be null");
        for (AnomalyCheck check : this.checks) {
            check.verifySource(source);
        }
    }

    /**
     * Build a domain from its configuration.
     *
     * @param settings validated domain settings
     * @param source   metric source
     * @param step     query resolution
     * @return domain
     */
    public static MetricDomain from(DomainSettings settings, MetricSource source, Duration step) {
        Objects.requireNonNull(settings, "DomainSettings must not be null");
        return new MetricDomain(settings.getName(), CheckFactory.createAll(settings.getChecks()), source, step);
    }

    @Override
    public List<AnomalyRecord> fetch(WindowPair windows) throws MetricFetchException {
        List<AnomalyRecord> records = new ArrayList<>();
        for (AnomalyCheck check : checks) {
            List<AnomalyRecord> found = check.run(name, source, windows, step);
            if (!found.isEmpty()) {
                LOG.info("Domain [{}] check [{}]: {} anomaly(ies)", name, check.getName(), found.size());
            }
            records.addAll(found);
        }
        return records;
    }

    @Override
    public String getName() {
        return name;
    }

    public List<AnomalyCheck> getChecks() {
        return checks;
    }

    @Override
    public String toString() {
        return "MetricDomain{name='" + name + "', checks=" + checks + '}';
    }
}
