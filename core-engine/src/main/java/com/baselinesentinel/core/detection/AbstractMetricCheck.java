package com.baselinesentinel.core.detection;

import com.baselinesentinel.core.config.CheckRule;
import com.baselinesentinel.core.model.Aggregated;
import com.baselinesentinel.core.model.BucketingMode;
import com.baselinesentinel.core.model.LabeledSeries;
import com.baselinesentinel.core.model.TimeWindow;
import com.baselinesentinel.core.normalize.EntityFilter;
import com.baselinesentinel.core.normalize.SeriesNormalizer;
import com.baselinesentinel.core.spi.MetricFetchException;
import com.baselinesentinel.core.spi.MetricQueryResult;
import com.baselinesentinel.core.spi.MetricSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Shared plumbing of the configured checks: the query, the normalizer built
 * from the check's key fields and entity filter, and a fetch helper that
 * turns a non-success response into "no data".
 *
 * <p>
 * {@link #aggregate} yields category histograms when the rule names a code
 * field and gauge tracks otherwise.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class AbstractMetricCheck implements AnomalyCheck {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractMetricCheck.class);

    protected final String name;
    protected final String query;
    protected final SeriesNormalizer normalizer;
    protected final String codeField;
    protected final BucketingMode mode;

    protected AbstractMetricCheck(CheckRule rule) {
        Objects.requireNonNull(rule, "CheckRule must not be null");
        this.name = Objects.requireNonNull(rule.getName(), "Check name must not be null");
        this.query = Objects.requireNonNull(rule.getQuery(),
                "Query must not be null for check '" + name + "'");
        this.normalizer = new SeriesNormalizer(rule.getKeyFields(),
                new EntityFilter(rule.getIncludePrefixes(), rule.getExcludePrefixes()));
        this.codeField = rule.getCodeField();
        this.mode = rule.bucketingMode();
    }

    /**
     * Query one window and normalize it in the shape this rule asks for.
     *
     * @throws MetricFetchException if the query could not be completed
     */
    protected Aggregated aggregate(MetricSource source, TimeWindow window, Duration step)
            throws MetricFetchException {
        return normalizer.normalize(fetch(source, window, step), codeField, mode);
    }

    /**
     * Query one window.
     *
     * @return the series, empty when the source reported a non-success status
     *         or no series
     * @throws MetricFetchException if the query could not be completed
     */
    protected List<LabeledSeries> fetch(MetricSource source, TimeWindow window, Duration step)
            throws MetricFetchException {
        MetricQueryResult result = source.queryRange(query, window.getStart(), window.getEnd(), step);
        if (result == null) {
            LOG.warn("Check [{}]: metric source returned no response for {}", name, window);
            return List.of();
        }
        if (!result.isSuccess()) {
            LOG.warn("Check [{}]: query status '{}' for {}, treating as no data",
                    name, result.getStatus(), window);
        }
        List<LabeledSeries> series = result.seriesOrEmpty();
        LOG.debug("Check [{}]: {} series for {}", name, series.size(), window);
        return series;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name='" + name + "'}";
    }
}
