package com.baselinesentinel.core.detection;

import com.baselinesentinel.core.config.CheckRule;
import com.baselinesentinel.core.model.AnomalyRecord;
import com.baselinesentinel.core.model.BreachResult;
import com.baselinesentinel.core.model.EntityKey;
import com.baselinesentinel.core.model.GaugeTrack;
import com.baselinesentinel.core.model.WindowPair;
import com.baselinesentinel.core.spi.MetricFetchException;
import com.baselinesentinel.core.spi.MetricSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Gauge above a fixed threshold for several consecutive samples of the
 * current window, e.g. pod CPU% above 80.
 *
 * @since 1.0.0
 */
public class SustainedBreachCheck extends AbstractMetricCheck {

    private static final Logger LOG = LoggerFactory.getLogger(SustainedBreachCheck.class);

    private final String metric;
    private final double threshold;
    private final int minConsecutive;

    public SustainedBreachCheck(CheckRule rule) {
        super(rule);
        this.metric = rule.metricName();
        this.threshold = Objects.requireNonNull(rule.getThreshold(),
                "Threshold must not be null for breach check '" + name + "'");
        this.minConsecutive = rule.getMinConsecutive();
    }

    @Override
    public List<AnomalyRecord> run(String domain, MetricSource source, WindowPair windows, Duration step)
            throws MetricFetchException {
        Map<EntityKey, GaugeTrack> tracks = aggregate(source, windows.getCurrent(), step).asSequences();

        List<AnomalyRecord> records = new ArrayList<>();
        for (Map.Entry<EntityKey, GaugeTrack> entry : tracks.entrySet()) {
            double[] values = entry.getValue().valueArray();
            BreachResult result = BreachDetector.detect(values, threshold, minConsecutive);
            if (!result.isBreached()) {
                continue;
            }
            LOG.debug("Check [{}]: {} breached {} at {}", name, entry.getKey(), threshold, result.getIndices());
            records.add(BreachRecords.of(domain, name, entry.getKey(), metric, values, threshold, result));
        }
        return records;
    }
}
