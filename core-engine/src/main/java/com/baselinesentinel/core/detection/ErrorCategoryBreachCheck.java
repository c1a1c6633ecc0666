package com.baselinesentinel.core.detection;

import com.baselinesentinel.core.config.CheckRule;
import com.baselinesentinel.core.config.DetectionPolicy;
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
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Sustained error counts per response category, e.g. mesh {@code 5xx} and
 * {@code 0DC} per destination service.
 *
 * <p>
 * Series are grouped by key fields plus category; each category with a
 * configured threshold runs through {@link BreachDetector}. Records are
 * returned heaviest run first.
 * </p>
 *
 * @since 1.0.0
 */
public class ErrorCategoryBreachCheck extends AbstractMetricCheck {

    private static final Logger LOG = LoggerFactory.getLogger(ErrorCategoryBreachCheck.class);

    private final DetectionPolicy policy;

    public ErrorCategoryBreachCheck(CheckRule rule) {
        super(rule);
        Objects.requireNonNull(codeField, "Code field must not be null for error breach check '" + name + "'");
        this.policy = DetectionPolicy.fromRule(rule);
    }

    @Override
    public List<AnomalyRecord> run(String domain, MetricSource source, WindowPair windows, Duration step)
            throws MetricFetchException {
        Map<EntityKey, GaugeTrack> tracks = normalizer.categorySequences(
                fetch(source, windows.getCurrent(), step), codeField, mode);

        List<AnomalyRecord> records = new ArrayList<>();
        for (Map.Entry<EntityKey, GaugeTrack> entry : tracks.entrySet()) {
            EntityKey key = entry.getKey();
            String category = key.get(key.size() - 1);
            Double threshold = policy.getBreachThresholds().get(category);
            if (threshold == null) {
                continue;
            }
            double[] values = entry.getValue().valueArray();
            BreachResult result = BreachDetector.detect(values, threshold, policy.getMinConsecutive());
            if (!result.isBreached()) {
                continue;
            }
            EntityKey entity = EntityKey.of(key.getComponents().subList(0, key.size() - 1));
            LOG.debug("Check [{}]: {} {} breached {} (magnitude {})",
                    name, entity, category, threshold, result.getRunMagnitudeSum());
            records.add(BreachRecords.of(domain, name, entity, category, values, threshold, result));
        }
        records.sort(Comparator.comparingDouble(AnomalyRecord::getMagnitude).reversed());
        return records;
    }
}
