package com.baselinesentinel.core.detection;

import com.baselinesentinel.core.config.CheckRule;
import com.baselinesentinel.core.config.DetectionPolicy;
import com.baselinesentinel.core.model.AnomalyRecord;
import com.baselinesentinel.core.model.CategoryHistogram;
import com.baselinesentinel.core.model.EntityKey;
import com.baselinesentinel.core.model.WindowPair;
import com.baselinesentinel.core.spi.MetricFetchException;
import com.baselinesentinel.core.spi.MetricSource;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Request-volume growth per response category between the past and current
 * window.
 *
 * <p>
 * Both windows are bucketed into {@link CategoryHistogram}s by the code label
 * and compared category by category.
 * </p>
 *
 * @since 1.0.0
 */
public class BaselineCheck extends AbstractMetricCheck {

    private final DetectionPolicy policy;

    public BaselineCheck(CheckRule rule) {
        super(rule);
        Objects.requireNonNull(codeField, "Code field must not be null for baseline check '" + name + "'");
        this.policy = DetectionPolicy.fromRule(rule);
    }

    @Override
    public List<AnomalyRecord> run(String domain, MetricSource source, WindowPair windows, Duration step)
            throws MetricFetchException {
        Map<EntityKey, CategoryHistogram> current = aggregate(source, windows.getCurrent(), step).asHistograms();
        if (current.isEmpty()) {
            return List.of();
        }
        Map<EntityKey, CategoryHistogram> past = aggregate(source, windows.getPast(), step).asHistograms();

        return new BaselineComparator(domain, name, policy)
                .compare(measurements(current), measurements(past));
    }

    private static Map<EntityKey, Map<String, Double>> measurements(Map<EntityKey, CategoryHistogram> histograms) {
        Map<EntityKey, Map<String, Double>> result = new LinkedHashMap<>();
        histograms.forEach((key, histogram) -> result.put(key, histogram.asMeasurements()));
        return result;
    }
}
