package com.baselinesentinel.core.detection;

import com.baselinesentinel.core.config.CheckRule;
import com.baselinesentinel.core.config.DetectionPolicy;
import com.baselinesentinel.core.model.AnomalyRecord;
import com.baselinesentinel.core.model.EntityKey;
import com.baselinesentinel.core.model.GaugeTrack;
import com.baselinesentinel.core.model.WindowPair;
import com.baselinesentinel.core.spi.MetricFetchException;
import com.baselinesentinel.core.spi.MetricSource;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Growth of an instance gauge (CPU, connections, memory of a database or
 * cache node) between the past and current window.
 *
 * <p>
 * Each entity's track is reduced to one value with the configured
 * {@link GaugeReducer} and compared under the check's metric name.
 * </p>
 *
 * @since 1.0.0
 */
public class GaugeBaselineCheck extends AbstractMetricCheck {

    private final String metric;
    private final GaugeReducer reducer;
    private final DetectionPolicy policy;

    public GaugeBaselineCheck(CheckRule rule) {
        super(rule);
        this.metric = rule.metricName();
        this.reducer = GaugeReducer.parse(rule.getReduce());
        this.policy = DetectionPolicy.fromRule(rule);
    }

    @Override
    public List<AnomalyRecord> run(String domain, MetricSource source, WindowPair windows, Duration step)
            throws MetricFetchException {
        Map<EntityKey, Map<String, Double>> current = reduce(
                aggregate(source, windows.getCurrent(), step).asSequences());
        if (current.isEmpty()) {
            return List.of();
        }
        Map<EntityKey, Map<String, Double>> past = reduce(
                aggregate(source, windows.getPast(), step).asSequences());

        return new BaselineComparator(domain, name, policy).compare(current, past);
    }

    private Map<EntityKey, Map<String, Double>> reduce(Map<EntityKey, GaugeTrack> tracks) {
        Map<EntityKey, Map<String, Double>> result = new LinkedHashMap<>();
        tracks.forEach((key, track) -> {
            OptionalDouble value = reducer.apply(track.valueArray());
            if (value.isPresent()) {
                result.put(key, Map.of(metric, value.getAsDouble()));
            }
        });
        return result;
    }
}
