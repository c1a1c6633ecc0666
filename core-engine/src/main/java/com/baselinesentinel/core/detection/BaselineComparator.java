package com.baselinesentinel.core.detection;

import com.baselinesentinel.core.config.DetectionPolicy;
import com.baselinesentinel.core.model.AnomalyRecord;
import com.baselinesentinel.core.model.AnomalyType;
import com.baselinesentinel.core.model.EntityKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Locale;
import java.util.Optional;

/**
 * Flags entities whose measurement grew by more than a percentage threshold
 * between the past and the current window.
 *
 * <h3>Guards</h3>
 * <p>
 * For every entity in {@code current} and every measurement the policy
 * covers, in this order:
 * </p>
 * <ol>
 * <li>entity absent from {@code past}: skipped, there is no baseline</li>
 * <li>past value {@code 0}: skipped</li>
 * <li>current value at or below the activity floor: skipped</li>
 * <li>growth above the percent threshold: reported, rounded to two
 * decimals</li>
 * </ol>
 *
 * <p>
 * Both the activity floor and the percent threshold must be passed, so a
 * jump from 1 to 4 requests stays quiet while 10,000 to 14,000 does not.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineComparator {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineComparator.class);

    private final String domain;
    private final String check;
    private final DetectionPolicy policy;

    /**
     * @param domain domain stamped on produced records
     * @param check  check name stamped on produced records, may be {@code null}
     * @param policy floors and thresholds
     */
    public BaselineComparator(String domain, String check, DetectionPolicy policy) {
        this.domain = Objects.requireNonNull(domain, "Domain must not be null");
        this.check = check;
        this.policy = Objects.requireNonNull(policy, "DetectionPolicy must not be null");
    }

    /**
     * @param current measurements per entity in the current window
     * @param past    measurements per entity in the past window
     * @return growth anomalies, in entity then measurement order
     */
    public List<AnomalyRecord> compare(Map<EntityKey, Map<String, Double>> current,
            Map<EntityKey, Map<String, Double>> past) {
        List<AnomalyRecord> records = new ArrayList<>();
        if (current == null || current.isEmpty() || past == null || past.isEmpty()) {
            return records;
        }

        for (Map.Entry<EntityKey, Map<String, Double>> entry : current.entrySet()) {
            EntityKey entity = entry.getKey();
            Map<String, Double> pastMeasurements = past.get(entity);
            if (pastMeasurements == null) {
                LOG.trace("[{}] {} has no baseline, skipping", check, entity);
                continue;
            }
            for (Map.Entry<String, Double> measurement : entry.getValue().entrySet()) {
                compareOne(entity, measurement.getKey(), measurement.getValue(), pastMeasurements)
                        .ifPresent(records::add);
            }
        }
        return records;
    }

    private Optional<AnomalyRecord> compareOne(EntityKey entity, String metric, Double currentValue,
            Map<String, Double> pastMeasurements) {
        Optional<Double> threshold = policy.percentThresholdFor(metric);
        if (threshold.isEmpty() || currentValue == null) {
            return Optional.empty();
        }
        double pastValue = pastMeasurements.getOrDefault(metric, 0.0);
        if (pastValue == 0) {
            return Optional.empty();
        }
        double floor = policy.minActivityFor(metric);
        if (currentValue <= floor) {
            LOG.trace("[{}] {} {}={} below activity floor {}", check, entity, metric, currentValue, floor);
            return Optional.empty();
        }

        double percentChange = (currentValue - pastValue) / pastValue * 100;
        if (!(percentChange > threshold.get())) {
            return Optional.empty();
        }

        double rounded = round2(percentChange);
        LOG.debug("[{}] {} {} grew {}% ({} -> {})", check, entity, metric, rounded, pastValue, currentValue);
        return Optional.of(AnomalyRecord.builder()
                .domain(domain)
                .check(check)
                .type(AnomalyType.BASELINE_GROWTH)
                .entity(entity)
                .metric(metric)
                .currentValue(currentValue)
                .pastValue(pastValue)
                .percentChange(rounded)
                .threshold(threshold.get())
                .magnitude(rounded)
                .severityNote(String.format(Locale.ROOT, "%s up %.2f%% (%.2f -> %.2f, threshold %.2f%%)",
                        metric, rounded, pastValue, currentValue, threshold.get()))
                .build());
    }

    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
