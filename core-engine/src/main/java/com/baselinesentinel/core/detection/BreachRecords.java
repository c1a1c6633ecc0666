package com.baselinesentinel.core.detection;

import com.baselinesentinel.core.model.AnomalyRecord;
import com.baselinesentinel.core.model.AnomalyType;
import com.baselinesentinel.core.model.BreachResult;
import com.baselinesentinel.core.model.EntityKey;

import java.util.List;
import java.util.Locale;

/**
 * Adapts a {@link BreachResult} into an {@link AnomalyRecord}.
 */
final class BreachRecords {

    private BreachRecords() {
    }

    static AnomalyRecord of(String domain, String check, EntityKey entity, String metric, double[] values,
            double threshold, BreachResult result) {
        List<Integer> indices = result.getIndices();
        double peak = Double.NEGATIVE_INFINITY;
        for (int i : indices) {
            peak = Math.max(peak, values[i]);
        }
        return AnomalyRecord.builder()
                .domain(domain)
                .check(check)
                .type(AnomalyType.SUSTAINED_BREACH)
                .entity(entity)
                .metric(metric)
                .currentValue(peak)
                .threshold(threshold)
                .breachIndices(indices)
                .magnitude(result.getRunMagnitudeSum())
                .severityNote(String.format(Locale.ROOT, "%s above %.2f at %d confirmed sample(s), peak %.2f",
                        metric, threshold, indices.size(), peak))
                .build();
    }
}
