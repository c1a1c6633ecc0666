package com.baselinesentinel.core.detection;

import com.baselinesentinel.core.model.BreachResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Sustained-breach detector over an ordered value sequence.
 *
 * <h3>Algorithm</h3>
 * <p>
 * A counter of consecutive over-threshold samples is kept while walking
 * positions {@code 0 .. length - 2}. The final sample is never examined, so a
 * breach that only completes on the last sample is not reported. Once the
 * counter reaches {@code minConsecutive}, every further over-threshold
 * position of the run is recorded. Any sample at or below the threshold
 * resets the counter.
 * </p>
 *
 * <p>
 * The run magnitude is the value-sum of the recorded positions of one run;
 * the result carries the largest such sum across all runs. It ranks entities
 * that breach at the same time.
 * </p>
 *
 * <p>
 * {@code minConsecutive <= 0} behaves like {@code 1}. Sequences shorter than
 * two samples never breach.
 * </p>
 *
 * @since 1.0.0
 */
public final class BreachDetector {

    private BreachDetector() {
    }

    /**
     * @param values         ordered samples; must not be {@code null}
     * @param threshold      strict upper bound
     * @param minConsecutive samples above threshold needed to confirm
     * @return confirmed positions and heaviest run magnitude
     */
    public static BreachResult detect(double[] values, double threshold, int minConsecutive) {
        Objects.requireNonNull(values, "Values must not be null");
        int required = Math.max(1, minConsecutive);

        List<Integer> indices = new ArrayList<>();
        int count = 0;
        double runSum = 0;
        double maxSum = 0;

        for (int i = 0; i < values.length - 1; i++) {
            if (values[i] > threshold) {
                count++;
                if (count >= required) {
                    indices.add(i);
                    runSum += values[i];
                    maxSum = Math.max(maxSum, runSum);
                }
            } else {
                count = 0;
                runSum = 0;
            }
        }

        if (indices.isEmpty()) {
            return BreachResult.none();
        }
        return new BreachResult(indices, maxSum);
    }

    /**
     * Boxed variant.
     *
     * @see #detect(double[], double, int)
     */
    public static BreachResult detect(List<Double> values, double threshold, int minConsecutive) {
        Objects.requireNonNull(values, "Values must not be null");
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            Double v = values.get(i);
            array[i] = v != null ? v : Double.NaN;
        }
        return detect(array, threshold, minConsecutive);
    }
}
