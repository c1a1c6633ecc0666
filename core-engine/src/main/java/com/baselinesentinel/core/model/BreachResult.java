package com.baselinesentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of sustained-breach detection over one value sequence.
 *
 * @since 1.0.0
 */
public final class BreachResult {

    private static final BreachResult NONE = new BreachResult(List.of(), 0);

    private final List<Integer> indices;
    private final double runMagnitudeSum;

    public BreachResult(List<Integer> indices, double runMagnitudeSum) {
        Objects.requireNonNull(indices, "Indices must not be null");
        this.indices = Collections.unmodifiableList(new ArrayList<>(indices));
        this.runMagnitudeSum = runMagnitudeSum;
    }

    public static BreachResult none() {
        return NONE;
    }

    /**
     * @return 0-based positions at which a sustained breach was confirmed
     */
    public List<Integer> getIndices() {
        return indices;
    }

    /**
     * @return value-sum of the heaviest confirmed run
     */
    public double getRunMagnitudeSum() {
        return runMagnitudeSum;
    }

    public boolean isBreached() {
        return !indices.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BreachResult that))
            return false;
        return Double.compare(runMagnitudeSum, that.runMagnitudeSum) == 0
                && indices.equals(that.indices);
    }

    @Override
    public int hashCode() {
        return Objects.hash(indices, runMagnitudeSum);
    }

    @Override
    public String toString() {
        return "BreachResult{indices=" + indices + ", runMagnitudeSum=" + runMagnitudeSum + '}';
    }
}
