package com.baselinesentinel.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered value sequence (with parallel timestamps) of one gauge-style
 * entity, e.g. CPU% of a pod.
 *
 * @since 1.0.0
 */
public final class GaugeTrack {

    private final List<Instant> timestamps;
    private final List<Double> values;

    public GaugeTrack(List<Instant> timestamps, List<Double> values) {
        Objects.requireNonNull(timestamps, "Timestamps must not be null");
        Objects.requireNonNull(values, "Values must not be null");
        if (timestamps.size() != values.size()) {
            throw new IllegalArgumentException("Timestamps and values differ in length: "
                    + timestamps.size() + " vs " + values.size());
        }
        this.timestamps = Collections.unmodifiableList(new ArrayList<>(timestamps));
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public List<Instant> getTimestamps() {
        return timestamps;
    }

    public List<Double> getValues() {
        return values;
    }

    /**
     * @return values as a primitive array, in order
     */
    public double[] valueArray() {
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i);
        }
        return array;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof GaugeTrack that))
            return false;
        return timestamps.equals(that.timestamps) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamps, values);
    }

    @Override
    public String toString() {
        return "GaugeTrack" + values;
    }
}
