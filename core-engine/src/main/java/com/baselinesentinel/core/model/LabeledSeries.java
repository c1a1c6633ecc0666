package com.baselinesentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One labelled time series as returned by the metric source for a single
 * dimension combination.
 *
 * <p>
 * Labels are free-form: the metric source does not guarantee any schema, so
 * every accessor is total. {@link #label(String)} falls back to
 * {@value #UNKNOWN} for absent or blank labels.
 * </p>
 *
 * <h3>Ordering</h3>
 * <p>
 * Points are kept in the order they were supplied, which the metric source
 * guarantees to be ascending by timestamp.
 * </p>
 *
 * @since 1.0.0
 */
public final class LabeledSeries {

    /** Placeholder used for missing label values. */
    public static final String UNKNOWN = "unknown";

    private final Map<String, String> labels;
    private final List<RawSeriesPoint> points;

    /**
     * @param labels label map; {@code null} is treated as empty
     * @param points samples; {@code null} is treated as empty
     */
    public LabeledSeries(Map<String, String> labels, List<RawSeriesPoint> points) {
        this.labels = labels != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(labels))
                : Map.of();
        this.points = points != null
                ? Collections.unmodifiableList(new ArrayList<>(points))
                : List.of();
    }

    // ---------------------------------------------------------------
    // Label accessors
    // ---------------------------------------------------------------

    /**
     * Retrieve a label value.
     *
     * @param name label name
     * @return optional containing the trimmed value, empty if absent or blank
     */
    public Optional<String> getLabel(String name) {
        String raw = labels.get(name);
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(raw.trim());
    }

    /**
     * Retrieve a label value, defaulting to {@value #UNKNOWN}.
     *
     * @param name label name
     * @return the trimmed label value or {@value #UNKNOWN}
     */
    public String label(String name) {
        return getLabel(name).orElse(UNKNOWN);
    }

    /**
     * Build the grouping key for this series from the given label names.
     *
     * @param keyFields ordered label names; must not be {@code null}
     * @return entity key with one component per field
     */
    public EntityKey keyOf(List<String> keyFields) {
        Objects.requireNonNull(keyFields, "Key fields must not be null");
        List<String> components = new ArrayList<>(keyFields.size());
        for (String field : keyFields) {
            components.add(label(field));
        }
        return EntityKey.of(components);
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    // ---------------------------------------------------------------
    // Point accessors
    // ---------------------------------------------------------------

    public List<RawSeriesPoint> getPoints() {
        return points;
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    /**
     * @return exact sum of all finite point values
     */
    public double sum() {
        double total = 0;
        for (RawSeriesPoint point : points) {
            if (Double.isFinite(point.getValue())) {
                total += point.getValue();
            }
        }
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LabeledSeries that))
            return false;
        return labels.equals(that.labels) && points.equals(that.points);
    }

    @Override
    public int hashCode() {
        return Objects.hash(labels, points);
    }

    @Override
    public String toString() {
        return "LabeledSeries" + labels + "[" + points.size() + " points]";
    }
}
