package com.baselinesentinel.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fixed-shape request counts per {@link Category}.
 *
 * <p>
 * Every category of the histogram's {@link BucketingMode} is present from
 * construction with a count of zero, so readers never need existence checks.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Mutable and <strong>not</strong> thread-safe; histograms are built by one
 * normalizer call and then only read.
 * </p>
 *
 * @since 1.0.0
 */
public final class CategoryHistogram {

    private final BucketingMode mode;
    private final EnumMap<Category, Long> counts = new EnumMap<>(Category.class);

    public CategoryHistogram(BucketingMode mode) {
        this.mode = Objects.requireNonNull(mode, "Bucketing mode must not be null");
        for (Category category : mode.categories()) {
            counts.put(category, 0L);
        }
    }

    /**
     * Add to a bucket. Categories outside the mode are counted as
     * {@link Category#UNKNOWN}.
     *
     * @param category target bucket
     * @param count    amount to add
     */
    public void add(Category category, long count) {
        Category target = counts.containsKey(category) ? category : Category.UNKNOWN;
        counts.merge(target, count, Long::sum);
    }

    /**
     * @param category bucket
     * @return count, {@code 0} for categories outside the mode
     */
    public long get(Category category) {
        return counts.getOrDefault(category, 0L);
    }

    public BucketingMode getMode() {
        return mode;
    }

    /**
     * @return unmodifiable view of the counts in category order
     */
    public Map<Category, Long> getCounts() {
        return Collections.unmodifiableMap(counts);
    }

    /**
     * View the histogram as comparator measurements keyed by category label.
     *
     * @return label → count, in category order
     */
    public Map<String, Double> asMeasurements() {
        Map<String, Double> measurements = new LinkedHashMap<>();
        counts.forEach((category, count) -> measurements.put(category.label(), count.doubleValue()));
        return measurements;
    }

    public long total() {
        long total = 0;
        for (long count : counts.values()) {
            total += count;
        }
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CategoryHistogram that))
            return false;
        return mode == that.mode && counts.equals(that.counts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, counts);
    }

    @Override
    public String toString() {
        return "CategoryHistogram" + asMeasurements();
    }
}
