package com.baselinesentinel.core.config;

import com.baselinesentinel.core.model.Category;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolved thresholds handed to the detection components.
 *
 * <p>
 * Keys are category labels ({@code 2xx}, {@code 5xx}, {@code 0DC}, ...) or
 * gauge metric names. Category labels are canonicalised, so {@code 0dc} and
 * {@code 0DC} name the same bucket.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionPolicy {

    private final Map<String, Double> minActivity;
    private final Map<String, Double> percentThreshold;
    private final Map<String, Double> breachThresholds;
    private final int minConsecutive;

    private DetectionPolicy(Builder builder) {
        this.minActivity = Collections.unmodifiableMap(new LinkedHashMap<>(builder.minActivity));
        this.percentThreshold = Collections.unmodifiableMap(new LinkedHashMap<>(builder.percentThreshold));
        this.breachThresholds = Collections.unmodifiableMap(new LinkedHashMap<>(builder.breachThresholds));
        this.minConsecutive = builder.minConsecutive;
    }

    /**
     * Build the policy of one configured check.
     *
     * @param rule validated check rule
     * @return policy
     */
    public static DetectionPolicy fromRule(CheckRule rule) {
        Objects.requireNonNull(rule, "CheckRule must not be null");
        Builder builder = builder().minConsecutive(rule.getMinConsecutive());
        rule.getMinActivity().forEach((k, v) -> builder.minActivity(k, v.doubleValue()));
        rule.getPercentThreshold().forEach((k, v) -> builder.percentThreshold(k, v.doubleValue()));
        rule.getThresholds().forEach((k, v) -> builder.breachThreshold(k, v.doubleValue()));
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link DetectionPolicy}.
     */
    public static class Builder {
        private final Map<String, Double> minActivity = new LinkedHashMap<>();
        private final Map<String, Double> percentThreshold = new LinkedHashMap<>();
        private final Map<String, Double> breachThresholds = new LinkedHashMap<>();
        private int minConsecutive = 1;

        public Builder minActivity(String key, double floor) {
            minActivity.put(canonical(key), floor);
            return this;
        }

        public Builder percentThreshold(String key, double percent) {
            percentThreshold.put(canonical(key), percent);
            return this;
        }

        public Builder breachThreshold(String key, double threshold) {
            breachThresholds.put(canonical(key), threshold);
            return this;
        }

        public Builder minConsecutive(int minConsecutive) {
            this.minConsecutive = minConsecutive;
            return this;
        }

        public DetectionPolicy build() {
            return new DetectionPolicy(this);
        }
    }

    // ---------------------------------------------------------------
    // Lookups
    // ---------------------------------------------------------------

    /**
     * @return activity floor, {@code 0} when none is configured
     */
    public double minActivityFor(String key) {
        return minActivity.getOrDefault(canonical(key), 0.0);
    }

    public Optional<Double> percentThresholdFor(String key) {
        return Optional.ofNullable(percentThreshold.get(canonical(key)));
    }

    public Map<String, Double> getBreachThresholds() {
        return breachThresholds;
    }

    public Map<String, Double> getMinActivity() {
        return minActivity;
    }

    public Map<String, Double> getPercentThreshold() {
        return percentThreshold;
    }

    public int getMinConsecutive() {
        return minConsecutive;
    }

    static String canonical(String key) {
        Objects.requireNonNull(key, "Policy key must not be null");
        String trimmed = key.trim();
        return Category.fromLabel(trimmed).map(Category::label).orElse(trimmed);
    }

    @Override
    public String toString() {
        return "DetectionPolicy{minActivity=" + minActivity
                + ", percentThreshold=" + percentThreshold
                + ", breachThresholds=" + breachThresholds
                + ", minConsecutive=" + minConsecutive + '}';
    }
}
