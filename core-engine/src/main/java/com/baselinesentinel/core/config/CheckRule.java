package com.baselinesentinel.core.config;

import com.baselinesentinel.core.model.BucketingMode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Describes a single check of a metric domain, loaded from configuration.
 *
 * <p>
 * Supported check types:
 * </p>
 * <ul>
 * <li>{@code baseline}: growth between the past and current window; with a
 * {@code codeField} the series are bucketed into response categories,
 * without one each entity's gauge is reduced to a scalar</li>
 * <li>{@code breach}: sustained threshold breach within the current window;
 * with a {@code codeField} each response category is checked against its own
 * threshold</li>
 * <li>{@code bigkeys}: keys of a cache node larger than {@code threshold}
 * megabytes; needs no query and reads the domain's source directly</li>
 * </ul>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization to verify
 * that all required fields for the declared type are present and valid.
 * </p>
 *
 * @since 1.0.0
 */
public class CheckRule {

    public static final String TYPE_BASELINE = "baseline";
    public static final String TYPE_BREACH = "breach";
    public static final String TYPE_BIGKEYS = "bigkeys";

    /** Reducers accepted for gauge baselines. */
    public static final Set<String> REDUCERS = Set.of("last", "mean", "max", "sum");

    /** Unique check name used in anomaly records. */
    private String name;

    /** Check type: "baseline" or "breach". */
    private String type;

    /** PromQL range query. */
    private String query;

    /** Labels forming the entity key, in order. */
    private List<String> keyFields = new ArrayList<>();

    /** Label carrying the status/response code; enables category bucketing. */
    private String codeField;

    /** "status_code" or "response_code" (the latter enables the 0DC bucket). */
    private String bucketing = "status_code";

    // --- Baseline fields ---
    private Map<String, Number> minActivity = new LinkedHashMap<>();
    private Map<String, Number> percentThreshold = new LinkedHashMap<>();

    /** Gauge reducer for baselines without a code field. */
    private String reduce = "last";

    /** Metric label for gauge checks; defaults to the check name. */
    private String metric;

    // --- Breach fields ---
    /** Single threshold for gauge breaches; key size in MB for bigkeys. */
    private Double threshold;

    /** Per-category thresholds for breaches with a code field. */
    private Map<String, Number> thresholds = new LinkedHashMap<>();

    /** Consecutive samples above threshold needed to confirm a breach. */
    private int minConsecutive = 2;

    // --- Entity filters ---
    private List<String> excludePrefixes = new ArrayList<>();
    private List<String> includePrefixes = new ArrayList<>();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all required fields for the declared check type are
     * present and contain legal values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Check 'name' is required");
        }
        if (type == null || type.isBlank()) {
            errors.add("Check 'type' is required");
        }
        if (!TYPE_BIGKEYS.equals(type)) {
            if (query == null || query.isBlank()) {
                errors.add("Check '" + name + "' requires 'query'");
            }
            if (keyFields == null || keyFields.isEmpty()) {
                errors.add("Check '" + name + "' requires at least one 'keyFields' entry");
            }
        }
        try {
            BucketingMode.parse(bucketing);
        } catch (IllegalArgumentException e) {
            errors.add("Check '" + name + "': " + e.getMessage());
        }

        if (type != null) {
            switch (type) {
                case TYPE_BASELINE -> {
                    if (percentThreshold == null || percentThreshold.isEmpty()) {
                        errors.add("Baseline check '" + name + "' requires 'percentThreshold'");
                    }
                    if (!hasCodeField()) {
                        if (reduce == null || !REDUCERS.contains(reduce.toLowerCase(Locale.ROOT))) {
                            errors.add("Baseline check '" + name + "' has unknown 'reduce': '" + reduce
                                    + "'. Supported: last, mean, max, sum");
                        }
                        if (percentThreshold != null && !percentThreshold.isEmpty()
                                && !percentThreshold.containsKey(metricName())) {
                            errors.add("Baseline check '" + name + "' requires a 'percentThreshold' entry for '"
                                    + metricName() + "'");
                        }
                    }
                }
                case TYPE_BREACH -> {
                    if (hasCodeField()) {
                        if (thresholds == null || thresholds.isEmpty()) {
                            errors.add("Breach check '" + name + "' with 'codeField' requires 'thresholds'");
                        }
                    } else if (threshold == null) {
                        errors.add("Breach check '" + name + "' requires 'threshold'");
                    }
                }
                case TYPE_BIGKEYS -> {
                    if (threshold == null || !(threshold > 0)) {
                        errors.add("Bigkeys check '" + name + "' requires a positive 'threshold' in MB");
                    }
                }
                default -> errors.add("Unknown check type: '" + type
                        + "'. Supported: baseline, breach, bigkeys");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid CheckRule: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Derived values
    // ---------------------------------------------------------------

    public boolean hasCodeField() {
        return codeField != null && !codeField.isBlank();
    }

    public BucketingMode bucketingMode() {
        return BucketingMode.parse(bucketing);
    }

    /**
     * @return metric label for gauge checks; the check name unless
     *         {@code metric} is set
     */
    public String metricName() {
        return metric != null && !metric.isBlank() ? metric.trim() : name;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    /**
     * Set the check type, normalised to lowercase.
     *
     * @param type check type string
     */
    public void setType(String type) {
        this.type = type != null ? type.trim().toLowerCase(Locale.ROOT) : null;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public List<String> getKeyFields() {
        return keyFields;
    }

    public void setKeyFields(List<String> keyFields) {
        this.keyFields = keyFields != null ? new ArrayList<>(keyFields) : new ArrayList<>();
    }

    public String getCodeField() {
        return codeField;
    }

    public void setCodeField(String codeField) {
        this.codeField = codeField;
    }

    public String getBucketing() {
        return bucketing;
    }

    public void setBucketing(String bucketing) {
        this.bucketing = bucketing;
    }

    public Map<String, Number> getMinActivity() {
        return minActivity;
    }

    public void setMinActivity(Map<String, Number> minActivity) {
        this.minActivity = minActivity != null ? new LinkedHashMap<>(minActivity) : new LinkedHashMap<>();
    }

    public Map<String, Number> getPercentThreshold() {
        return percentThreshold;
    }

    public void setPercentThreshold(Map<String, Number> percentThreshold) {
        this.percentThreshold = percentThreshold != null
                ? new LinkedHashMap<>(percentThreshold)
                : new LinkedHashMap<>();
    }

    public String getReduce() {
        return reduce;
    }

    public void setReduce(String reduce) {
        this.reduce = reduce;
    }

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    public Double getThreshold() {
        return threshold;
    }

    public void setThreshold(Double threshold) {
        this.threshold = threshold;
    }

    public Map<String, Number> getThresholds() {
        return thresholds;
    }

    public void setThresholds(Map<String, Number> thresholds) {
        this.thresholds = thresholds != null ? new LinkedHashMap<>(thresholds) : new LinkedHashMap<>();
    }

    public int getMinConsecutive() {
        return minConsecutive;
    }

    public void setMinConsecutive(int minConsecutive) {
        this.minConsecutive = minConsecutive;
    }

    public List<String> getExcludePrefixes() {
        return excludePrefixes;
    }

    public void setExcludePrefixes(List<String> excludePrefixes) {
        this.excludePrefixes = excludePrefixes != null ? new ArrayList<>(excludePrefixes) : new ArrayList<>();
    }

    public List<String> getIncludePrefixes() {
        return includePrefixes;
    }

    public void setIncludePrefixes(List<String> includePrefixes) {
        this.includePrefixes = includePrefixes != null ? new ArrayList<>(includePrefixes) : new ArrayList<>();
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CheckRule that))
            return false;
        return Objects.equals(name, that.name) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return "CheckRule{" +
                "name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", keyFields=" + keyFields +
                ", codeField='" + codeField + '\'' +
                ", threshold=" + threshold +
                ", thresholds=" + thresholds +
                ", percentThreshold=" + percentThreshold +
                ", minActivity=" + minActivity +
                ", minConsecutive=" + minConsecutive +
                '}';
    }
}
