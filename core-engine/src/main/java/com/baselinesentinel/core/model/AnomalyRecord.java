package com.baselinesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One detected anomaly.
 *
 * <p>
 * Produced by {@link com.baselinesentinel.core.detection.BaselineComparator}
 * (growth between windows) or adapted from a {@link BreachResult} (sustained
 * breach within the current window). The union of all records across domains
 * is what the notification sink receives.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code domain}, {@code type}, {@code entity} and
 * {@code metric} are required; omitting any of them throws
 * {@link NullPointerException} at build time. {@code pastValue} and
 * {@code percentChange} are {@code null} for breach records.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AnomalyRecord {

    private final String domain;
    private final String check;
    private final AnomalyType type;
    private final EntityKey entity;
    private final String metric;
    private final double currentValue;
    private final Double pastValue;
    private final Double percentChange;
    private final double threshold;
    private final String severityNote;
    private final List<Integer> breachIndices;
    private final double magnitude;

    private AnomalyRecord(Builder builder) {
        this.domain = Objects.requireNonNull(builder.domain, "domain must not be null");
        this.check = builder.check;
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.entity = Objects.requireNonNull(builder.entity, "entity must not be null");
        this.metric = Objects.requireNonNull(builder.metric, "metric must not be null");
        this.currentValue = builder.currentValue;
        this.pastValue = builder.pastValue;
        this.percentChange = builder.percentChange;
        this.threshold = builder.threshold;
        this.severityNote = builder.severityNote;
        this.breachIndices = builder.breachIndices != null
                ? Collections.unmodifiableList(new ArrayList<>(builder.breachIndices))
                : List.of();
        this.magnitude = builder.magnitude;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnomalyRecord} instances.
     */
    public static class Builder {
        private String domain;
        private String check;
        private AnomalyType type;
        private EntityKey entity;
        private String metric;
        private double currentValue;
        private Double pastValue;
        private Double percentChange;
        private double threshold;
        private String severityNote;
        private List<Integer> breachIndices;
        private double magnitude;

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder check(String check) {
            this.check = check;
            return this;
        }

        public Builder type(AnomalyType type) {
            this.type = type;
            return this;
        }

        public Builder entity(EntityKey entity) {
            this.entity = entity;
            return this;
        }

        public Builder metric(String metric) {
            this.metric = metric;
            return this;
        }

        public Builder currentValue(double currentValue) {
            this.currentValue = currentValue;
            return this;
        }

        public Builder pastValue(Double pastValue) {
            this.pastValue = pastValue;
            return this;
        }

        public Builder percentChange(Double percentChange) {
            this.percentChange = percentChange;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder severityNote(String severityNote) {
            this.severityNote = severityNote;
            return this;
        }

        public Builder breachIndices(List<Integer> breachIndices) {
            this.breachIndices = breachIndices;
            return this;
        }

        public Builder magnitude(double magnitude) {
            this.magnitude = magnitude;
            return this;
        }

        /**
         * Build the record.
         *
         * @return a new {@link AnomalyRecord}
         * @throws NullPointerException if a required field is {@code null}
         */
        public AnomalyRecord build() {
            return new AnomalyRecord(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getDomain() {
        return domain;
    }

    public String getCheck() {
        return check;
    }

    public AnomalyType getType() {
        return type;
    }

    public EntityKey getEntity() {
        return entity;
    }

    /**
     * @return category label (e.g. {@code 5xx}) or metric name (e.g.
     *         {@code cpu})
     */
    public String getMetric() {
        return metric;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public Double getPastValue() {
        return pastValue;
    }

    /**
     * @return growth in percent rounded to two decimals, {@code null} for
     *         breach records
     */
    public Double getPercentChange() {
        return percentChange;
    }

    public double getThreshold() {
        return threshold;
    }

    public String getSeverityNote() {
        return severityNote;
    }

    public List<Integer> getBreachIndices() {
        return breachIndices;
    }

    /**
     * @return severity used for ordering: run magnitude for breaches, percent
     *         change for growth
     */
    public double getMagnitude() {
        return magnitude;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyRecord that))
            return false;
        return Double.compare(currentValue, that.currentValue) == 0
                && Double.compare(threshold, that.threshold) == 0
                && Double.compare(magnitude, that.magnitude) == 0
                && domain.equals(that.domain)
                && Objects.equals(check, that.check)
                && type == that.type
                && entity.equals(that.entity)
                && metric.equals(that.metric)
                && Objects.equals(pastValue, that.pastValue)
                && Objects.equals(percentChange, that.percentChange)
                && Objects.equals(severityNote, that.severityNote)
                && breachIndices.equals(that.breachIndices);
    }

    @Override
    public int hashCode() {
        return Objects.hash(domain, check, type, entity, metric, currentValue, pastValue,
                percentChange, threshold);
    }

    @Override
    public String toString() {
        return "AnomalyRecord{" +
                "domain='" + domain + '\'' +
                ", check='" + check + '\'' +
                ", type=" + type +
                ", entity='" + entity + '\'' +
                ", metric='" + metric + '\'' +
                ", current=" + currentValue +
                ", past=" + pastValue +
                ", percentChange=" + percentChange +
                ", threshold=" + threshold +
                '}';
    }
}
