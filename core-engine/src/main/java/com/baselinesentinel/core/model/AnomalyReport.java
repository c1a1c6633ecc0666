package com.baselinesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The merged outcome of one detection run: anomalies per domain, the window
 * pair they were computed over and, when anything was found, the deployments
 * created inside the lookback horizon.
 *
 * <p>
 * Every domain that took part in the run is present in {@link #getByDomain()},
 * possibly with an empty list (no anomalies or fetch failure).
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyReport {

    private final WindowPair window;
    private final Map<String, List<AnomalyRecord>> byDomain;
    private final List<DeploymentRecord> deployments;

    private AnomalyReport(Builder builder) {
        this.window = Objects.requireNonNull(builder.window, "window must not be null");
        Map<String, List<AnomalyRecord>> copy = new LinkedHashMap<>();
        builder.byDomain.forEach((domain, records) ->
                copy.put(domain, Collections.unmodifiableList(new ArrayList<>(records))));
        this.byDomain = Collections.unmodifiableMap(copy);
        this.deployments = Collections.unmodifiableList(new ArrayList<>(builder.deployments));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnomalyReport}. {@code window} is required.
     */
    public static class Builder {
        private WindowPair window;
        private final Map<String, List<AnomalyRecord>> byDomain = new LinkedHashMap<>();
        private final List<DeploymentRecord> deployments = new ArrayList<>();

        public Builder window(WindowPair window) {
            this.window = window;
            return this;
        }

        /**
         * Record the anomalies of one domain. Calling this twice for the same
         * domain appends.
         */
        public Builder domain(String domain, List<AnomalyRecord> records) {
            Objects.requireNonNull(domain, "Domain name must not be null");
            byDomain.computeIfAbsent(domain, d -> new ArrayList<>())
                    .addAll(records != null ? records : List.of());
            return this;
        }

        public Builder deployments(List<DeploymentRecord> deployments) {
            this.deployments.clear();
            if (deployments != null) {
                this.deployments.addAll(deployments);
            }
            return this;
        }

        /**
         * @return a new {@link AnomalyReport}
         * @throws NullPointerException if {@code window} is {@code null}
         */
        public AnomalyReport build() {
            return new AnomalyReport(this);
        }
    }

    /**
     * Copy this report with a deployment list attached.
     *
     * @param deployments recent deployments
     * @return new report
     */
    public AnomalyReport withDeployments(List<DeploymentRecord> deployments) {
        Builder builder = builder().window(window).deployments(deployments);
        byDomain.forEach(builder::domain);
        return builder.build();
    }

    public WindowPair getWindow() {
        return window;
    }

    public Map<String, List<AnomalyRecord>> getByDomain() {
        return byDomain;
    }

    /**
     * @param domain domain name
     * @return the domain's anomalies, empty if the domain is unknown
     */
    public List<AnomalyRecord> anomaliesFor(String domain) {
        return byDomain.getOrDefault(domain, List.of());
    }

    public List<DeploymentRecord> getDeployments() {
        return deployments;
    }

    /**
     * @return total number of anomalies across every domain
     */
    public int totalAnomalies() {
        int total = 0;
        for (List<AnomalyRecord> records : byDomain.values()) {
            total += records.size();
        }
        return total;
    }

    /**
     * @return {@code true} when no domain reported an anomaly; such a report
     *         ends the run without escalation
     */
    @JsonIgnore
    public boolean isEmpty() {
        return totalAnomalies() == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyReport that))
            return false;
        return window.equals(that.window)
                && byDomain.equals(that.byDomain)
                && deployments.equals(that.deployments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(window, byDomain, deployments);
    }

    @Override
    public String toString() {
        return "AnomalyReport{window=" + window + ", anomalies=" + totalAnomalies()
                + ", domains=" + byDomain.keySet() + ", deployments=" + deployments.size() + '}';
    }
}
