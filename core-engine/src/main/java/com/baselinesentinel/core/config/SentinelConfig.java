package com.baselinesentinel.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for the detection YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * window:
 *   targetHour: 12
 *   daysBefore: 7
 * domains:
 *   - name: database
 *     checks:
 *       - name: rds_cpu
 *         type: baseline
 *         query: avg by (instance) (rds_cpu_utilization)
 *         keyFields: [instance]
 *         percentThreshold: {rds_cpu: 50}
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify the window and every
 * domain.
 * </p>
 *
 * @since 1.0.0
 */
public class SentinelConfig {

    private WindowSettings window = new WindowSettings();
    private List<DomainSettings> domains = new ArrayList<>();

    public WindowSettings getWindow() {
        return window;
    }

    public void setWindow(WindowSettings window) {
        this.window = window != null ? window : new WindowSettings();
    }

    /**
     * Return the domains in configuration order. The returned list is
     * <strong>unmodifiable</strong>.
     *
     * @return unmodifiable list of domains
     */
    public List<DomainSettings> getDomains() {
        return Collections.unmodifiableList(domains);
    }

    public void setDomains(List<DomainSettings> domains) {
        this.domains = domains != null ? new ArrayList<>(domains) : new ArrayList<>();
    }

    /**
     * @return enabled domains, in configuration order
     */
    public List<DomainSettings> enabledDomains() {
        return domains.stream().filter(DomainSettings::isEnabled).toList();
    }

    /**
     * Validate the window settings and every domain.
     *
     * <p>
     * Collects all errors and throws a single exception if anything is
     * invalid.
     * </p>
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>(window.validate());

        Set<String> names = new HashSet<>();
        for (int i = 0; i < domains.size(); i++) {
            DomainSettings domain = Objects.requireNonNull(domains.get(i),
                    "Domain at index " + i + " is null");
            errors.addAll(domain.validate());
            if (domain.getName() != null && !names.add(domain.getName())) {
                errors.add("Duplicate domain name: '" + domain.getName() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Sentinel configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "SentinelConfig{window=" + window + ", domains=" + domains + '}';
    }
}
