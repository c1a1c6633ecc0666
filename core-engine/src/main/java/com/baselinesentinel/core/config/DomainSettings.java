package com.baselinesentinel.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * One metric domain (database, cache, application mesh, ...) and its checks.
 *
 * @since 1.0.0
 */
public class DomainSettings {

    public static final String DEFAULT_SOURCE = "prometheus";

    private String name;
    private boolean enabled = true;
    /** Name of the metric source every check of this domain queries. */
    private String source = DEFAULT_SOURCE;
    private List<CheckRule> checks = new ArrayList<>();

    /**
     * @return validation errors for this domain and all of its checks
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (name == null || name.isBlank()) {
            errors.add("Domain 'name' is required");
        }
        if (source == null || source.isBlank()) {
            errors.add("Domain '" + name + "' requires 'source'");
        }
        if (checks.isEmpty()) {
            errors.add("Domain '" + name + "' defines no checks");
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < checks.size(); i++) {
            CheckRule check = checks.get(i);
            if (check == null) {
                errors.add("Domain '" + name + "': check at index " + i + " is null");
                continue;
            }
            try {
                check.validate();
            } catch (IllegalStateException e) {
                errors.add("Domain '" + name + "': " + e.getMessage());
            }
            if (check.getName() != null && !seen.add(check.getName())) {
                errors.add("Domain '" + name + "': duplicate check name '" + check.getName() + "'");
            }
        }
        return errors;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * @return unmodifiable list of checks
     */
    public List<CheckRule> getChecks() {
        return Collections.unmodifiableList(checks);
    }

    public void setChecks(List<CheckRule> checks) {
        this.checks = checks != null ? new ArrayList<>(checks) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "DomainSettings{name='" + name + "', source='" + source + "', enabled=" + enabled + ", checks=" + checks + '}';
    }
}
