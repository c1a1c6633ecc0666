package com.baselinesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered tuple of label values used to group series into one logical entity,
 * e.g. {@code (method, service, handler)} or {@code (service, pod)}.
 *
 * <p>
 * Components are trimmed on construction; two keys are equal iff all
 * components are equal.
 * </p>
 *
 * @since 1.0.0
 */
public final class EntityKey {

    private final List<String> components;

    private EntityKey(List<String> components) {
        this.components = components;
    }

    public static EntityKey of(String... components) {
        Objects.requireNonNull(components, "Key components must not be null");
        return of(Arrays.asList(components));
    }

    public static EntityKey of(List<String> components) {
        Objects.requireNonNull(components, "Key components must not be null");
        List<String> trimmed = new ArrayList<>(components.size());
        for (String component : components) {
            trimmed.add(component == null ? LabeledSeries.UNKNOWN : component.trim());
        }
        return new EntityKey(Collections.unmodifiableList(trimmed));
    }

    /**
     * Return a new key with {@code component} appended.
     *
     * @param component extra component, e.g. a response category
     * @return extended key
     */
    public EntityKey with(String component) {
        List<String> extended = new ArrayList<>(components);
        extended.add(component);
        return of(extended);
    }

    public List<String> getComponents() {
        return components;
    }

    public int size() {
        return components.size();
    }

    /**
     * @param index component position
     * @return component at {@code index}
     * @throws IndexOutOfBoundsException if {@code index} is out of range
     */
    public String get(int index) {
        return components.get(index);
    }

    /**
     * @param prefix name prefix
     * @return {@code true} if any component starts with {@code prefix}
     */
    public boolean anyComponentStartsWith(String prefix) {
        for (String component : components) {
            if (component.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return components joined by a single space, blank components dropped
     */
    @JsonValue
    public String display() {
        StringBuilder sb = new StringBuilder();
        for (String component : components) {
            if (component.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(component);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EntityKey that))
            return false;
        return components.equals(that.components);
    }

    @Override
    public int hashCode() {
        return components.hashCode();
    }

    @Override
    public String toString() {
        return display();
    }
}
