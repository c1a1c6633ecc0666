package com.baselinesentinel.core.normalize;

import com.baselinesentinel.core.model.EntityKey;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Prefix-based allow/deny list over entity keys.
 *
 * <p>
 * An entity is rejected when any key component starts with an exclude
 * prefix. When include prefixes are configured, an entity must additionally
 * have a component starting with one of them.
 * </p>
 *
 * @since 1.0.0
 */
public final class EntityFilter implements Predicate<EntityKey> {

    private static final EntityFilter ACCEPT_ALL = new EntityFilter(List.of(), List.of());

    private final List<String> includePrefixes;
    private final List<String> excludePrefixes;

    public EntityFilter(List<String> includePrefixes, List<String> excludePrefixes) {
        this.includePrefixes = clean(includePrefixes);
        this.excludePrefixes = clean(excludePrefixes);
    }

    public static EntityFilter acceptAll() {
        return ACCEPT_ALL;
    }

    @Override
    public boolean test(EntityKey key) {
        Objects.requireNonNull(key, "Entity key must not be null");
        for (String prefix : excludePrefixes) {
            if (key.anyComponentStartsWith(prefix)) {
                return false;
            }
        }
        if (includePrefixes.isEmpty()) {
            return true;
        }
        for (String prefix : includePrefixes) {
            if (key.anyComponentStartsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> clean(List<String> prefixes) {
        if (prefixes == null) {
            return List.of();
        }
        return prefixes.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .toList();
    }

    @Override
    public String toString() {
        return "EntityFilter{include=" + includePrefixes + ", exclude=" + excludePrefixes + '}';
    }
}
