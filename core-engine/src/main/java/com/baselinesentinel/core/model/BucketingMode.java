package com.baselinesentinel.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * How a code label is mapped onto {@link Category} buckets.
 *
 * <ul>
 * <li>{@link #STATUS_CODE} – application HTTP status codes; no {@code 0DC}
 * bucket</li>
 * <li>{@link #RESPONSE_CODE} – service-mesh response codes; codes starting with
 * {@code 0} land in {@code 0DC}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public enum BucketingMode {

    STATUS_CODE(EnumSet.of(Category.SUCCESS, Category.REDIRECT, Category.CLIENT_ERROR,
            Category.SERVER_ERROR, Category.UNKNOWN)),
    RESPONSE_CODE(EnumSet.allOf(Category.class));

    private final Set<Category> categories;

    BucketingMode(Set<Category> categories) {
        this.categories = Collections.unmodifiableSet(categories);
    }

    /**
     * @return the buckets every histogram in this mode carries
     */
    public Set<Category> categories() {
        return categories;
    }

    /**
     * Parse a configuration value such as {@code status_code} or
     * {@code response-code}.
     *
     * @param value configuration value
     * @return the mode
     * @throws IllegalArgumentException if the value is not recognised
     */
    public static BucketingMode parse(String value) {
        if (value == null || value.isBlank()) {
            return STATUS_CODE;
        }
        String normalised = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return valueOf(normalised);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown bucketing mode: '" + value
                    + "'. Supported: status_code, response_code", e);
        }
    }
}
