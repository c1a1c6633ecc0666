package com.baselinesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Response-class buckets used by category histograms.
 *
 * @since 1.0.0
 */
public enum Category {

    SUCCESS("2xx"),
    REDIRECT("3xx"),
    CLIENT_ERROR("4xx"),
    SERVER_ERROR("5xx"),
    /** Destination never reached: the mesh reported a response code starting with {@code 0}. */
    NO_DOWNSTREAM("0DC"),
    UNKNOWN("unknown");

    private final String label;

    Category(String label) {
        this.label = label;
    }

    /**
     * @return configuration/report label, e.g. {@code 5xx}
     */
    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Look up a category by its label (case-insensitive).
     *
     * @param label e.g. {@code "5xx"} or {@code "0DC"}
     * @return the category, empty if the label is not recognised
     */
    public static Optional<Category> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String trimmed = label.trim();
        for (Category category : values()) {
            if (category.label.equalsIgnoreCase(trimmed)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return label;
    }
}
