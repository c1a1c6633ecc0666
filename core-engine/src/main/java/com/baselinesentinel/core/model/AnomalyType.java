package com.baselinesentinel.core.model;

/**
 * Which detection rule produced an {@link AnomalyRecord}.
 *
 * @since 1.0.0
 */
public enum AnomalyType {
    /** Growth between the past and current window exceeded policy. */
    BASELINE_GROWTH,
    /** Values stayed above a threshold for the configured number of samples. */
    SUSTAINED_BREACH,
    /** A single cache key holds more memory than allowed. */
    OVERSIZED_KEY
}
