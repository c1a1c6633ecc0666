package com.baselinesentinel.core.detection;

import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Collapses a gauge track into one comparable scalar.
 *
 * @since 1.0.0
 */
public enum GaugeReducer {

    /** Latest sample. */
    LAST {
        @Override
        public OptionalDouble apply(double[] values) {
            return values.length == 0 ? OptionalDouble.empty() : OptionalDouble.of(values[values.length - 1]);
        }
    },
    MEAN {
        @Override
        public OptionalDouble apply(double[] values) {
            double sum = 0;
            for (double v : values) {
                sum += v;
            }
            return values.length == 0 ? OptionalDouble.empty() : OptionalDouble.of(sum / values.length);
        }
    },
    MAX {
        @Override
        public OptionalDouble apply(double[] values) {
            if (values.length == 0) {
                return OptionalDouble.empty();
            }
            double max = values[0];
            for (double v : values) {
                max = Math.max(max, v);
            }
            return OptionalDouble.of(max);
        }
    },
    SUM {
        @Override
        public OptionalDouble apply(double[] values) {
            if (values.length == 0) {
                return OptionalDouble.empty();
            }
            double sum = 0;
            for (double v : values) {
                sum += v;
            }
            return OptionalDouble.of(sum);
        }
    };

    /**
     * @param values ordered samples
     * @return reduced value, empty for an empty track
     */
    public abstract OptionalDouble apply(double[] values);

    /**
     * @param name reducer name, case-insensitive; blank means {@link #LAST}
     * @return reducer
     * @throws IllegalArgumentException if the name is unknown
     */
    public static GaugeReducer parse(String name) {
        if (name == null || name.isBlank()) {
            return LAST;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown reducer: '" + name
                    + "'. Supported: last, mean, max, sum", e);
        }
    }
}
