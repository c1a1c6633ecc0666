package com.baselinesentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One sample of a time series.
 *
 * @since 1.0.0
 */
public final class RawSeriesPoint {

    private final Instant timestamp;
    private final double value;

    public RawSeriesPoint(Instant timestamp, double value) {
        this.timestamp = Objects.requireNonNull(timestamp, "Point timestamp must not be null");
        this.value = value;
    }

    public static RawSeriesPoint ofEpochSecond(long epochSecond, double value) {
        return new RawSeriesPoint(Instant.ofEpochSecond(epochSecond), value);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RawSeriesPoint that))
            return false;
        return Double.compare(value, that.value) == 0 && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "(" + timestamp.getEpochSecond() + ", " + value + ")";
    }
}
