package com.baselinesentinel.core.model;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Half-open observation interval {@code [start, end]} expressed in UTC.
 *
 * <p>
 * Instances are immutable and always satisfy {@code start < end}. They are
 * produced by {@link com.baselinesentinel.core.window.TimeWindowResolver} and
 * consumed by every metric fetch.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeWindow {

    private final Instant start;
    private final Instant end;

    private TimeWindow(Instant start, Instant end) {
        this.start = start;
        this.end = end;
    }

    /**
     * Create a window.
     *
     * @param start inclusive start; must not be {@code null}
     * @param end   end; must not be {@code null} and must be after {@code start}
     * @return the window
     * @throws IllegalArgumentException if {@code start} is not before {@code end}
     */
    public static TimeWindow of(Instant start, Instant end) {
        Objects.requireNonNull(start, "Window start must not be null");
        Objects.requireNonNull(end, "Window end must not be null");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException(
                    "Window start must be before end, got: " + start + " .. " + end);
        }
        return new TimeWindow(start, end);
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public Duration length() {
        return Duration.between(start, end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeWindow that))
            return false;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start.atOffset(ZoneOffset.UTC) + " .. " + end.atOffset(ZoneOffset.UTC) + "]";
    }
}
