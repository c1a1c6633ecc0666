package com.baselinesentinel.core.model;

import java.util.Objects;

/**
 * The two comparable windows of one invocation: the current observation
 * window and the historical baseline window at the same time of day.
 *
 * @since 1.0.0
 */
public final class WindowPair {

    private final TimeWindow current;
    private final TimeWindow past;

    public WindowPair(TimeWindow current, TimeWindow past) {
        this.current = Objects.requireNonNull(current, "Current window must not be null");
        this.past = Objects.requireNonNull(past, "Past window must not be null");
    }

    public TimeWindow getCurrent() {
        return current;
    }

    public TimeWindow getPast() {
        return past;
    }

    /**
     * @return window spanning from the start of the past window to the end of
     *         the current one; used as the deployment lookback horizon
     */
    public TimeWindow lookbackHorizon() {
        return past.getStart().isBefore(current.getStart())
                ? TimeWindow.of(past.getStart(), current.getEnd())
                : current;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof WindowPair that))
            return false;
        return current.equals(that.current) && past.equals(that.past);
    }

    @Override
    public int hashCode() {
        return Objects.hash(current, past);
    }

    @Override
    public String toString() {
        return "WindowPair{current=" + current + ", past=" + past + '}';
    }
}
