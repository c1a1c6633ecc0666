package com.baselinesentinel.core.window;

import com.baselinesentinel.core.config.WindowSettings;
import com.baselinesentinel.core.model.TimeWindow;
import com.baselinesentinel.core.model.WindowPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Computes the comparable current and past windows of a detection run.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>The reference instant is today at {@code targetHour:targetMinute} in the
 * configured zone, or yesterday at that time when the target is still ahead
 * of {@code now}. The reference is therefore never in the future.</li>
 * <li>The past reference is {@code daysBefore} calendar days earlier, same
 * local time of day.</li>
 * <li>Each window ends at its reference and is {@code width} long.</li>
 * </ol>
 *
 * <p>
 * Windows are returned as UTC instants. A width below one minute is clamped
 * to one minute; {@code daysBefore = 0} yields two identical windows.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeWindowResolver {

    private static final Logger LOG = LoggerFactory.getLogger(TimeWindowResolver.class);

    /** Smallest window the resolver hands out. */
    public static final Duration MIN_WIDTH = Duration.ofMinutes(1);

    private final ZoneId zone;

    /**
     * @param zone zone in which the target time of day is interpreted
     */
    public TimeWindowResolver(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "Zone must not be null");
    }

    /**
     * Resolve windows from configured settings.
     *
     * @param now      the current instant
     * @param settings window settings; must not be {@code null}
     * @return current and past windows
     */
    public static WindowPair resolve(Instant now, WindowSettings settings) {
        Objects.requireNonNull(settings, "Window settings must not be null");
        return new TimeWindowResolver(settings.zoneId()).resolve(now,
                settings.getTargetHour(),
                settings.getTargetMinute(),
                settings.getDaysBefore(),
                settings.width());
    }

    /**
     * Resolve the current and past windows.
     *
     * @param now          the current instant; must not be {@code null}
     * @param targetHour   hour of day the windows end at, 0..23
     * @param targetMinute minute of the hour the windows end at, 0..59
     * @param daysBefore   distance between the windows in days, {@code >= 0}
     * @param width        window length; values below one minute are clamped
     * @return current and past windows in UTC
     * @throws IllegalArgumentException if the target time or offset is out of
     *                                  range
     */
    public WindowPair resolve(Instant now, int targetHour, int targetMinute, int daysBefore,
            Duration width) {
        Objects.requireNonNull(now, "now must not be null");
        if (targetHour < 0 || targetHour > 23) {
            throw new IllegalArgumentException("targetHour must be in [0, 23], got: " + targetHour);
        }
        if (targetMinute < 0 || targetMinute > 59) {
            throw new IllegalArgumentException("targetMinute must be in [0, 59], got: " + targetMinute);
        }
        if (daysBefore < 0) {
            throw new IllegalArgumentException("daysBefore must be >= 0, got: " + daysBefore);
        }
        Duration effectiveWidth = clampWidth(width);

        ZonedDateTime localNow = now.atZone(zone);
        ZonedDateTime reference = localNow.withHour(targetHour)
                .withMinute(targetMinute)
                .withSecond(0)
                .withNano(0);
        boolean targetAhead = targetHour > localNow.getHour()
                || (targetHour == localNow.getHour() && targetMinute > localNow.getMinute());
        if (targetAhead) {
            reference = localNow.minusDays(1)
                    .withHour(targetHour)
                    .withMinute(targetMinute)
                    .withSecond(0)
                    .withNano(0);
        }
        ZonedDateTime pastReference = reference.minusDays(daysBefore);

        TimeWindow current = TimeWindow.of(reference.minus(effectiveWidth).toInstant(), reference.toInstant());
        TimeWindow past = TimeWindow.of(pastReference.minus(effectiveWidth).toInstant(),
                pastReference.toInstant());

        LOG.debug("Resolved windows in {}: current {} -> {}, past {} -> {}", zone,
                reference.minus(effectiveWidth), reference,
                pastReference.minus(effectiveWidth), pastReference);
        return new WindowPair(current, past);
    }

    private static Duration clampWidth(Duration width) {
        if (width == null || width.compareTo(MIN_WIDTH) < 0) {
            LOG.warn("Window width {} is below {}; clamping", width, MIN_WIDTH);
            return MIN_WIDTH;
        }
        return width;
    }
}
