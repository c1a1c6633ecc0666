package com.baselinesentinel.core.config;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * When the comparison windows end, how far apart and how wide they are.
 *
 * <pre>
 * window:
 *   targetHour: 12
 *   targetMinute: 30
 *   daysBefore: 7
 *   widthMinutes: 60
 *   timezone: Asia/Kolkata
 *   step: 10m
 * </pre>
 *
 * @since 1.0.0
 */
public class WindowSettings {

    private int targetHour = 12;
    private int targetMinute = 30;
    private int daysBefore = 7;
    private int widthMinutes = 60;
    private String timezone = "Asia/Kolkata";
    private String step = "10m";

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * @return validation errors, empty when the settings are usable
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (targetHour < 0 || targetHour > 23) {
            errors.add("window.targetHour must be in [0, 23], got: " + targetHour);
        }
        if (targetMinute < 0 || targetMinute > 59) {
            errors.add("window.targetMinute must be in [0, 59], got: " + targetMinute);
        }
        if (daysBefore < 0) {
            errors.add("window.daysBefore must be >= 0, got: " + daysBefore);
        }
        try {
            zoneId();
        } catch (DateTimeException e) {
            errors.add("window.timezone is not a valid zone id: '" + timezone + "'");
        }
        try {
            stepDuration();
        } catch (IllegalArgumentException e) {
            errors.add("window.step " + e.getMessage());
        }
        return errors;
    }

    // ---------------------------------------------------------------
    // Derived values
    // ---------------------------------------------------------------

    public ZoneId zoneId() {
        return ZoneId.of(timezone == null || timezone.isBlank() ? "UTC" : timezone.trim());
    }

    /**
     * @return window width; the resolver clamps values below one minute
     */
    public Duration width() {
        return Duration.ofMinutes(widthMinutes);
    }

    public Duration stepDuration() {
        return parseDuration(step);
    }

    /**
     * Parse a Prometheus-style duration such as {@code 30s}, {@code 10m} or
     * {@code 1h}.
     *
     * @param value duration literal
     * @return parsed duration
     * @throws IllegalArgumentException if the literal is malformed or not
     *                                  positive
     */
    public static Duration parseDuration(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("must not be blank");
        }
        String trimmed = value.trim().toLowerCase(Locale.ROOT);
        char unit = trimmed.charAt(trimmed.length() - 1);
        long amount;
        try {
            amount = Long.parseLong(trimmed.substring(0, trimmed.length() - 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("must look like 30s, 10m or 1h, got: '" + value + "'", e);
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("must be positive, got: '" + value + "'");
        }
        return switch (unit) {
            case 's' -> Duration.ofSeconds(amount);
            case 'm' -> Duration.ofMinutes(amount);
            case 'h' -> Duration.ofHours(amount);
            case 'd' -> Duration.ofDays(amount);
            default -> throw new IllegalArgumentException(
                    "must end with s, m, h or d, got: '" + value + "'");
        };
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getTargetHour() {
        return targetHour;
    }

    public void setTargetHour(int targetHour) {
        this.targetHour = targetHour;
    }

    public int getTargetMinute() {
        return targetMinute;
    }

    public void setTargetMinute(int targetMinute) {
        this.targetMinute = targetMinute;
    }

    public int getDaysBefore() {
        return daysBefore;
    }

    public void setDaysBefore(int daysBefore) {
        this.daysBefore = daysBefore;
    }

    public int getWidthMinutes() {
        return widthMinutes;
    }

    public void setWidthMinutes(int widthMinutes) {
        this.widthMinutes = widthMinutes;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public String getStep() {
        return step;
    }

    public void setStep(String step) {
        this.step = step;
    }

    @Override
    public String toString() {
        return "WindowSettings{" +
                "target=" + targetHour + ':' + targetMinute +
                ", daysBefore=" + daysBefore +
                ", widthMinutes=" + widthMinutes +
                ", timezone='" + timezone + '\'' +
                ", step='" + step + '\'' +
                '}';
    }
}
