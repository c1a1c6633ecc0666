package com.baselinesentinel.core.window;

import com.baselinesentinel.core.config.WindowSettings;
import com.baselinesentinel.core.model.WindowPair;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TimeWindowResolver}.
 */
class TimeWindowResolverTest {

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    private TimeWindowResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new TimeWindowResolver(IST);
    }

    @Test
    @DisplayName("Should end the current window at today's target when the target has passed")
    void shouldUseTodayWhenTargetPassed() {
        WindowPair windows = resolver.resolve(ist(2024, 1, 15, 14, 30), 12, 30, 7, Duration.ofHours(1));

        assertThat(windows.getCurrent().getStart()).isEqualTo(Instant.parse("2024-01-15T06:00:00Z"));
        assertThat(windows.getCurrent().getEnd()).isEqualTo(Instant.parse("2024-01-15T07:00:00Z"));
        assertThat(windows.getPast().getStart()).isEqualTo(Instant.parse("2024-01-08T06:00:00Z"));
        assertThat(windows.getPast().getEnd()).isEqualTo(Instant.parse("2024-01-08T07:00:00Z"));
    }

    @Test
    @DisplayName("Should fall back to yesterday when the target time is still ahead")
    void shouldUseYesterdayWhenTargetAhead() {
        WindowPair windows = resolver.resolve(ist(2024, 1, 15, 10, 0), 12, 30, 7, Duration.ofHours(1));

        assertThat(windows.getCurrent().getEnd())
                .isEqualTo(ist(2024, 1, 14, 12, 30))
                .isEqualTo(Instant.parse("2024-01-14T07:00:00Z"));
        assertThat(windows.getPast().getEnd()).isEqualTo(Instant.parse("2024-01-07T07:00:00Z"));
    }

    @Test
    @DisplayName("Should use today when now is exactly the target time")
    void shouldUseTodayAtExactTarget() {
        Instant now = ist(2024, 1, 15, 12, 30);
        WindowPair windows = resolver.resolve(now, 12, 30, 1, Duration.ofMinutes(30));

        assertThat(windows.getCurrent().getEnd()).isEqualTo(now);
        assertThat(windows.getCurrent().length()).isEqualTo(Duration.ofMinutes(30));
    }

    @Test
    @DisplayName("Should never end the current window after now")
    void shouldNeverRequestFutureData() {
        Instant now = ist(2024, 3, 1, 0, 5);
        for (int hour = 0; hour < 24; hour++) {
            WindowPair windows = resolver.resolve(now, hour, 0, 7, Duration.ofHours(1));
            assertThat(windows.getCurrent().getEnd()).isBeforeOrEqualTo(now);
        }
    }

    @Test
    @DisplayName("Should produce identical windows when daysBefore is zero")
    void shouldSelfCompareWithZeroDays() {
        WindowPair windows = resolver.resolve(ist(2024, 1, 15, 14, 30), 12, 30, 0, Duration.ofHours(1));

        assertThat(windows.getPast()).isEqualTo(windows.getCurrent());
        assertThat(windows.lookbackHorizon()).isEqualTo(windows.getCurrent());
    }

    @Test
    @DisplayName("Should clamp a zero or negative width to one minute")
    void shouldClampWidth() {
        WindowPair zero = resolver.resolve(ist(2024, 1, 15, 14, 30), 12, 30, 7, Duration.ZERO);
        WindowPair negative = resolver.resolve(ist(2024, 1, 15, 14, 30), 12, 30, 7, Duration.ofMinutes(-5));

        assertThat(zero.getCurrent().length()).isEqualTo(TimeWindowResolver.MIN_WIDTH);
        assertThat(negative.getPast().length()).isEqualTo(TimeWindowResolver.MIN_WIDTH);
    }

    @Test
    @DisplayName("Should reject out-of-range target time and negative offsets")
    void shouldRejectInvalidArguments() {
        Instant now = Instant.parse("2024-01-15T09:00:00Z");

        assertThatThrownBy(() -> resolver.resolve(now, 24, 0, 7, Duration.ofHours(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("targetHour");
        assertThatThrownBy(() -> resolver.resolve(now, 12, 60, 7, Duration.ofHours(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("targetMinute");
        assertThatThrownBy(() -> resolver.resolve(now, 12, 0, -1, Duration.ofHours(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("daysBefore");
    }

    @Test
    @DisplayName("Should resolve from window settings")
    void shouldResolveFromSettings() {
        WindowSettings settings = new WindowSettings();
        settings.setTargetHour(9);
        settings.setTargetMinute(0);
        settings.setDaysBefore(1);
        settings.setWidthMinutes(30);
        settings.setTimezone("UTC");

        WindowPair windows = TimeWindowResolver.resolve(Instant.parse("2024-05-02T10:00:00Z"), settings);

        assertThat(windows.getCurrent().getStart()).isEqualTo(Instant.parse("2024-05-02T08:30:00Z"));
        assertThat(windows.getPast().getEnd()).isEqualTo(Instant.parse("2024-05-01T09:00:00Z"));
        assertThat(windows.lookbackHorizon().getStart()).isEqualTo(Instant.parse("2024-05-01T08:30:00Z"));
        assertThat(windows.lookbackHorizon().getEnd()).isEqualTo(Instant.parse("2024-05-02T09:00:00Z"));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Instant ist(int year, int month, int day, int hour, int minute) {
        return ZonedDateTime.of(year, month, day, hour, minute, 0, 0, IST).toInstant();
    }
}
