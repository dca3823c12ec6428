package io.github.byzatic.jobscheduler.recurrence;

import io.github.byzatic.jobscheduler.base_exceptions.ConfigurationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Parses the {@code time} of a recurrence rule.
 * <p>
 * Accepted forms:
 * <ul>
 *   <li>{@code HH:MM} or {@code HH:MM:SS}, resolved on a given date;</li>
 *   <li>{@code yyyy-MM-ddTHH:MM[:SS[.fff]]} or {@code yyyy-MM-dd HH:MM[:SS]}.</li>
 * </ul>
 */
public final class TimeParser {
    private static final DateTimeFormatter TIME_OF_DAY = DateTimeFormatter.ofPattern("H:mm[:ss]");
    private static final DateTimeFormatter SPACED_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]");

    private TimeParser() {
    }

    /**
     * Resolve {@code text} against {@code date} when it carries no date of its own.
     */
    public static @NotNull LocalDateTime parse(@Nullable String text, @NotNull LocalDate date) throws ConfigurationException {
        if (text == null || text.isBlank()) {
            throw new ConfigurationException("Time is required for time-of-day rules");
        }
        String value = text.trim();
        LocalTime timeOfDay = tryParseTime(value);
        if (timeOfDay != null) {
            return date.atTime(timeOfDay);
        }
        try {
            return LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        } catch (DateTimeParseException isoFailure) {
            try {
                return LocalDateTime.parse(value, SPACED_DATE_TIME);
            } catch (DateTimeParseException e) {
                throw new ConfigurationException("Invalid time '" + text + "': expected HH:MM or yyyy-MM-ddTHH:MM", e);
            }
        }
    }

    /**
     * Bare times of day are taken as today, according to {@code clock}.
     */
    public static @NotNull LocalDateTime parse(@Nullable String text, @NotNull Clock clock) throws ConfigurationException {
        return parse(text, LocalDate.now(clock));
    }

    public static void validate(@Nullable String text) throws ConfigurationException {
        parse(text, LocalDate.EPOCH);
    }

    private static @Nullable LocalTime tryParseTime(String value) {
        if (value.indexOf('-') >= 0) return null;
        try {
            return LocalTime.parse(value, TIME_OF_DAY);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
