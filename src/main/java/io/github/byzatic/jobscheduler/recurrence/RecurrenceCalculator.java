package io.github.byzatic.jobscheduler.recurrence;

import io.github.byzatic.jobscheduler.base_exceptions.ConfigurationException;
import org.jetbrains.annotations.NotNull;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Computes the next trigger time of a rule. Pure: no clock, no I/O.
 */
public final class RecurrenceCalculator {

    /**
     * @param rule        the job's rule
     * @param lastTrigger the time the job was due at (its previous {@code nextRun}), not the time it ran
     * @return the next trigger; for {@code once} the configured time, unchanged
     * @throws ConfigurationException on an unknown tag, a bad time, a non-positive interval or a
     *                                next trigger outside the supported date-time range
     */
    public @NotNull LocalDateTime next(@NotNull RecurrenceRule rule, @NotNull LocalDateTime lastTrigger) throws ConfigurationException {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(lastTrigger, "lastTrigger");

        try {
            return switch (rule.frequency()) {
                // a bare HH:MM is resolved on the day the job was due
                case ONCE -> TimeParser.parse(rule.getTime(), lastTrigger.toLocalDate());
                case DAILY -> lastTrigger.plusDays(1);
                case WEEKLY -> lastTrigger.plusWeeks(1);
                case HOURLY -> lastTrigger.plusHours(1);
                case INTERVAL -> lastTrigger.plus(intervalOf(rule));
            };
        } catch (DateTimeException | ArithmeticException e) {
            throw new ConfigurationException("Next run of rule " + rule + " after " + lastTrigger + " is out of range", e);
        }
    }

    private static Duration intervalOf(RecurrenceRule rule) throws ConfigurationException {
        Long seconds = rule.getSeconds();
        if (seconds == null || seconds <= 0) {
            throw new ConfigurationException("Interval rule requires seconds > 0, got " + seconds);
        }
        return Duration.ofSeconds(seconds);
    }
}
