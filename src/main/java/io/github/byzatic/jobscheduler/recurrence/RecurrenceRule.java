package io.github.byzatic.jobscheduler.recurrence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.byzatic.jobscheduler.base_exceptions.ConfigurationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * How a job's trigger time advances after each run.
 * <p>
 * Stored as {@code {"frequency": "...", "time": "...", "seconds": n}}:
 * <ul>
 *   <li>{@code once}, {@code daily}, {@code weekly}, {@code hourly} carry a {@code time},
 *       either a bare {@code HH:MM} (today) or a full date-time;</li>
 *   <li>{@code interval} carries a positive {@code seconds}.</li>
 * </ul>
 * The frequency is kept as its raw tag, so a rule read back from storage with a tag this
 * version does not know still loads and only fails once it is evaluated.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RecurrenceRule {
    private final String frequency;
    private final String time;
    private final Long seconds;

    @JsonCreator
    public RecurrenceRule(@JsonProperty("frequency") @Nullable String frequency,
                          @JsonProperty("time") @Nullable String time,
                          @JsonProperty("seconds") @Nullable Long seconds) {
        this.frequency = frequency;
        this.time = time;
        this.seconds = seconds;
    }

    public static @NotNull RecurrenceRule once(@NotNull String time) {
        return new RecurrenceRule(Frequency.ONCE.tag(), Objects.requireNonNull(time), null);
    }

    public static @NotNull RecurrenceRule daily(@NotNull String time) {
        return new RecurrenceRule(Frequency.DAILY.tag(), Objects.requireNonNull(time), null);
    }

    public static @NotNull RecurrenceRule weekly(@NotNull String time) {
        return new RecurrenceRule(Frequency.WEEKLY.tag(), Objects.requireNonNull(time), null);
    }

    public static @NotNull RecurrenceRule hourly(@NotNull String time) {
        return new RecurrenceRule(Frequency.HOURLY.tag(), Objects.requireNonNull(time), null);
    }

    public static @NotNull RecurrenceRule interval(long seconds) {
        return new RecurrenceRule(Frequency.INTERVAL.tag(), null, seconds);
    }

    /**
     * Build and validate a rule from loose parts, e.g. command line arguments.
     * Interval rules ignore {@code time}, the other rules ignore {@code seconds}.
     */
    public static @NotNull RecurrenceRule of(@Nullable String frequency, @Nullable String time, @Nullable Long seconds) throws ConfigurationException {
        Frequency f = Frequency.fromTag(frequency);
        RecurrenceRule rule = f.isTimeOfDay()
                ? new RecurrenceRule(f.tag(), time, null)
                : new RecurrenceRule(f.tag(), null, seconds);
        rule.validate();
        return rule;
    }

    @JsonProperty("frequency")
    public @Nullable String getFrequencyTag() {
        return frequency;
    }

    @JsonProperty("time")
    public @Nullable String getTime() {
        return time;
    }

    @JsonProperty("seconds")
    public @Nullable Long getSeconds() {
        return seconds;
    }

    /**
     * @throws ConfigurationException if the tag is missing or unknown
     */
    public @NotNull Frequency frequency() throws ConfigurationException {
        return Frequency.fromTag(frequency);
    }

    /**
     * Checks everything that can be checked without a clock: known tag,
     * positive interval, a parseable time for time-of-day rules.
     */
    public void validate() throws ConfigurationException {
        Frequency f = frequency();
        if (f == Frequency.INTERVAL) {
            if (seconds == null || seconds <= 0) {
                throw new ConfigurationException("Interval rule requires seconds > 0, got " + seconds);
            }
        } else {
            TimeParser.validate(time);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecurrenceRule)) return false;
        RecurrenceRule that = (RecurrenceRule) o;
        return Objects.equals(frequency, that.frequency)
                && Objects.equals(time, that.time)
                && Objects.equals(seconds, that.seconds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(frequency, time, seconds);
    }

    @Override
    public String toString() {
        if (seconds != null) return frequency + "(" + seconds + "s)";
        return frequency + (time != null ? "@" + time : "");
    }
}
