package io.github.byzatic.jobscheduler.recurrence;

import io.github.byzatic.jobscheduler.base_exceptions.ConfigurationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * Recurrence tags. The tag is what gets persisted.
 */
public enum Frequency {
    ONCE("once"),
    DAILY("daily"),
    WEEKLY("weekly"),
    HOURLY("hourly"),
    INTERVAL("interval");

    private final String tag;

    Frequency(String tag) {
        this.tag = tag;
    }

    public @NotNull String tag() {
        return tag;
    }

    /**
     * Time-of-day rules take their first trigger from the rule's {@code time}.
     */
    public boolean isTimeOfDay() {
        return this != INTERVAL;
    }

    public static @NotNull Frequency fromTag(@Nullable String tag) throws ConfigurationException {
        if (tag == null || tag.isBlank()) {
            throw new ConfigurationException("Recurrence frequency is missing");
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (Frequency f : values()) {
            if (f.tag.equals(normalized)) return f;
        }
        throw new ConfigurationException("Unknown recurrence rule: " + tag);
    }
}
