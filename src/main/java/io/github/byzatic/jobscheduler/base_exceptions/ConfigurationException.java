package io.github.byzatic.jobscheduler.base_exceptions;

/**
 * A recurrence rule or job definition that cannot be scheduled:
 * unknown frequency tag, missing or unparseable time, non-positive interval.
 */
public class ConfigurationException extends Exception {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(Throwable cause) {
        super(cause);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConfigurationException(Throwable cause, String message) {
        super(message, cause);
    }
}
