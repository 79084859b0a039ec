package work.gpflow.kernel.api;

import java.util.Locale;

/**
 * Log thresholds accepted on the command line; {@code FATAL} maps to the logging backend's ERROR.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return INFO;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    public String backendName() {
        return this == FATAL ? ERROR.name() : name();
    }
}
