package work.gpflow.kernel.status;

import java.util.Locale;
import java.util.Optional;

/**
 * Outcome level of a log record or command phase, ordered {@code UNKNOWN < SUCCESS < WARNING < FAILURE}.
 */
public enum Severity {
    UNKNOWN,
    SUCCESS,
    WARNING,
    FAILURE;

    public static Severity max(Severity a, Severity b) {
        if (a == null) {
            return b == null ? UNKNOWN : b;
        }
        if (b == null) {
            return a;
        }
        return a.compareTo(b) >= 0 ? a : b;
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Case-insensitive lookup used for {@code CommandStatus="Warning"} style parameters.
     */
    public static Optional<Severity> lookup(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Severity.valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
