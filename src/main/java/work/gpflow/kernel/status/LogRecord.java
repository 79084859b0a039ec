package work.gpflow.kernel.status;

import java.util.Objects;

/**
 * Immutable message logged by a command under one phase.
 */
public record LogRecord(CommandPhase phase, Severity severity, String message, String recommendation) {
    public LogRecord {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(severity, "severity");
        message = message == null ? "" : message;
        recommendation = recommendation == null ? "" : recommendation;
    }

    public static LogRecord failure(CommandPhase phase, String message, String recommendation) {
        return new LogRecord(phase, Severity.FAILURE, message, recommendation);
    }

    public static LogRecord warning(CommandPhase phase, String message, String recommendation) {
        return new LogRecord(phase, Severity.WARNING, message, recommendation);
    }

    public boolean isProblem() {
        return severity.isAtLeast(Severity.WARNING);
    }
}
