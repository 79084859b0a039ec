package work.gpflow.kernel.command;

import java.util.List;
import work.gpflow.kernel.status.LogRecord;

/**
 * Result handed from a command to the workflow processor.
 */
public sealed interface Outcome permits Outcome.Ready, Outcome.ValidationFailed, Outcome.Skipped, Outcome.Completed {
    List<LogRecord> records();

    /** WARNING and FAILURE records added while running. */
    int warningCount();

    /** True for a parameter error and for any run that logged warnings. */
    boolean failed();

    record Ready() implements Outcome {
        @Override
        public List<LogRecord> records() {
            return List.of();
        }

        @Override
        public int warningCount() {
            return 0;
        }

        @Override
        public boolean failed() {
            return false;
        }
    }

    record ValidationFailed(List<LogRecord> records) implements Outcome {
        public ValidationFailed {
            records = List.copyOf(records);
        }

        @Override
        public int warningCount() {
            return 0;
        }

        @Override
        public boolean failed() {
            return true;
        }
    }

    /** A blocking check failed and the effect never executed. */
    record Skipped(List<LogRecord> records, int warningCount) implements Outcome {
        public Skipped {
            records = List.copyOf(records);
        }

        @Override
        public boolean failed() {
            return true;
        }
    }

    record Completed(List<LogRecord> records, int warningCount) implements Outcome {
        public Completed {
            records = List.copyOf(records);
        }

        @Override
        public boolean failed() {
            return warningCount > 0;
        }
    }
}
