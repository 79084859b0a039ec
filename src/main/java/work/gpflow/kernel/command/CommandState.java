package work.gpflow.kernel.command;

/**
 * Lifecycle of one command invocation. VALIDATION_FAILED, COMPLETED and SKIPPED are terminal.
 */
public enum CommandState {
    CREATED,
    VALIDATING,
    VALIDATION_FAILED,
    READY,
    RUNNING,
    COMPLETED,
    SKIPPED;

    public boolean canTransitionTo(CommandState next) {
        return switch (this) {
            case CREATED -> next == VALIDATING;
            case VALIDATING -> next == VALIDATION_FAILED || next == READY;
            case READY -> next == RUNNING;
            case RUNNING -> next == COMPLETED || next == SKIPPED;
            case VALIDATION_FAILED, COMPLETED, SKIPPED -> false;
        };
    }

    public boolean isTerminal() {
        return this == VALIDATION_FAILED || this == COMPLETED || this == SKIPPED;
    }
}
