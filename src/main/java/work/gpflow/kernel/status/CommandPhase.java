package work.gpflow.kernel.status;

/**
 * Logical stage of a command invocation; each phase accumulates its own severity.
 */
public enum CommandPhase {
    /** Parameter syntax and type checks. */
    INITIALIZATION,
    /** Light pre-run scan, used to publish expected outputs. */
    DISCOVERY,
    /** Runtime precondition checks and the effect itself. */
    RUN
}
