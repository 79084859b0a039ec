package work.gpflow.kernel.registry;

/**
 * Result of a registration attempt; the caller turns {@code warned}/{@code failed} into log records.
 */
public record RegisterOutcome(boolean inserted, boolean warned, boolean failed) {
    public static final RegisterOutcome INSERTED = new RegisterOutcome(true, false, false);
    public static final RegisterOutcome REPLACED_WITH_WARNING = new RegisterOutcome(true, true, false);
    public static final RegisterOutcome KEPT_WITH_WARNING = new RegisterOutcome(false, true, false);
    public static final RegisterOutcome REJECTED = new RegisterOutcome(false, false, true);

    public RegisterOutcome {
        if (inserted && failed) {
            throw new IllegalArgumentException("An inserted registration cannot be failed");
        }
    }
}
