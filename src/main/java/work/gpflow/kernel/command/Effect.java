package work.gpflow.kernel.command;

/**
 * Side effect of a command, prepared after its run checks passed.
 */
@FunctionalInterface
public interface Effect {
    Effect NONE = () -> {};

    void apply() throws Exception;
}
