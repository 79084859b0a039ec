package work.gpflow.kernel.command;

/**
 * Raised when a line of a command file is not of the form {@code Name(Param="value",...)}.
 */
public final class CommandSyntaxException extends RuntimeException {
    private final int position;

    public CommandSyntaxException(String message, int position) {
        super(message + " (at character " + (position + 1) + ")");
        this.position = position;
    }

    public int position() {
        return position;
    }
}
