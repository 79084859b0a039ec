package work.gpflow.kernel.command;

/**
 * Declared type of a command parameter. Values are coerced once during validation.
 */
public enum ParameterType {
    /** Free text, expanded and formatted when the command runs. */
    STRING,
    /** File or folder path, expanded and resolved against the working directory when the command runs. */
    PATH,
    BOOLEAN,
    INTEGER,
    DECIMAL,
    /** Comma-separated values. */
    LIST,
    /** One of the declared choices, matched case-insensitively. */
    CHOICE;

    /**
     * Types whose raw text is expanded during validation rather than at run time.
     */
    boolean expandsBeforeCoercion() {
        return this != STRING && this != PATH;
    }
}
