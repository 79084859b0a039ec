package work.gpflow.kernel.external;

/**
 * Failure reported by an external collaborator (geometry engine, codec, archive or download service).
 */
public final class CollaboratorException extends RuntimeException {
    private final String code;

    public CollaboratorException(String code, String message) {
        super(message);
        this.code = code;
    }

    public CollaboratorException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
