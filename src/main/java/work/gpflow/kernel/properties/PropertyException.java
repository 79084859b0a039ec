package work.gpflow.kernel.properties;

/**
 * Base error raised by the property store and path formatter, carrying a machine-readable code.
 */
public class PropertyException extends RuntimeException {
    private final String code;
    private final String name;

    public PropertyException(String code, String name, String message) {
        super(message);
        this.code = code;
        this.name = name;
    }

    public String code() {
        return code;
    }

    /**
     * Property name or formatter code the error refers to.
     */
    public String name() {
        return name;
    }
}
