package work.gpflow.kernel.properties;

public final class MissingPropertyException extends PropertyException {
    public MissingPropertyException(String name) {
        super("property/missing", name, "Property is not defined: " + name);
    }
}
