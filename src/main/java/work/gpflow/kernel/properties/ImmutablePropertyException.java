package work.gpflow.kernel.properties;

public final class ImmutablePropertyException extends PropertyException {
    public ImmutablePropertyException(String name) {
        super("property/immutable", name, "Property is write-once and already set: " + name);
    }
}
