package work.gpflow.kernel.properties;

public final class UnknownFormatterException extends PropertyException {
    public UnknownFormatterException(String code) {
        super("formatter/unknown", code, "Unknown path formatter code: " + code);
    }
}
