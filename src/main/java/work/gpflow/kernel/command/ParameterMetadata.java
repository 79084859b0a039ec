package work.gpflow.kernel.command;

import java.util.List;
import java.util.Objects;
import work.gpflow.kernel.registry.CollisionPolicy;

/**
 * Static description of one command parameter.
 */
public record ParameterMetadata(String name, ParameterType type, boolean required, List<String> choices, String defaultValue) {
    public ParameterMetadata {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        choices = choices == null ? List.of() : List.copyOf(choices);
        if (type == ParameterType.CHOICE && choices.isEmpty()) {
            throw new IllegalArgumentException("Choice parameter " + name + " declares no choices");
        }
    }

    public static ParameterMetadata required(String name, ParameterType type) {
        return new ParameterMetadata(name, type, true, List.of(), null);
    }

    public static ParameterMetadata optional(String name, ParameterType type) {
        return new ParameterMetadata(name, type, false, List.of(), null);
    }

    public static ParameterMetadata optional(String name, ParameterType type, String defaultValue) {
        return new ParameterMetadata(name, type, false, List.of(), defaultValue);
    }

    public static ParameterMetadata choice(String name, String defaultValue, String... choices) {
        return new ParameterMetadata(name, ParameterType.CHOICE, false, List.of(choices), defaultValue);
    }

    public static ParameterMetadata requiredChoice(String name, String... choices) {
        return new ParameterMetadata(name, ParameterType.CHOICE, true, List.of(choices), null);
    }

    /**
     * {@code IfXxxExists} style parameter accepting the collision policy names, defaulting to {@code Replace}.
     */
    public static ParameterMetadata collision(String name) {
        return new ParameterMetadata(
            name,
            ParameterType.CHOICE,
            false,
            CollisionPolicy.externalNames(),
            CollisionPolicy.REPLACE.externalName()
        );
    }
}
