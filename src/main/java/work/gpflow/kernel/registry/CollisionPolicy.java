package work.gpflow.kernel.registry;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * What {@link EntityRegistry#register} does when the target ID is already taken.
 */
public enum CollisionPolicy {
    REPLACE("Replace"),
    REPLACE_AND_WARN("ReplaceAndWarn"),
    WARN("Warn"),
    FAIL("Fail");

    private final String externalName;

    CollisionPolicy(String externalName) {
        this.externalName = externalName;
    }

    public String externalName() {
        return externalName;
    }

    /**
     * Case-insensitive lookup of a parameter value such as {@code ReplaceAndWarn}.
     */
    public static Optional<CollisionPolicy> lookup(String value) {
        if (value == null) {
            return Optional.empty();
        }
        var trimmed = value.trim();
        return Arrays.stream(values())
            .filter(policy -> policy.externalName.equalsIgnoreCase(trimmed))
            .findFirst();
    }

    public static List<String> externalNames() {
        return Arrays.stream(values()).map(CollisionPolicy::externalName).toList();
    }
}
