package work.gpflow.kernel.properties;

import java.util.List;
import java.util.Objects;

/**
 * Expanded text plus the names of {@code ${...}} tokens that could not be resolved (left verbatim).
 */
public record ExpansionResult(String value, List<String> unresolved) {
    public ExpansionResult {
        Objects.requireNonNull(value, "value");
        unresolved = unresolved == null ? List.of() : List.copyOf(unresolved);
    }

    public boolean complete() {
        return unresolved.isEmpty();
    }
}
