package work.gpflow.kernel.config;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import work.gpflow.kernel.value.TypedValue;

/**
 * Settings read from a workflow TOML file; paths are already resolved against the file's folder.
 */
public record WorkflowConfig(
    Map<String, TypedValue> properties,
    Optional<Path> workingDirectory,
    Optional<String> logLevel,
    Optional<Path> summaryFile
) {
    public WorkflowConfig {
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static WorkflowConfig empty() {
        return new WorkflowConfig(Map.of(), Optional.empty(), Optional.empty(), Optional.empty());
    }
}
