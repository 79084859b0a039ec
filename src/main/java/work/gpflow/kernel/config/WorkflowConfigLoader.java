package work.gpflow.kernel.config;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Optional;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.gpflow.kernel.value.TypedValue;

/**
 * Reads {@code [properties]} and {@code [run]} tables from a TOML workflow configuration.
 */
public final class WorkflowConfigLoader {
    private WorkflowConfigLoader() {}

    public static WorkflowConfig load(Path file) {
        TomlParseResult result;
        try {
            result = Toml.parse(file);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read configuration: " + file, ex);
        }
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid configuration " + file + ": " + result.errors().get(0).toString());
        }
        var base = file.toAbsolutePath().getParent();
        return fromTable(result, base);
    }

    public static WorkflowConfig parse(String text, Path baseDirectory) {
        var result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid configuration: " + result.errors().get(0).toString());
        }
        return fromTable(result, baseDirectory);
    }

    private static WorkflowConfig fromTable(TomlTable root, Path base) {
        var properties = new LinkedHashMap<String, TypedValue>();
        var table = root.getTable("properties");
        if (table != null) {
            for (String key : table.keySet()) {
                properties.put(key, toValue(table.get(key)));
            }
        }
        var run = root.getTable("run");
        Optional<Path> workingDir = Optional.empty();
        Optional<String> logLevel = Optional.empty();
        Optional<Path> summaryFile = Optional.empty();
        if (run != null) {
            workingDir = Optional.ofNullable(run.getString("workingDir")).map(value -> resolve(base, value));
            logLevel = Optional.ofNullable(run.getString("logLevel"));
            summaryFile = Optional.ofNullable(run.getString("summaryFile")).map(value -> resolve(base, value));
        }
        return new WorkflowConfig(properties, workingDir, logLevel, summaryFile);
    }

    private static TypedValue toValue(Object raw) {
        if (raw instanceof TomlArray array) {
            var items = new ArrayList<String>(array.size());
            for (int i = 0; i < array.size(); i++) {
                items.add(String.valueOf(array.get(i)));
            }
            return new TypedValue.Items(items);
        }
        if (raw instanceof TomlTable) {
            throw new IllegalArgumentException("Nested tables are not supported in [properties]");
        }
        return TypedValue.of(raw);
    }

    private static Path resolve(Path base, String value) {
        var path = Path.of(value);
        if (path.isAbsolute() || base == null) {
            return path.normalize();
        }
        return base.resolve(path).normalize();
    }
}
