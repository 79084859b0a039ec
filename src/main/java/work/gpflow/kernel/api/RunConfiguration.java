package work.gpflow.kernel.api;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.gpflow.kernel.value.TypedValue;

/**
 * Immutable configuration of one workflow run.
 */
public record RunConfiguration(
    Path commandFile,
    Path workingDirectory,
    Map<String, TypedValue> properties,
    LogLevel logLevel,
    Optional<Path> summaryFile
) {
    public RunConfiguration {
        Objects.requireNonNull(commandFile, "commandFile");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        Objects.requireNonNull(properties, "properties");
        Objects.requireNonNull(logLevel, "logLevel");
        Objects.requireNonNull(summaryFile, "summaryFile");
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path commandFile;
        private Path workingDirectory;
        private final Map<String, TypedValue> properties = new LinkedHashMap<>();
        private LogLevel logLevel = LogLevel.INFO;
        private Optional<Path> summaryFile = Optional.empty();

        public Builder commandFile(Path commandFile) {
            this.commandFile = commandFile;
            return this;
        }

        /**
         * Defaults to the folder of the command file.
         */
        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder property(String name, TypedValue value) {
            this.properties.put(name, value);
            return this;
        }

        public Builder properties(Map<String, TypedValue> properties) {
            this.properties.putAll(properties);
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder summaryFile(Path summaryFile) {
            this.summaryFile = Optional.ofNullable(summaryFile);
            return this;
        }

        public RunConfiguration build() {
            Objects.requireNonNull(commandFile, "commandFile");
            var absolute = commandFile.toAbsolutePath().normalize();
            var workDir = workingDirectory != null ? workingDirectory : absolute.getParent();
            return new RunConfiguration(absolute, workDir, properties, logLevel, summaryFile);
        }
    }
}
