package work.gpflow.kernel.cli;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.gpflow.kernel.api.LogLevel;
import work.gpflow.kernel.api.RunConfiguration;
import work.gpflow.kernel.api.WorkflowRunner;
import work.gpflow.kernel.config.WorkflowConfig;
import work.gpflow.kernel.config.WorkflowConfigLoader;
import work.gpflow.kernel.value.TypedValue;

@CommandLine.Command(
    name = "gpflow",
    description = "Validate and run a workflow command file.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class GpflowRunCommand implements Callable<Integer> {
    static final String LOG_LEVEL_PROPERTY = "gpflow.log.level";

    @CommandLine.Option(
        names = {"-c", "--commands"},
        required = true,
        paramLabel = "FILE",
        description = "Command file to run, one command per line."
    )
    private Path commandFile;

    @CommandLine.Option(
        names = {"-w", "--working-dir"},
        paramLabel = "DIR",
        description = "Working directory for relative paths (default: folder of the command file)."
    )
    private Path workingDirectory;

    @CommandLine.Option(
        names = {"-p", "--property"},
        paramLabel = "NAME=VALUE",
        description = "Initial property, repeatable."
    )
    private Map<String, String> properties = new LinkedHashMap<>();

    @CommandLine.Option(
        names = "--config",
        paramLabel = "FILE",
        description = "TOML file with [properties] and [run] tables."
    )
    private Path configFile;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--summary",
        paramLabel = "FILE",
        description = "Write a JSON summary of every command to this file."
    )
    private Path summaryFile;

    @Override
    public Integer call() {
        var config = configFile == null ? WorkflowConfig.empty() : WorkflowConfigLoader.load(configFile);
        var logLevel = LogLevel.from(logLevelRaw != null ? logLevelRaw : config.logLevel().orElse(null));
        System.setProperty(LOG_LEVEL_PROPERTY, logLevel.backendName());

        var builder = RunConfiguration.builder()
            .commandFile(commandFile)
            .logLevel(logLevel)
            .properties(config.properties());
        properties.forEach((name, value) -> builder.property(name, new TypedValue.Text(value)));
        if (workingDirectory != null) {
            builder.workingDirectory(workingDirectory.toAbsolutePath().normalize());
        } else {
            config.workingDirectory().ifPresent(builder::workingDirectory);
        }
        if (summaryFile != null) {
            builder.summaryFile(summaryFile.toAbsolutePath());
        } else {
            config.summaryFile().ifPresent(builder::summaryFile);
        }

        var result = new WorkflowRunner().run(builder.build());
        System.out.println(result.toPrettyJson());
        return result.status().exitCode();
    }
}
