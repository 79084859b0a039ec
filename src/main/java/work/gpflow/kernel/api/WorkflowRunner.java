package work.gpflow.kernel.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.commands.files.WriteCommandSummaryToFile;
import work.gpflow.kernel.external.Collaborators;
import work.gpflow.kernel.runtime.CommandFactory;
import work.gpflow.kernel.runtime.CommandFileLoader;
import work.gpflow.kernel.runtime.WorkflowProcessor;

/**
 * Public entry point for embedding the workflow engine.
 */
public final class WorkflowRunner {
    private static final Logger LOG = LoggerFactory.getLogger(WorkflowRunner.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final Collaborators collaborators;
    private final CommandFactory factory;

    public WorkflowRunner() {
        this(Collaborators.defaults(), CommandFactory.create());
    }

    public WorkflowRunner(Collaborators collaborators, CommandFactory factory) {
        this.collaborators = Objects.requireNonNull(collaborators, "collaborators");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    public RunResult run(RunConfiguration configuration) {
        var started = Instant.now();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("commandFile", configuration.commandFile().toString());
        metadata.put("workingDirectory", configuration.workingDirectory().toString());
        metadata.put("logLevel", configuration.logLevel().name());
        try {
            var commands = new CommandFileLoader(factory).load(configuration.commandFile());
            var processor = new WorkflowProcessor(configuration.workingDirectory(), configuration.properties(), collaborators)
                .addCommands(commands);
            var summary = processor.executeAll();
            metadata.put("summary", summary.toSerializableMap());
            if (configuration.summaryFile().isPresent()) {
                writeSummary(configuration.summaryFile().get(), processor.commands());
                metadata.put("summaryFile", configuration.summaryFile().get().toString());
            }
            if (summary.succeeded()) {
                return RunResult.success(metadata, started);
            }
            return RunResult.failure(
                summary.failed() + " of " + summary.executed() + " commands failed",
                metadata,
                started
            );
        } catch (Exception ex) {
            if (Boolean.getBoolean("gpflow.debug")) {
                LOG.error("Workflow run failed", ex);
            }
            return RunResult.failure(ex.getMessage(), metadata, started);
        }
    }

    private static void writeSummary(Path file, List<Command> commands) throws IOException {
        var parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        JSON.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), WriteCommandSummaryToFile.summarize(commands));
    }
}
