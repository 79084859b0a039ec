package work.gpflow.kernel.runtime;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.command.CommandState;
import work.gpflow.kernel.command.Outcome;
import work.gpflow.kernel.commands.util.CommentBlockEnd;
import work.gpflow.kernel.commands.util.CommentBlockStart;
import work.gpflow.kernel.commands.util.Exit;
import work.gpflow.kernel.external.Collaborators;
import work.gpflow.kernel.status.CommandPhase;
import work.gpflow.kernel.status.LogRecord;
import work.gpflow.kernel.status.Severity;
import work.gpflow.kernel.value.TypedValue;

/**
 * Runs an ordered command list against a fresh {@link WorkflowContext}. Commands run strictly in order; a
 * failing command is recorded and the next one still runs. Command instances are single use, so a processor
 * supports one {@link #executeAll()} or {@link #discoverAll()} pass.
 */
public final class WorkflowProcessor {
    private static final Logger LOG = LoggerFactory.getLogger(WorkflowProcessor.class);

    private final List<Command> commands = new ArrayList<>();
    private final Path workingDirectory;
    private final Map<String, TypedValue> initialProperties;
    private final Collaborators collaborators;
    private WorkflowContext context;

    public WorkflowProcessor(Path workingDirectory) {
        this(workingDirectory, Map.of(), Collaborators.defaults());
    }

    public WorkflowProcessor(Path workingDirectory, Map<String, TypedValue> initialProperties, Collaborators collaborators) {
        this.workingDirectory = workingDirectory;
        this.initialProperties = new LinkedHashMap<>(initialProperties == null ? Map.of() : initialProperties);
        this.collaborators = Objects.requireNonNull(collaborators, "collaborators");
    }

    public WorkflowProcessor addCommand(Command command) {
        commands.add(Objects.requireNonNull(command, "command"));
        return this;
    }

    public WorkflowProcessor addCommands(List<? extends Command> toAdd) {
        toAdd.forEach(this::addCommand);
        return this;
    }

    public List<Command> commands() {
        return Collections.unmodifiableList(commands);
    }

    /**
     * Context of the last pass, or {@code null} before the first one.
     */
    public WorkflowContext context() {
        return context;
    }

    public RunSummary executeAll() {
        startPass();
        int executed = 0;
        var failures = new ArrayList<RunSummary.Failure>();
        var pass = new Pass();
        for (int i = 0; i < commands.size(); i++) {
            var command = commands.get(i);
            if (!pass.shouldProcess(command)) {
                continue;
            }
            LOG.info("-> Start processing command {} of {}: {}", i + 1, commands.size(), command.toCommandString());
            executed++;
            Outcome outcome;
            try {
                outcome = command.validate(context);
                if (outcome instanceof Outcome.Ready) {
                    outcome = command.run(context);
                }
            } catch (RuntimeException ex) {
                LOG.error("Unexpected error processing command {} of {}: {}", i + 1, commands.size(), command.name(), ex);
                command.status().addLog(LogRecord.failure(
                    CommandPhase.RUN,
                    "Unexpected error processing " + command.name() + ": " + ex.getMessage(),
                    "Check the log file for details."
                ));
                failures.add(new RunSummary.Failure(i + 1, command.name(), "Unexpected error: " + ex.getMessage()));
                continue;
            }
            if (outcome.failed()) {
                var reason = failureReason(outcome);
                LOG.warn("Command {} of {} ({}) failed: {}", i + 1, commands.size(), command.name(), reason);
                failures.add(new RunSummary.Failure(i + 1, command.name(), reason));
            }
            if (command instanceof Exit && command.state() == CommandState.COMPLETED) {
                LOG.info("Exit command found at {} of {}, skipping the remaining commands", i + 1, commands.size());
                break;
            }
        }
        var summary = new RunSummary(executed, failures.size(), failures);
        LOG.info("Processed {} of {} commands, {} failed", executed, commands.size(), summary.failed());
        return summary;
    }

    /**
     * Validates every command and runs its discovery step, without running any effect.
     */
    public RunSummary discoverAll() {
        startPass();
        int validated = 0;
        var failures = new ArrayList<RunSummary.Failure>();
        var pass = new Pass();
        for (int i = 0; i < commands.size(); i++) {
            var command = commands.get(i);
            if (!pass.shouldProcess(command)) {
                continue;
            }
            validated++;
            try {
                var outcome = command.validate(context);
                if (outcome instanceof Outcome.Ready) {
                    command.discover(context);
                } else {
                    failures.add(new RunSummary.Failure(i + 1, command.name(), failureReason(outcome)));
                }
            } catch (RuntimeException ex) {
                LOG.error("Unexpected error discovering command {} of {}: {}", i + 1, commands.size(), command.name(), ex);
                command.status().addLog(LogRecord.failure(
                    CommandPhase.DISCOVERY,
                    "Unexpected error discovering " + command.name() + ": " + ex.getMessage(),
                    "Check the log file for details."
                ));
                failures.add(new RunSummary.Failure(i + 1, command.name(), "Unexpected error: " + ex.getMessage()));
                continue;
            }
            if (command instanceof Exit) {
                break;
            }
        }
        return new RunSummary(validated, failures.size(), failures);
    }

    private void startPass() {
        for (Command command : commands) {
            if (command.state() != CommandState.CREATED) {
                throw new IllegalStateException("Workflow commands were already processed; load them again to rerun");
            }
        }
        context = WorkflowContext.create(workingDirectory, initialProperties, collaborators);
        context.attachCommands(commands);
    }

    private static String failureReason(Outcome outcome) {
        if (outcome instanceof Outcome.ValidationFailed failed) {
            var first = failed.records().stream()
                .filter(record -> record.severity() == Severity.FAILURE)
                .findFirst()
                .map(LogRecord::message)
                .orElse("invalid parameters");
            return "Parameter error: " + first;
        }
        return "There were " + outcome.warningCount() + " warnings processing the command.";
    }

    /**
     * Tracks comment blocks; commands inside a block are neither executed nor failed.
     */
    private static final class Pass {
        private boolean inCommentBlock;

        boolean shouldProcess(Command command) {
            if (command instanceof CommentBlockEnd) {
                inCommentBlock = false;
                return true;
            }
            if (inCommentBlock) {
                return false;
            }
            if (command instanceof CommentBlockStart) {
                inCommentBlock = true;
            }
            return true;
        }
    }
}
