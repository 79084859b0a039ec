package work.gpflow.kernel.commands.util;

import java.util.List;
import java.util.Objects;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.command.Effect;
import work.gpflow.kernel.runtime.WorkflowContext;

/**
 * Line that could not be turned into a known command. It always fails validation, so it is never run.
 */
public final class UnknownCommand extends Command {
    public static final String NAME = "UnknownCommand";

    private final String line;
    private final String reason;

    public UnknownCommand(String line, String reason) {
        super(NAME, List.of());
        this.line = Objects.requireNonNull(line, "line");
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public String reason() {
        return reason;
    }

    @Override
    public String toCommandString() {
        return line;
    }

    @Override
    protected void validateParameters(WorkflowContext ctx) {
        failParameter(reason, "Correct the command name and syntax.");
    }

    @Override
    protected Effect prepareRun(WorkflowContext ctx) {
        throw new IllegalStateException("Unknown commands cannot run");
    }
}
