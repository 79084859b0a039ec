package work.gpflow.kernel.commands.util;

import java.util.List;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.command.Effect;
import work.gpflow.kernel.runtime.WorkflowContext;

/**
 * Empty line of a command file.
 */
public final class Blank extends Command {
    public static final String NAME = "Blank";

    public Blank() {
        super(NAME, List.of());
    }

    @Override
    public String toCommandString() {
        return "";
    }

    @Override
    protected Effect prepareRun(WorkflowContext ctx) {
        return Effect.NONE;
    }
}
