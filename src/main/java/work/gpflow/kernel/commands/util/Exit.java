package work.gpflow.kernel.commands.util;

import java.util.List;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.command.Effect;
import work.gpflow.kernel.runtime.WorkflowContext;

/**
 * Stops the workflow; the processor does not process the commands that follow.
 */
public final class Exit extends Command {
    public static final String NAME = "Exit";

    public Exit() {
        super(NAME, List.of());
    }

    @Override
    protected Effect prepareRun(WorkflowContext ctx) {
        return Effect.NONE;
    }
}
