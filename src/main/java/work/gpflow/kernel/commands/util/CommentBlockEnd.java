package work.gpflow.kernel.commands.util;

import java.util.List;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.command.Effect;
import work.gpflow.kernel.runtime.WorkflowContext;

public final class CommentBlockEnd extends Command {
    public static final String NAME = "CommentBlockEnd";
    public static final String MARKER = "*/";

    public CommentBlockEnd() {
        super(NAME, List.of());
    }

    @Override
    public String toCommandString() {
        return MARKER;
    }

    @Override
    protected Effect prepareRun(WorkflowContext ctx) {
        return Effect.NONE;
    }
}
