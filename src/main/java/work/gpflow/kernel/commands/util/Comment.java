package work.gpflow.kernel.commands.util;

import java.util.List;
import java.util.Objects;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.command.Effect;
import work.gpflow.kernel.runtime.WorkflowContext;

/**
 * {@code # ...} line, kept verbatim.
 */
public final class Comment extends Command {
    public static final String NAME = "Comment";

    private final String text;

    public Comment(String text) {
        super(NAME, List.of());
        this.text = Objects.requireNonNull(text, "text");
    }

    public String text() {
        return text;
    }

    @Override
    public String toCommandString() {
        return text;
    }

    @Override
    protected Effect prepareRun(WorkflowContext ctx) {
        return Effect.NONE;
    }
}
