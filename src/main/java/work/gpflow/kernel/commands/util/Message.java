package work.gpflow.kernel.commands.util;

import java.util.List;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.command.Effect;
import work.gpflow.kernel.command.ParameterMetadata;
import work.gpflow.kernel.command.ParameterType;
import work.gpflow.kernel.runtime.WorkflowContext;
import work.gpflow.kernel.status.Severity;

/**
 * Logs a message with the requested status; WARNING and FAILURE count as command warnings.
 */
public final class Message extends Command {
    public static final String NAME = "Message";

    public Message() {
        super(NAME, List.of(
            ParameterMetadata.required("Message", ParameterType.STRING),
            ParameterMetadata.choice("CommandStatus", "Success", "Success", "Warning", "Failure")
        ));
    }

    @Override
    protected Effect prepareRun(WorkflowContext ctx) {
        var message = expand(ctx, "Message");
        var severity = Severity.lookup(text("CommandStatus")).orElse(Severity.SUCCESS);
        return () -> logRun(
            severity,
            message,
            severity == Severity.SUCCESS ? "" : "See the message for the reason this command reported a problem."
        );
    }
}
