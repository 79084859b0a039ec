package work.gpflow.kernel.commands.tables;

import java.nio.file.Path;
import java.util.List;
import work.gpflow.kernel.check.CheckRequest;
import work.gpflow.kernel.check.FailPolicy;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.command.Effect;
import work.gpflow.kernel.command.ParameterMetadata;
import work.gpflow.kernel.command.ParameterType;
import work.gpflow.kernel.external.TableLayout;
import work.gpflow.kernel.registry.EntityKind;
import work.gpflow.kernel.runtime.WorkflowContext;

public final class WriteTableToDelimitedFile extends Command {
    public static final String NAME = "WriteTableToDelimitedFile";

    public WriteTableToDelimitedFile() {
        super(NAME, List.of(
            ParameterMetadata.required("TableID", ParameterType.STRING),
            ParameterMetadata.required("OutputFile", ParameterType.PATH),
            ParameterMetadata.optional("Delimiter", ParameterType.STRING, ","),
            ParameterMetadata.optional("WriteHeaderRow", ParameterType.BOOLEAN, "True")
        ));
    }

    @Override
    protected void validateParameters(WorkflowContext ctx) {
        if (Delimiters.parse(text("Delimiter")).isEmpty()) {
            failParameter("The Delimiter (" + text("Delimiter") + ") must be a single character.", "Specify one character or \\t.");
        }
    }

    @Override
    protected Effect prepareRun(WorkflowContext ctx) {
        var id = expand(ctx, "TableID");
        var output = path(ctx, "OutputFile");
        requireInput(ctx, EntityKind.TABLE, "TableID", id);
        require(ctx, CheckRequest.fileFolder("OutputFile", output), FailPolicy.FAIL);
        if (isBlocked()) {
            return null;
        }
        var table = ctx.tables().get(id).orElseThrow();
        var layout = TableLayout.delimited(Delimiters.parse(text("Delimiter")).orElseThrow(), bool("WriteHeaderRow"));
        return () -> ctx.collaborators().tableCodec().writeTable(table, Path.of(output), layout);
    }
}
