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

/**
 * Reads a delimited file with a header row into a Table; the ID defaults to the file name without extension.
 */
public final class ReadTableFromDelimitedFile extends Command {
    public static final String NAME = "ReadTableFromDelimitedFile";

    public ReadTableFromDelimitedFile() {
        super(NAME, List.of(
            ParameterMetadata.required("InputFile", ParameterType.PATH),
            ParameterMetadata.optional("Delimiter", ParameterType.STRING, ","),
            ParameterMetadata.optional("TableID", ParameterType.STRING, "%f"),
            ParameterMetadata.collision("IfTableIDExists")
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
        var file = path(ctx, "InputFile");
        if (!require(ctx, CheckRequest.filePath("InputFile", file), FailPolicy.FAIL)) {
            return null;
        }
        var id = formatted(ctx, "TableID", file);
        var policy = collisionPolicy("IfTableIDExists");
        requireOutput(ctx, EntityKind.TABLE, "TableID", id, policy);
        var layout = TableLayout.delimited(Delimiters.parse(text("Delimiter")).orElseThrow(), true);
        return () -> {
            var table = ctx.collaborators().tableCodec().readTable(id, Path.of(file), layout);
            registerOutput(ctx.tables(), id, table, policy);
        };
    }
}
