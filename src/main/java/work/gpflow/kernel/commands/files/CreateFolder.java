package work.gpflow.kernel.commands.files;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import work.gpflow.kernel.check.CheckRequest;
import work.gpflow.kernel.check.FailPolicy;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.command.Effect;
import work.gpflow.kernel.command.ParameterMetadata;
import work.gpflow.kernel.command.ParameterType;
import work.gpflow.kernel.runtime.WorkflowContext;
import work.gpflow.kernel.status.Severity;

public final class CreateFolder extends Command {
    public static final String NAME = "CreateFolder";

    public CreateFolder() {
        super(NAME, List.of(
            ParameterMetadata.required("Folder", ParameterType.PATH),
            ParameterMetadata.optional("CreateParentFolders", ParameterType.BOOLEAN, "False"),
            ParameterMetadata.choice("IfFolderExists", MissingSourceHandling.IGNORE,
                MissingSourceHandling.IGNORE, MissingSourceHandling.WARN, MissingSourceHandling.FAIL)
        ));
    }

    @Override
    protected Effect prepareRun(WorkflowContext ctx) {
        var folder = Path.of(path(ctx, "Folder"));
        if (Files.isDirectory(folder)) {
            switch (text("IfFolderExists")) {
                case MissingSourceHandling.WARN -> logRun(
                    Severity.WARNING, "The folder " + folder + " already exists.", "Remove the folder first if it should be new.");
                case MissingSourceHandling.FAIL -> block(
                    "The folder " + folder + " already exists.", "Remove the folder or set IfFolderExists.");
                default -> { }
            }
            return Effect.NONE;
        }
        boolean parents = bool("CreateParentFolders");
        if (!parents) {
            require(ctx, CheckRequest.fileFolder("Folder", folder.toString()), FailPolicy.FAIL);
        }
        return () -> {
            if (parents) {
                Files.createDirectories(folder);
            } else {
                Files.createDirectory(folder);
            }
        };
    }
}
