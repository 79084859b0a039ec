package work.gpflow.kernel.commands.files;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import work.gpflow.kernel.check.CheckRequest;
import work.gpflow.kernel.check.FailPolicy;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.command.Effect;
import work.gpflow.kernel.command.ParameterMetadata;
import work.gpflow.kernel.command.ParameterType;
import work.gpflow.kernel.runtime.WorkflowContext;

public final class CopyFile extends Command {
    public static final String NAME = "CopyFile";

    public CopyFile() {
        super(NAME, List.of(
            ParameterMetadata.required("SourceFile", ParameterType.PATH),
            ParameterMetadata.required("DestinationFile", ParameterType.PATH),
            ParameterMetadata.choice("IfSourceFileNotFound", MissingSourceHandling.WARN,
                MissingSourceHandling.IGNORE, MissingSourceHandling.WARN, MissingSourceHandling.FAIL)
        ));
    }

    @Override
    protected Effect prepareRun(WorkflowContext ctx) {
        var source = path(ctx, "SourceFile");
        var destination = path(ctx, "DestinationFile");
        if (!Files.isRegularFile(Path.of(source))) {
            var policy = MissingSourceHandling.failPolicy(text("IfSourceFileNotFound"));
            if (policy.isEmpty()) {
                return Effect.NONE;
            }
            require(ctx, CheckRequest.filePath("SourceFile", source), policy.get());
            return null;
        }
        require(ctx, CheckRequest.fileFolder("DestinationFile", destination), FailPolicy.FAIL);
        return () -> Files.copy(Path.of(source), Path.of(destination), StandardCopyOption.REPLACE_EXISTING);
    }
}
