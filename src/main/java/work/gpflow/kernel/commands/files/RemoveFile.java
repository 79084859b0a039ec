package work.gpflow.kernel.commands.files;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import work.gpflow.kernel.check.CheckRequest;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.command.Effect;
import work.gpflow.kernel.command.ParameterMetadata;
import work.gpflow.kernel.command.ParameterType;
import work.gpflow.kernel.runtime.WorkflowContext;

/**
 * Removes a file, or a whole folder when {@code RemoveIfFolder=True}.
 */
public final class RemoveFile extends Command {
    public static final String NAME = "RemoveFile";

    public RemoveFile() {
        super(NAME, List.of(
            ParameterMetadata.required("SourceFile", ParameterType.PATH),
            ParameterMetadata.choice("IfSourceFileNotFound", MissingSourceHandling.WARN,
                MissingSourceHandling.IGNORE, MissingSourceHandling.WARN, MissingSourceHandling.FAIL),
            ParameterMetadata.optional("RemoveIfFolder", ParameterType.BOOLEAN, "False")
        ));
    }

    @Override
    protected Effect prepareRun(WorkflowContext ctx) {
        var source = Path.of(path(ctx, "SourceFile"));
        if (Files.isDirectory(source)) {
            if (!bool("RemoveIfFolder")) {
                block("The SourceFile (" + source + ") is a folder.", "Set RemoveIfFolder=True to remove folders.");
                return null;
            }
            return () -> deleteTree(source);
        }
        if (!Files.isRegularFile(source)) {
            var policy = MissingSourceHandling.failPolicy(text("IfSourceFileNotFound"));
            if (policy.isEmpty()) {
                return Effect.NONE;
            }
            require(ctx, CheckRequest.filePath("SourceFile", source.toString()), policy.get());
            return null;
        }
        return () -> Files.deleteIfExists(source);
    }

    private static void deleteTree(Path root) throws IOException {
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        }
    }
}
