package work.gpflow.kernel.commands.files;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.gpflow.kernel.check.CheckRequest;
import work.gpflow.kernel.check.FailPolicy;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.command.Effect;
import work.gpflow.kernel.command.ParameterMetadata;
import work.gpflow.kernel.command.ParameterType;
import work.gpflow.kernel.external.ArchiveFormat;
import work.gpflow.kernel.runtime.WorkflowContext;

/**
 * Extracts a zip, tar or tar.gz archive through the archive service.
 */
public final class UnzipFile extends Command {
    public static final String NAME = "UnzipFile";
    private static final Logger LOG = LoggerFactory.getLogger(UnzipFile.class);

    public UnzipFile() {
        super(NAME, List.of(
            ParameterMetadata.required("File", ParameterType.PATH),
            ParameterMetadata.choice("FileType", null, "zip", "tar", "tar.gz"),
            ParameterMetadata.optional("OutputFolder", ParameterType.PATH),
            ParameterMetadata.optional("DeleteFile", ParameterType.BOOLEAN, "False")
        ));
    }

    @Override
    protected Effect prepareRun(WorkflowContext ctx) {
        var file = path(ctx, "File");
        if (!require(ctx, CheckRequest.filePath("File", file), FailPolicy.FAIL)) {
            return null;
        }
        var archive = Path.of(file);
        var format = has("FileType")
            ? ArchiveFormat.lookup(text("FileType"))
            : ArchiveFormat.fromFileName(archive.getFileName().toString());
        if (format.isEmpty()) {
            block("The archive type of " + archive.getFileName() + " cannot be determined.", "Specify FileType.");
            return null;
        }
        var output = has("OutputFolder") ? Path.of(path(ctx, "OutputFolder")) : archive.getParent();
        boolean delete = bool("DeleteFile");
        return () -> {
            var extracted = ctx.collaborators().archiveService().unzip(archive, output, format.get());
            LOG.debug("Extracted {} files from {} into {}", extracted.size(), archive, output);
            if (delete) {
                Files.deleteIfExists(archive);
            }
        };
    }
}
