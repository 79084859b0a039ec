package work.gpflow.kernel.commands.files;

import java.net.URI;
import java.nio.file.Path;
import java.util.List;
import work.gpflow.kernel.check.CheckRequest;
import work.gpflow.kernel.check.FailPolicy;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.command.Effect;
import work.gpflow.kernel.command.ParameterMetadata;
import work.gpflow.kernel.command.ParameterType;
import work.gpflow.kernel.runtime.WorkflowContext;
import work.gpflow.kernel.shared.DurationParser;

/**
 * Downloads a URL to a file; the file defaults to the last URL path segment in the working directory.
 */
public final class WebGet extends Command {
    public static final String NAME = "WebGet";

    public WebGet() {
        super(NAME, List.of(
            ParameterMetadata.required("FileURL", ParameterType.STRING),
            ParameterMetadata.optional("OutputFile", ParameterType.PATH),
            ParameterMetadata.optional("Timeout", ParameterType.STRING)
        ));
    }

    @Override
    protected void validateParameters(WorkflowContext ctx) {
        try {
            DurationParser.parse(text("Timeout"));
        } catch (NumberFormatException ex) {
            failParameter(
                "The Timeout parameter value (" + text("Timeout") + ") is not a valid duration.",
                "Specify a duration such as 30, 30s, 2m or 1500ms."
            );
        }
    }

    @Override
    protected Effect prepareRun(WorkflowContext ctx) {
        var url = expand(ctx, "FileURL").strip();
        if (!require(ctx, CheckRequest.url("FileURL", url), FailPolicy.FAIL)) {
            return null;
        }
        var output = has("OutputFile") ? path(ctx, "OutputFile") : defaultOutput(ctx, url);
        if (!require(ctx, CheckRequest.fileFolder("OutputFile", output), FailPolicy.FAIL)) {
            return null;
        }
        var timeout = DurationParser.parse(text("Timeout"));
        return () -> ctx.collaborators().downloadService().download(URI.create(url), Path.of(output), timeout);
    }

    private static String defaultOutput(WorkflowContext ctx, String url) {
        var path = URI.create(url).getPath();
        var name = path == null ? "" : path.substring(path.lastIndexOf('/') + 1);
        return ctx.resolvePath(name.isEmpty() ? "index.html" : name).toString();
    }
}
