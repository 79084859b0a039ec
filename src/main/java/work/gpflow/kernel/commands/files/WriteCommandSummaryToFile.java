package work.gpflow.kernel.commands.files;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.gpflow.kernel.check.CheckRequest;
import work.gpflow.kernel.check.FailPolicy;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.command.Effect;
import work.gpflow.kernel.command.ParameterMetadata;
import work.gpflow.kernel.command.ParameterType;
import work.gpflow.kernel.runtime.WorkflowContext;
import work.gpflow.kernel.status.CommandPhase;
import work.gpflow.kernel.status.LogRecord;

/**
 * Writes a JSON list describing every workflow command, its state and its log records.
 */
public final class WriteCommandSummaryToFile extends Command {
    public static final String NAME = "WriteCommandSummaryToFile";
    private static final ObjectMapper JSON = new ObjectMapper();

    public WriteCommandSummaryToFile() {
        super(NAME, List.of(ParameterMetadata.required("OutputFile", ParameterType.PATH)));
    }

    @Override
    protected Effect prepareRun(WorkflowContext ctx) {
        var output = path(ctx, "OutputFile");
        if (!require(ctx, CheckRequest.fileFolder("OutputFile", output), FailPolicy.FAIL)) {
            return null;
        }
        return () -> JSON.writerWithDefaultPrettyPrinter().writeValue(Path.of(output).toFile(), summarize(ctx.commands()));
    }

    public static List<Map<String, Object>> summarize(List<Command> commands) {
        var summary = new ArrayList<Map<String, Object>>();
        for (int i = 0; i < commands.size(); i++) {
            var command = commands.get(i);
            var entry = new LinkedHashMap<String, Object>();
            entry.put("index", i + 1);
            entry.put("command", command.toCommandString());
            entry.put("state", command.state().name());
            entry.put("severity", command.status().overallSeverity().name());
            var phases = new LinkedHashMap<String, Object>();
            for (CommandPhase phase : CommandPhase.values()) {
                var phaseMap = new LinkedHashMap<String, Object>();
                phaseMap.put("severity", command.status().phaseSeverity(phase).name());
                phaseMap.put("records", command.status().records(phase).stream().map(WriteCommandSummaryToFile::toMap).toList());
                phases.put(phase.name(), phaseMap);
            }
            entry.put("phases", phases);
            summary.add(entry);
        }
        return summary;
    }

    private static Map<String, Object> toMap(LogRecord record) {
        var map = new LinkedHashMap<String, Object>();
        map.put("severity", record.severity().name());
        map.put("message", record.message());
        map.put("recommendation", record.recommendation());
        return map;
    }
}
