package work.gpflow.kernel.commands.properties;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import work.gpflow.kernel.check.CheckRequest;
import work.gpflow.kernel.check.FailPolicy;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.command.Effect;
import work.gpflow.kernel.command.ParameterMetadata;
import work.gpflow.kernel.command.ParameterType;
import work.gpflow.kernel.properties.PropertyStore;
import work.gpflow.kernel.runtime.WorkflowContext;
import work.gpflow.kernel.value.TypedValue;

/**
 * Writes selected properties as {@code Name=value} lines or a JSON object.
 */
public final class WritePropertiesToFile extends Command {
    public static final String NAME = "WritePropertiesToFile";
    private static final ObjectMapper JSON = new ObjectMapper();

    public WritePropertiesToFile() {
        super(NAME, List.of(
            ParameterMetadata.required("OutputFile", ParameterType.PATH),
            ParameterMetadata.optional("IncludeProperties", ParameterType.LIST, "*"),
            ParameterMetadata.choice("FileFormat", "NameValue", "NameValue", "JSON"),
            ParameterMetadata.choice("SortOrder", "Ascending", "Ascending", "Descending", "None")
        ));
    }

    @Override
    protected Effect prepareRun(WorkflowContext ctx) {
        var output = path(ctx, "OutputFile");
        if (!require(ctx, CheckRequest.fileFolder("OutputFile", output), FailPolicy.FAIL)) {
            return null;
        }
        var selected = select(ctx.properties(), items("IncludeProperties"), text("SortOrder"));
        var json = "JSON".equals(text("FileFormat"));
        return () -> Files.writeString(Path.of(output), json ? toJson(selected) : toNameValue(selected), StandardCharsets.UTF_8);
    }

    static Map<String, TypedValue> select(PropertyStore store, List<String> globs, String sortOrder) {
        var patterns = globs.isEmpty() ? List.of(globToPattern("*")) : globs.stream().map(WritePropertiesToFile::globToPattern).toList();
        var names = new ArrayList<>(store.names());
        if ("Ascending".equals(sortOrder)) {
            Collections.sort(names);
        } else if ("Descending".equals(sortOrder)) {
            names.sort(Collections.reverseOrder());
        }
        var selected = new LinkedHashMap<String, TypedValue>();
        for (String name : names) {
            if (patterns.stream().anyMatch(pattern -> pattern.matcher(name).matches())) {
                selected.put(name, store.get(name));
            }
        }
        return selected;
    }

    static Pattern globToPattern(String glob) {
        var regex = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }

    private static String toNameValue(Map<String, TypedValue> selected) {
        var out = new StringBuilder();
        selected.forEach((name, value) -> {
            var rendered = value.render();
            boolean quoted = value instanceof TypedValue.Text || value instanceof TypedValue.FilePath;
            out.append(name).append('=').append(quoted ? "\"" + rendered.replace("\"", "\\\"") + "\"" : rendered).append('\n');
        });
        return out.toString();
    }

    private static String toJson(Map<String, TypedValue> selected) throws IOException {
        ObjectNode root = JSON.createObjectNode();
        selected.forEach((name, value) -> {
            if (value instanceof TypedValue.Bool bool) {
                root.put(name, bool.value());
            } else if (value instanceof TypedValue.Int number) {
                root.put(name, number.value());
            } else if (value instanceof TypedValue.Decimal number) {
                root.put(name, number.value());
            } else if (value instanceof TypedValue.Items list) {
                var array = root.putArray(name);
                list.values().forEach(array::add);
            } else {
                root.put(name, value.render());
            }
        });
        return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(root) + "\n";
    }
}
