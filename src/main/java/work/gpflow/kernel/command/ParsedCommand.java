package work.gpflow.kernel.command;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record ParsedCommand(String name, Map<String, String> parameters) {
    public ParsedCommand {
        Objects.requireNonNull(name, "name");
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
