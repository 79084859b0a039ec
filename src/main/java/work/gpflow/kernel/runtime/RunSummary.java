package work.gpflow.kernel.runtime;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts of one {@link WorkflowProcessor#executeAll()} pass plus the reason each failed command failed.
 */
public record RunSummary(int executed, int failed, List<Failure> failures) {
    public RunSummary {
        failures = List.copyOf(failures);
    }

    public boolean succeeded() {
        return failed == 0;
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("executed", executed);
        map.put("failed", failed);
        map.put("failures", failures.stream().map(Failure::toSerializableMap).toList());
        return map;
    }

    /**
     * {@code index} is the 1-based position of the command in the workflow.
     */
    public record Failure(int index, String commandName, String reason) {
        Map<String, Object> toSerializableMap() {
            var map = new LinkedHashMap<String, Object>();
            map.put("index", index);
            map.put("command", commandName);
            map.put("reason", reason);
            return map;
        }
    }
}
