package work.gpflow.kernel.status;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-command aggregator of log records. Each phase keeps its records in insertion order and a
 * severity that never drops below the worst record logged under it.
 */
public final class CommandStatus {
    private final Map<CommandPhase, List<LogRecord>> records = new EnumMap<>(CommandPhase.class);
    private final Map<CommandPhase, Severity> floors = new EnumMap<>(CommandPhase.class);

    public CommandStatus() {
        for (CommandPhase phase : CommandPhase.values()) {
            records.put(phase, new ArrayList<>());
            floors.put(phase, Severity.UNKNOWN);
        }
    }

    public void addLog(CommandPhase phase, LogRecord record) {
        if (phase == null || record == null) {
            return;
        }
        records.get(phase).add(record);
    }

    public void addLog(LogRecord record) {
        if (record != null) {
            addLog(record.phase(), record);
        }
    }

    /**
     * Raises the phase severity to at least {@code floor}; used to mark a phase SUCCESS once it completed
     * without problems.
     */
    public void refreshPhaseSeverity(CommandPhase phase, Severity floor) {
        if (phase == null || floor == null) {
            return;
        }
        floors.put(phase, Severity.max(floors.get(phase), floor));
    }

    public Severity phaseSeverity(CommandPhase phase) {
        Severity severity = floors.get(phase);
        for (LogRecord record : records.get(phase)) {
            severity = Severity.max(severity, record.severity());
        }
        return severity;
    }

    public Severity overallSeverity() {
        Severity severity = Severity.UNKNOWN;
        for (CommandPhase phase : CommandPhase.values()) {
            severity = Severity.max(severity, phaseSeverity(phase));
        }
        return severity;
    }

    public List<LogRecord> records(CommandPhase phase) {
        return Collections.unmodifiableList(records.get(phase));
    }

    public List<LogRecord> allRecords() {
        List<LogRecord> all = new ArrayList<>();
        for (CommandPhase phase : CommandPhase.values()) {
            all.addAll(records.get(phase));
        }
        return all;
    }

    public int count(CommandPhase phase, Severity severity) {
        int count = 0;
        for (CommandPhase candidate : CommandPhase.values()) {
            if (phase != null && candidate != phase) {
                continue;
            }
            for (LogRecord record : records.get(candidate)) {
                if (record.severity() == severity) {
                    count++;
                }
            }
        }
        return count;
    }

    /**
     * Clears one phase, or every phase when {@code phase} is null, back to UNKNOWN.
     */
    public void clear(CommandPhase phase) {
        for (CommandPhase candidate : CommandPhase.values()) {
            if (phase == null || candidate == phase) {
                records.get(candidate).clear();
                floors.put(candidate, Severity.UNKNOWN);
            }
        }
    }
}
