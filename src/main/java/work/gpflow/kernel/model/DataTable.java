package work.gpflow.kernel.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * In-memory table of string cells.
 */
public record DataTable(String id, List<String> columns, List<List<String>> rows, String source) {
    public DataTable {
        Objects.requireNonNull(id, "id");
        columns = List.copyOf(columns);
        var copied = new ArrayList<List<String>>(rows.size());
        for (var row : rows) {
            copied.add(List.copyOf(row));
        }
        rows = List.copyOf(copied);
        source = source == null ? "" : source;
    }

    public int rowCount() {
        return rows.size();
    }
}
