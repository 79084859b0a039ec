package work.gpflow.kernel.external;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import work.gpflow.kernel.model.DataTable;

/**
 * Delimited text tables via Apache Commons CSV. The sheet option is ignored.
 */
public final class DelimitedTableCodec implements TableCodec {
    @Override
    public DataTable readTable(String id, Path path, TableLayout layout) throws IOException {
        var builder = CSVFormat.DEFAULT.builder()
            .setDelimiter(layout.delimiter())
            .setIgnoreSurroundingSpaces(true);
        if (layout.headerRow()) {
            builder.setHeader().setSkipHeaderRecord(true);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = new CSVParser(reader, builder.build())) {
            var rows = new ArrayList<List<String>>();
            int width = 0;
            for (CSVRecord record : parser) {
                rows.add(record.toList());
                width = Math.max(width, record.size());
            }
            List<String> columns = layout.headerRow() ? parser.getHeaderNames() : numberedColumns(width);
            return new DataTable(id, columns, rows, path.toString());
        }
    }

    @Override
    public void writeTable(DataTable table, Path path, TableLayout layout) throws IOException {
        var parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        var format = CSVFormat.DEFAULT.builder().setDelimiter(layout.delimiter()).build();
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            if (layout.headerRow()) {
                printer.printRecord(table.columns());
            }
            for (var row : table.rows()) {
                printer.printRecord(row);
            }
        }
    }

    private static List<String> numberedColumns(int width) {
        var columns = new ArrayList<String>(width);
        for (int i = 1; i <= width; i++) {
            columns.add("Column" + i);
        }
        return columns;
    }
}
