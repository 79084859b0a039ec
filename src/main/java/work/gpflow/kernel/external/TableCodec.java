package work.gpflow.kernel.external;

import java.io.IOException;
import java.nio.file.Path;
import work.gpflow.kernel.model.DataTable;

public interface TableCodec {
    DataTable readTable(String id, Path path, TableLayout layout) throws IOException;

    void writeTable(DataTable table, Path path, TableLayout layout) throws IOException;
}
