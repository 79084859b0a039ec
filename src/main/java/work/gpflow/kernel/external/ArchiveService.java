package work.gpflow.kernel.external;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public interface ArchiveService {
    /**
     * Extracts {@code archive} into {@code destination} and returns the extracted files.
     */
    List<Path> unzip(Path archive, Path destination, ArchiveFormat format) throws IOException;
}
