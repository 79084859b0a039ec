package work.gpflow.kernel.external;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

public interface DownloadService {
    void download(URI url, Path destination, Optional<Duration> timeout) throws IOException;
}
