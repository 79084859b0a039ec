package work.gpflow.kernel.external;

import java.io.IOException;
import java.nio.file.Path;

public interface LayerCodec {
    String GEOJSON = "GeoJSON";

    LayerHandle readLayer(Path path) throws IOException;

    void writeLayer(LayerHandle handle, Path path, String format) throws IOException;
}
