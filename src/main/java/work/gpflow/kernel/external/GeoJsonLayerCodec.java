package work.gpflow.kernel.external;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes GeoJSON FeatureCollections with Jackson.
 */
public final class GeoJsonLayerCodec implements LayerCodec {
    private static final ObjectMapper JSON = new ObjectMapper();

    @Override
    public LayerHandle readLayer(Path path) throws IOException {
        var root = JSON.readTree(path.toFile());
        if (!(root instanceof ObjectNode object) || !"FeatureCollection".equals(object.path("type").asText())) {
            throw new IOException("Not a GeoJSON FeatureCollection: " + path);
        }
        return new GeoJsonLayer(object);
    }

    @Override
    public void writeLayer(LayerHandle handle, Path path, String format) throws IOException {
        if (format != null && !GEOJSON.equalsIgnoreCase(format)) {
            throw new CollaboratorException("codec/unsupported-format", "Unsupported layer format: " + format);
        }
        if (!(handle instanceof GeoJsonLayer layer)) {
            throw new CollaboratorException(
                "codec/unsupported-handle",
                "Cannot write " + handle.getClass().getSimpleName() + " as GeoJSON"
            );
        }
        var parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        JSON.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), layer.tree());
    }
}
