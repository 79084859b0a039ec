package work.gpflow.kernel.external;

import java.util.List;
import java.util.Map;

/**
 * Minimal engine over {@link GeoJsonLayer} handles: only {@code merge} is available.
 */
public final class GeoJsonGeometryEngine implements GeometryEngine {
    @Override
    public Map<String, Object> runAlgorithm(String name, Map<String, Object> parameters) {
        if (MERGE.equals(name)) {
            return Map.of(OUTPUT, merge(parameters));
        }
        throw new CollaboratorException("engine/unsupported-algorithm", "Unsupported geometry algorithm: " + name);
    }

    private LayerHandle merge(Map<String, Object> parameters) {
        if (!(parameters.get(LAYERS) instanceof List<?> layers) || layers.isEmpty()) {
            throw new CollaboratorException("engine/invalid-parameters", "merge requires a non-empty LAYERS list");
        }
        var targetCrs = parameters.get(TARGET_CRS) instanceof String crs && !crs.isBlank()
            ? crs
            : ((LayerHandle) layers.get(0)).crs();
        var merged = GeoJsonLayer.empty(targetCrs);
        for (Object candidate : layers) {
            if (!(candidate instanceof GeoJsonLayer layer)) {
                throw new CollaboratorException("engine/unsupported-handle", "merge only supports GeoJSON layers");
            }
            layer.features().forEach(feature -> merged.features().add(feature.deepCopy()));
        }
        return merged;
    }
}
