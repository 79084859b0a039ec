package work.gpflow.kernel.external;

import java.util.Map;

/**
 * Opaque geometry/raster algorithm runner.
 */
public interface GeometryEngine {
    String CLIP = "clip";
    String MERGE = "merge";
    String REPROJECT = "reproject";

    String INPUT = "INPUT";
    String OVERLAY = "OVERLAY";
    String LAYERS = "LAYERS";
    String TARGET_CRS = "TARGET_CRS";
    String OUTPUT = "OUTPUT";

    /**
     * Runs {@code name} and returns its outputs, e.g. {@code OUTPUT -> LayerHandle}.
     *
     * @throws CollaboratorException when the algorithm is unknown or fails
     */
    Map<String, Object> runAlgorithm(String name, Map<String, Object> parameters);
}
