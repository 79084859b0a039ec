package work.gpflow.kernel.commands.layers;

import java.util.Map;
import work.gpflow.kernel.external.CollaboratorException;
import work.gpflow.kernel.external.GeometryEngine;
import work.gpflow.kernel.external.LayerHandle;

final class EngineOutputs {
    private EngineOutputs() {}

    static LayerHandle layer(Map<String, Object> outputs, String algorithm) {
        if (outputs != null && outputs.get(GeometryEngine.OUTPUT) instanceof LayerHandle handle) {
            return handle;
        }
        throw new CollaboratorException("engine/missing-output", "Algorithm " + algorithm + " returned no output layer");
    }
}
