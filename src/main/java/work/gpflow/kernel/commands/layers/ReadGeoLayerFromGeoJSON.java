package work.gpflow.kernel.commands.layers;

import java.nio.file.Path;
import java.util.List;
import work.gpflow.kernel.check.CheckRequest;
import work.gpflow.kernel.check.FailPolicy;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.command.Effect;
import work.gpflow.kernel.command.ParameterMetadata;
import work.gpflow.kernel.command.ParameterType;
import work.gpflow.kernel.model.GeoLayer;
import work.gpflow.kernel.registry.EntityKind;
import work.gpflow.kernel.runtime.WorkflowContext;

/**
 * Reads a GeoJSON file into a GeoLayer; the ID defaults to the file name without extension.
 */
public final class ReadGeoLayerFromGeoJSON extends Command {
    public static final String NAME = "ReadGeoLayerFromGeoJSON";

    public ReadGeoLayerFromGeoJSON() {
        super(NAME, List.of(
            ParameterMetadata.required("SpatialDataFile", ParameterType.PATH),
            ParameterMetadata.optional("GeoLayerID", ParameterType.STRING, "%f"),
            ParameterMetadata.collision("IfGeoLayerIDExists")
        ));
    }

    @Override
    protected Effect prepareRun(WorkflowContext ctx) {
        var file = path(ctx, "SpatialDataFile");
        if (!require(ctx, CheckRequest.filePath("SpatialDataFile", file), FailPolicy.FAIL)) {
            return null;
        }
        var id = formatted(ctx, "GeoLayerID", file);
        var policy = collisionPolicy("IfGeoLayerIDExists");
        requireOutput(ctx, EntityKind.GEO_LAYER, "GeoLayerID", id, policy);
        return () -> {
            var handle = ctx.collaborators().layerCodec().readLayer(Path.of(file));
            registerOutput(ctx.layers(), id, new GeoLayer(id, handle, file), policy);
        };
    }
}
