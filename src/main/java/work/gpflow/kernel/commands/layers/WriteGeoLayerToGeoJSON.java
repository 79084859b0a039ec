package work.gpflow.kernel.commands.layers;

import java.nio.file.Path;
import java.util.List;
import work.gpflow.kernel.check.CheckRequest;
import work.gpflow.kernel.check.FailPolicy;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.command.Effect;
import work.gpflow.kernel.command.ParameterMetadata;
import work.gpflow.kernel.command.ParameterType;
import work.gpflow.kernel.external.LayerCodec;
import work.gpflow.kernel.registry.EntityKind;
import work.gpflow.kernel.runtime.WorkflowContext;

public final class WriteGeoLayerToGeoJSON extends Command {
    public static final String NAME = "WriteGeoLayerToGeoJSON";

    public WriteGeoLayerToGeoJSON() {
        super(NAME, List.of(
            ParameterMetadata.required("GeoLayerID", ParameterType.STRING),
            ParameterMetadata.required("OutputFile", ParameterType.PATH)
        ));
    }

    @Override
    protected Effect prepareRun(WorkflowContext ctx) {
        var id = expand(ctx, "GeoLayerID");
        var output = path(ctx, "OutputFile");
        requireInput(ctx, EntityKind.GEO_LAYER, "GeoLayerID", id);
        require(ctx, CheckRequest.fileFolder("OutputFile", output), FailPolicy.FAIL);
        if (isBlocked()) {
            return null;
        }
        var layer = ctx.layers().get(id).orElseThrow();
        return () -> ctx.collaborators().layerCodec().writeLayer(layer.handle(), Path.of(output), LayerCodec.GEOJSON);
    }
}
