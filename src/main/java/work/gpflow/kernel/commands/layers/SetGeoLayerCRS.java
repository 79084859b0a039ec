package work.gpflow.kernel.commands.layers;

import java.util.List;
import java.util.Map;
import work.gpflow.kernel.check.CheckRequest;
import work.gpflow.kernel.check.FailPolicy;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.command.Effect;
import work.gpflow.kernel.command.ParameterMetadata;
import work.gpflow.kernel.command.ParameterType;
import work.gpflow.kernel.external.GeometryEngine;
import work.gpflow.kernel.registry.CollisionPolicy;
import work.gpflow.kernel.registry.EntityKind;
import work.gpflow.kernel.runtime.WorkflowContext;

/**
 * Assigns a CRS to a layer without one, otherwise reprojects it through the geometry engine.
 */
public final class SetGeoLayerCRS extends Command {
    public static final String NAME = "SetGeoLayerCRS";

    public SetGeoLayerCRS() {
        super(NAME, List.of(
            ParameterMetadata.required("GeoLayerID", ParameterType.STRING),
            ParameterMetadata.required("CRS", ParameterType.STRING)
        ));
    }

    @Override
    protected Effect prepareRun(WorkflowContext ctx) {
        var id = expand(ctx, "GeoLayerID");
        var crs = expand(ctx, "CRS").trim();
        requireInput(ctx, EntityKind.GEO_LAYER, "GeoLayerID", id);
        require(ctx, CheckRequest.crsCode("CRS", crs), FailPolicy.FAIL);
        if (isBlocked()) {
            return null;
        }
        var layer = ctx.layers().get(id).orElseThrow();
        if (crs.equalsIgnoreCase(layer.crs())) {
            return Effect.NONE;
        }
        return () -> {
            var handle = layer.crs().isBlank()
                ? layer.handle().withCrs(crs)
                : EngineOutputs.layer(
                    ctx.collaborators().geometryEngine().runAlgorithm(
                        GeometryEngine.REPROJECT,
                        Map.of(GeometryEngine.INPUT, layer.handle(), GeometryEngine.TARGET_CRS, crs)
                    ),
                    GeometryEngine.REPROJECT
                );
            ctx.layers().register(id, layer.withHandle(handle), CollisionPolicy.REPLACE);
        };
    }
}
