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
import work.gpflow.kernel.model.GeoLayer;
import work.gpflow.kernel.registry.EntityKind;
import work.gpflow.kernel.runtime.WorkflowContext;

/**
 * Clips a layer by a polygon layer that shares its CRS.
 */
public final class ClipGeoLayer extends Command {
    public static final String NAME = "ClipGeoLayer";

    public ClipGeoLayer() {
        super(NAME, List.of(
            ParameterMetadata.required("InputGeoLayerID", ParameterType.STRING),
            ParameterMetadata.required("ClippingGeoLayerID", ParameterType.STRING),
            ParameterMetadata.optional("OutputGeoLayerID", ParameterType.STRING),
            ParameterMetadata.collision("IfGeoLayerIDExists")
        ));
    }

    @Override
    protected Effect prepareRun(WorkflowContext ctx) {
        var inputId = expand(ctx, "InputGeoLayerID");
        var clippingId = expand(ctx, "ClippingGeoLayerID");
        var outputId = has("OutputGeoLayerID")
            ? expand(ctx, "OutputGeoLayerID")
            : inputId + "_clippedBy_" + clippingId;
        var policy = collisionPolicy("IfGeoLayerIDExists");

        boolean inputs = requireInput(ctx, EntityKind.GEO_LAYER, "InputGeoLayerID", inputId)
            & requireInput(ctx, EntityKind.GEO_LAYER, "ClippingGeoLayerID", clippingId);
        if (inputs) {
            require(ctx, CheckRequest.crsMatch(inputId, clippingId), FailPolicy.FAIL);
            require(
                ctx,
                CheckRequest.geometryKind("ClippingGeoLayerID", clippingId, List.of("Polygon")),
                FailPolicy.FAIL
            );
        }
        requireOutput(ctx, EntityKind.GEO_LAYER, "OutputGeoLayerID", outputId, policy);
        if (isBlocked()) {
            return null;
        }
        var input = ctx.layers().get(inputId).orElseThrow();
        var clipping = ctx.layers().get(clippingId).orElseThrow();
        return () -> {
            var outputs = ctx.collaborators().geometryEngine().runAlgorithm(
                GeometryEngine.CLIP,
                Map.of(GeometryEngine.INPUT, input.handle(), GeometryEngine.OVERLAY, clipping.handle())
            );
            var handle = EngineOutputs.layer(outputs, GeometryEngine.CLIP);
            registerOutput(ctx.layers(), outputId, new GeoLayer(outputId, handle, ""), policy);
        };
    }
}
