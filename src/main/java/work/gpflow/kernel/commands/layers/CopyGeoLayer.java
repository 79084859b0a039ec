package work.gpflow.kernel.commands.layers;

import java.util.List;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.command.Effect;
import work.gpflow.kernel.command.ParameterMetadata;
import work.gpflow.kernel.command.ParameterType;
import work.gpflow.kernel.registry.EntityKind;
import work.gpflow.kernel.runtime.WorkflowContext;

/**
 * Registers an independent copy of a GeoLayer, by default as {@code <GeoLayerID>_copy}.
 */
public final class CopyGeoLayer extends Command {
    public static final String NAME = "CopyGeoLayer";

    public CopyGeoLayer() {
        super(NAME, List.of(
            ParameterMetadata.required("GeoLayerID", ParameterType.STRING),
            ParameterMetadata.optional("CopiedGeoLayerID", ParameterType.STRING),
            ParameterMetadata.collision("IfGeoLayerIDExists")
        ));
    }

    @Override
    protected Effect prepareRun(WorkflowContext ctx) {
        var id = expand(ctx, "GeoLayerID");
        var copyId = has("CopiedGeoLayerID") ? expand(ctx, "CopiedGeoLayerID") : id + "_copy";
        var policy = collisionPolicy("IfGeoLayerIDExists");
        requireInput(ctx, EntityKind.GEO_LAYER, "GeoLayerID", id);
        requireOutput(ctx, EntityKind.GEO_LAYER, "CopiedGeoLayerID", copyId, policy);
        if (isBlocked()) {
            return null;
        }
        var source = ctx.layers().get(id).orElseThrow();
        return () -> registerOutput(ctx.layers(), copyId, source.copyAs(copyId), policy);
    }
}
