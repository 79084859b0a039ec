package work.gpflow.kernel.commands.layers;

import java.util.ArrayList;
import java.util.List;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.command.Effect;
import work.gpflow.kernel.command.ParameterMetadata;
import work.gpflow.kernel.command.ParameterType;
import work.gpflow.kernel.registry.EntityKind;
import work.gpflow.kernel.runtime.WorkflowContext;

/**
 * Removes GeoLayers from the context; {@code *} frees every layer.
 */
public final class FreeGeoLayers extends Command {
    public static final String NAME = "FreeGeoLayers";

    public FreeGeoLayers() {
        super(NAME, List.of(ParameterMetadata.required("GeoLayerIDs", ParameterType.LIST)));
    }

    @Override
    protected Effect prepareRun(WorkflowContext ctx) {
        var requested = items("GeoLayerIDs");
        List<String> ids;
        if (requested.contains("*")) {
            ids = new ArrayList<>(ctx.layers().ids());
        } else {
            ids = requested;
            for (String id : ids) {
                requireInput(ctx, EntityKind.GEO_LAYER, "GeoLayerIDs", id);
            }
        }
        return () -> ids.forEach(ctx.layers()::remove);
    }
}
