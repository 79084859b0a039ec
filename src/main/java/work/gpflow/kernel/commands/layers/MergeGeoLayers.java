package work.gpflow.kernel.commands.layers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.gpflow.kernel.check.CheckRequest;
import work.gpflow.kernel.check.FailPolicy;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.command.Effect;
import work.gpflow.kernel.command.ParameterMetadata;
import work.gpflow.kernel.command.ParameterType;
import work.gpflow.kernel.external.GeometryEngine;
import work.gpflow.kernel.external.LayerHandle;
import work.gpflow.kernel.model.GeoLayer;
import work.gpflow.kernel.registry.CollisionPolicy;
import work.gpflow.kernel.registry.EntityKind;
import work.gpflow.kernel.runtime.WorkflowContext;

/**
 * Merges layers of the same geometry into one. Renamed copies of the inputs are registered as temporary
 * layers for the engine call and always removed afterwards.
 */
public final class MergeGeoLayers extends Command {
    public static final String NAME = "MergeGeoLayers";
    static final String TEMPORARY_PREFIX = "__merge_";

    public MergeGeoLayers() {
        super(NAME, List.of(
            ParameterMetadata.required("GeoLayerIDs", ParameterType.LIST),
            ParameterMetadata.required("OutputGeoLayerID", ParameterType.STRING),
            ParameterMetadata.optional("AttributeMap", ParameterType.STRING),
            ParameterMetadata.collision("IfGeoLayerIDExists")
        ));
    }

    @Override
    protected void validateParameters(WorkflowContext ctx) {
        if (items("GeoLayerIDs").size() < 2) {
            failParameter("GeoLayerIDs must name at least two GeoLayers.", "Specify two or more GeoLayer IDs.");
        }
        for (String entry : entries(text("AttributeMap"))) {
            if (entry.split(":", -1).length != 2 || entry.startsWith(":") || entry.endsWith(":")) {
                failParameter(
                    "AttributeMap entry (" + entry + ") is not of the form OldName:NewName.",
                    "Specify AttributeMap as OldName:NewName pairs separated by commas."
                );
            }
        }
    }

    @Override
    protected Effect prepareRun(WorkflowContext ctx) {
        var ids = items("GeoLayerIDs");
        var outputId = expand(ctx, "OutputGeoLayerID");
        var policy = collisionPolicy("IfGeoLayerIDExists");
        var attributeMap = attributeMap(expand(ctx, "AttributeMap"));

        boolean inputs = true;
        for (String id : ids) {
            inputs &= requireInput(ctx, EntityKind.GEO_LAYER, "GeoLayerIDs", id);
        }
        if (inputs) {
            var first = ids.get(0);
            var geometry = ctx.layers().get(first).orElseThrow().handle().geometryType();
            for (String id : ids.subList(1, ids.size())) {
                require(ctx, CheckRequest.geometryKind("GeoLayerIDs", id, List.of(geometry)), FailPolicy.FAIL);
                require(ctx, CheckRequest.crsMatch(first, id), FailPolicy.WARN);
            }
        }
        requireOutput(ctx, EntityKind.GEO_LAYER, "OutputGeoLayerID", outputId, policy);
        if (isBlocked()) {
            return null;
        }
        var sources = ids.stream().map(id -> ctx.layers().get(id).orElseThrow()).toList();
        return () -> merge(ctx, sources, outputId, attributeMap, policy);
    }

    private void merge(
        WorkflowContext ctx,
        List<GeoLayer> sources,
        String outputId,
        Map<String, String> attributeMap,
        CollisionPolicy policy
    ) {
        var temporary = new ArrayList<String>();
        try {
            var handles = new ArrayList<LayerHandle>();
            for (int i = 0; i < sources.size(); i++) {
                var tempId = unusedId(ctx, TEMPORARY_PREFIX + outputId + "_" + i);
                var renamed = sources.get(i).handle().renamed(attributeMap);
                ctx.layers().register(tempId, new GeoLayer(tempId, renamed, sources.get(i).source()), CollisionPolicy.FAIL);
                temporary.add(tempId);
                handles.add(renamed);
            }
            var outputs = ctx.collaborators().geometryEngine().runAlgorithm(
                GeometryEngine.MERGE,
                Map.of(GeometryEngine.LAYERS, handles, GeometryEngine.TARGET_CRS, sources.get(0).crs())
            );
            var merged = EngineOutputs.layer(outputs, GeometryEngine.MERGE);
            registerOutput(ctx.layers(), outputId, new GeoLayer(outputId, merged, ""), policy);
        } finally {
            temporary.forEach(ctx.layers()::remove);
        }
    }

    /**
     * {@code base}, or {@code base_2}, {@code base_3}... when a layer already uses it.
     */
    static String unusedId(WorkflowContext ctx, String base) {
        var id = base;
        for (int suffix = 2; ctx.layers().exists(id); suffix++) {
            id = base + "_" + suffix;
        }
        return id;
    }

    static Map<String, String> attributeMap(String raw) {
        var map = new LinkedHashMap<String, String>();
        for (String entry : entries(raw)) {
            var parts = entry.split(":", 2);
            if (parts.length == 2) {
                map.put(parts[0].trim(), parts[1].trim());
            }
        }
        return map;
    }

    private static List<String> entries(String raw) {
        var entries = new ArrayList<String>();
        if (raw == null) {
            return entries;
        }
        for (String part : raw.split(",")) {
            if (!part.isBlank()) {
                entries.add(part.trim());
            }
        }
        return entries;
    }
}
