package work.gpflow.kernel.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Layer handle backed by a GeoJSON FeatureCollection tree.
 */
public final class GeoJsonLayer implements LayerHandle {
    static final String DEFAULT_CRS = "EPSG:4326";

    private final ObjectNode collection;

    public GeoJsonLayer(ObjectNode collection) {
        this.collection = Objects.requireNonNull(collection, "collection");
        if (!collection.has("features")) {
            collection.set("features", JsonNodeFactory.instance.arrayNode());
        }
    }

    public static GeoJsonLayer empty(String crs) {
        var root = JsonNodeFactory.instance.objectNode();
        root.put("type", "FeatureCollection");
        root.set("features", JsonNodeFactory.instance.arrayNode());
        return (GeoJsonLayer) new GeoJsonLayer(root).withCrs(crs);
    }

    public ObjectNode tree() {
        return collection;
    }

    public ArrayNode features() {
        return (ArrayNode) collection.get("features");
    }

    @Override
    public String crs() {
        var name = collection.path("crs").path("properties").path("name");
        if (name.isTextual()) {
            return normalizeCrs(name.asText());
        }
        return DEFAULT_CRS;
    }

    @Override
    public String geometryType() {
        for (JsonNode feature : features()) {
            var type = feature.path("geometry").path("type");
            if (type.isTextual()) {
                return type.asText();
            }
        }
        return "Unknown";
    }

    @Override
    public List<String> attributeNames() {
        var names = new LinkedHashSet<String>();
        for (JsonNode feature : features()) {
            var properties = feature.path("properties");
            if (properties.isObject()) {
                properties.fieldNames().forEachRemaining(names::add);
            }
        }
        return new ArrayList<>(names);
    }

    @Override
    public int featureCount() {
        return features().size();
    }

    @Override
    public LayerHandle duplicate() {
        return new GeoJsonLayer(collection.deepCopy());
    }

    @Override
    public LayerHandle renamed(Map<String, String> attributeMap) {
        var copy = collection.deepCopy();
        if (attributeMap == null || attributeMap.isEmpty()) {
            return new GeoJsonLayer(copy);
        }
        for (JsonNode feature : (ArrayNode) copy.get("features")) {
            if (!(feature.path("properties") instanceof ObjectNode properties)) {
                continue;
            }
            var renamed = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
            while (fields.hasNext()) {
                var field = fields.next();
                renamed.set(attributeMap.getOrDefault(field.getKey(), field.getKey()), field.getValue());
            }
            ((ObjectNode) feature).set("properties", renamed);
        }
        return new GeoJsonLayer(copy);
    }

    @Override
    public LayerHandle withCrs(String crs) {
        var copy = collection.deepCopy();
        var crsNode = JsonNodeFactory.instance.objectNode();
        crsNode.put("type", "name");
        crsNode.putObject("properties").put("name", crs);
        copy.set("crs", crsNode);
        return new GeoJsonLayer(copy);
    }

    /**
     * Maps OGC URNs such as {@code urn:ogc:def:crs:EPSG::3857} to {@code EPSG:3857}.
     */
    static String normalizeCrs(String raw) {
        if (raw.startsWith("urn:ogc:def:crs:")) {
            var parts = raw.substring("urn:ogc:def:crs:".length()).split(":");
            if (parts.length >= 2) {
                var code = parts[parts.length - 1];
                return "OGC".equals(parts[0]) && "CRS84".equals(code) ? DEFAULT_CRS : parts[0] + ":" + code;
            }
        }
        return raw;
    }
}
