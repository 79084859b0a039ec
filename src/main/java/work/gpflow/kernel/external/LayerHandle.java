package work.gpflow.kernel.external;

import java.util.List;
import java.util.Map;

/**
 * Opaque handle to layer data owned by a {@link LayerCodec} or {@link GeometryEngine}.
 */
public interface LayerHandle {
    /** Coordinate reference system code such as {@code EPSG:4326}; empty when unknown. */
    String crs();

    /** Geometry type of the features, e.g. {@code Polygon}; {@code Unknown} for an empty layer. */
    String geometryType();

    List<String> attributeNames();

    int featureCount();

    LayerHandle duplicate();

    /** Copy with attributes renamed per {@code oldName -> newName}. */
    LayerHandle renamed(Map<String, String> attributeMap);

    /** Copy tagged with {@code crs} without transforming coordinates. */
    LayerHandle withCrs(String crs);
}
