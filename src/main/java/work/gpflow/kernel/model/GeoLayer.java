package work.gpflow.kernel.model;

import java.util.Objects;
import work.gpflow.kernel.external.LayerHandle;

/**
 * Registered layer: its ID, the opaque data handle and where it was read from (may be empty).
 */
public record GeoLayer(String id, LayerHandle handle, String source) {
    public GeoLayer {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(handle, "handle");
        source = source == null ? "" : source;
    }

    public String crs() {
        return handle.crs();
    }

    public GeoLayer withHandle(LayerHandle newHandle) {
        return new GeoLayer(id, newHandle, source);
    }

    public GeoLayer copyAs(String newId) {
        return new GeoLayer(newId, handle.duplicate(), source);
    }
}
