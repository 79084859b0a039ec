package work.gpflow.kernel.check;

import java.util.List;
import java.util.Objects;
import work.gpflow.kernel.registry.CollisionPolicy;
import work.gpflow.kernel.registry.EntityKind;

/**
 * Inputs of one check. {@code label} names the checked parameter in messages; which other fields are read
 * depends on the condition.
 */
public record CheckRequest(
    Condition condition,
    String label,
    String value,
    List<String> values,
    EntityKind kind,
    CollisionPolicy collisionPolicy,
    long min,
    long max
) {
    public CheckRequest {
        Objects.requireNonNull(condition, "condition");
        label = label == null || label.isBlank() ? "value" : label;
        value = value == null ? "" : value;
        values = values == null ? List.of() : List.copyOf(values);
        kind = kind == null ? EntityKind.GEO_LAYER : kind;
        collisionPolicy = collisionPolicy == null ? CollisionPolicy.REPLACE : collisionPolicy;
    }

    private static CheckRequest of(Condition condition, String label, String value) {
        return new CheckRequest(condition, label, value, List.of(), null, null, 0, 0);
    }

    public static CheckRequest filePath(String label, String path) {
        return of(Condition.FILE_PATH_VALID, label, path);
    }

    public static CheckRequest folderPath(String label, String path) {
        return of(Condition.FOLDER_PATH_VALID, label, path);
    }

    public static CheckRequest fileFolder(String label, String path) {
        return of(Condition.FILE_PATH_HAS_VALID_FOLDER, label, path);
    }

    public static CheckRequest valueInSet(String label, String value, List<String> allowed) {
        return new CheckRequest(Condition.VALUE_IN_SET, label, value, allowed, null, null, 0, 0);
    }

    public static CheckRequest idExisting(EntityKind kind, String label, String id) {
        return new CheckRequest(Condition.ID_EXISTING, label, id, List.of(), kind, null, 0, 0);
    }

    public static CheckRequest outputIdAvailable(EntityKind kind, String label, String id, CollisionPolicy policy) {
        return new CheckRequest(Condition.OUTPUT_ID_AVAILABLE, label, id, List.of(), kind, policy, 0, 0);
    }

    public static CheckRequest crsMatch(String firstLayerId, String secondLayerId) {
        return new CheckRequest(Condition.CRS_MATCH, "GeoLayerID", firstLayerId, List.of(secondLayerId), null, null, 0, 0);
    }

    public static CheckRequest geometryKind(String label, String layerId, List<String> kinds) {
        return new CheckRequest(Condition.GEOMETRY_KIND, label, layerId, kinds, null, null, 0, 0);
    }

    public static CheckRequest crsCode(String label, String code) {
        return of(Condition.CRS_CODE_VALID, label, code);
    }

    public static CheckRequest intInRange(String label, String value, long min, long max) {
        return new CheckRequest(Condition.INT_IN_RANGE, label, value, List.of(), null, null, min, max);
    }

    public static CheckRequest listLength(String label, List<String> values, int expected) {
        return new CheckRequest(Condition.LIST_LENGTH_CORRECT, label, "", values, null, null, expected, expected);
    }

    public static CheckRequest propertyUnique(String label, String name, CollisionPolicy policy) {
        return new CheckRequest(Condition.PROPERTY_UNIQUE, label, name, List.of(), null, policy, 0, 0);
    }

    public static CheckRequest attributesExist(String label, String layerId, List<String> attributes) {
        return new CheckRequest(Condition.ATTRIBUTES_EXIST, label, layerId, attributes, null, null, 0, 0);
    }

    public static CheckRequest url(String label, String url) {
        return of(Condition.URL_VALID, label, url);
    }

    /**
     * Builds a request from the positional form used by the name-based entry point. Context values are:
     * the entity kind for ID conditions ({@code GeoLayer}, {@code Table}, {@code DataStore}), followed by the
     * collision policy for output IDs; {@code [min, max]} for ranges; {@code [expected]} for list lengths;
     * the second layer for CRS matches; otherwise the allowed values, geometry kinds or attributes.
     */
    public static CheckRequest fromContext(Condition condition, String value, List<String> contextValues) {
        var context = contextValues == null ? List.<String>of() : contextValues;
        return switch (condition) {
            case FILE_PATH_VALID, FOLDER_PATH_VALID, FILE_PATH_HAS_VALID_FOLDER, CRS_CODE_VALID, URL_VALID ->
                of(condition, null, value);
            case VALUE_IN_SET, GEOMETRY_KIND, ATTRIBUTES_EXIST, CRS_MATCH ->
                new CheckRequest(condition, null, value, context, null, null, 0, 0);
            case ID_EXISTING, OUTPUT_ID_AVAILABLE -> new CheckRequest(
                condition, null, value, List.of(), kindAt(context, 0), policyAt(context, 1), 0, 0);
            case PROPERTY_UNIQUE -> new CheckRequest(condition, null, value, List.of(), null, policyAt(context, 0), 0, 0);
            case INT_IN_RANGE -> new CheckRequest(
                condition, null, value, List.of(), null, null, longAt(context, 0, Long.MIN_VALUE), longAt(context, 1, Long.MAX_VALUE));
            case LIST_LENGTH_CORRECT -> {
                long expected = longAt(context, 0, 0);
                yield new CheckRequest(condition, null, "", splitList(value), null, null, expected, expected);
            }
        };
    }

    private static EntityKind kindAt(List<String> context, int index) {
        if (context.size() <= index) {
            return EntityKind.GEO_LAYER;
        }
        for (EntityKind kind : EntityKind.values()) {
            if (kind.label().equalsIgnoreCase(context.get(index).trim())) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown entity kind: " + context.get(index));
    }

    private static CollisionPolicy policyAt(List<String> context, int index) {
        if (context.size() <= index) {
            return CollisionPolicy.REPLACE;
        }
        return CollisionPolicy.lookup(context.get(index))
            .orElseThrow(() -> new IllegalArgumentException("Unknown collision policy: " + context.get(index)));
    }

    private static long longAt(List<String> context, int index, long fallback) {
        if (context.size() <= index) {
            return fallback;
        }
        return Long.parseLong(context.get(index).trim());
    }

    private static List<String> splitList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return List.of(value.split(",", -1)).stream().map(String::trim).toList();
    }
}
