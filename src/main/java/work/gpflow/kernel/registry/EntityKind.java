package work.gpflow.kernel.registry;

/**
 * Kinds of entities held by a workflow context, each in its own registry.
 */
public enum EntityKind {
    GEO_LAYER("GeoLayer"),
    TABLE("Table"),
    DATA_STORE("DataStore");

    private final String label;

    EntityKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
