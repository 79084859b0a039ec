package work.gpflow.kernel.model;

import java.util.Objects;

/**
 * Descriptor of an opened database connection target.
 */
public record DataStore(String id, String dialect, String server, String database, String file) {
    public DataStore {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(dialect, "dialect");
    }
}
