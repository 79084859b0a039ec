package work.gpflow.kernel.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Keyed store of live entities enforcing at most one entry per ID. Never logs: collisions are reported
 * through {@link RegisterOutcome}.
 */
public final class EntityRegistry<T> {
    private final EntityKind kind;
    private final Map<String, T> entries = new LinkedHashMap<>();

    public EntityRegistry(EntityKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public EntityKind kind() {
        return kind;
    }

    public Optional<T> get(String id) {
        return Optional.ofNullable(id == null ? null : entries.get(id));
    }

    public boolean exists(String id) {
        return id != null && entries.containsKey(id);
    }

    public RegisterOutcome register(String id, T entity, CollisionPolicy policy) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException(kind.label() + " ID must not be empty");
        }
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(policy, "policy");
        if (!entries.containsKey(id)) {
            entries.put(id, entity);
            return RegisterOutcome.INSERTED;
        }
        return switch (policy) {
            case REPLACE -> {
                entries.put(id, entity);
                yield RegisterOutcome.INSERTED;
            }
            case REPLACE_AND_WARN -> {
                entries.put(id, entity);
                yield RegisterOutcome.REPLACED_WITH_WARNING;
            }
            case WARN -> RegisterOutcome.KEPT_WITH_WARNING;
            case FAIL -> RegisterOutcome.REJECTED;
        };
    }

    /**
     * Removes the entry if present; removing a missing ID is a no-op.
     */
    public Optional<T> remove(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.remove(id));
    }

    public Set<String> ids() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}
