package work.gpflow.kernel.runtime;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.gpflow.kernel.check.CheckDispatcher;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.external.Collaborators;
import work.gpflow.kernel.model.DataStore;
import work.gpflow.kernel.model.DataTable;
import work.gpflow.kernel.model.GeoLayer;
import work.gpflow.kernel.properties.PropertyStore;
import work.gpflow.kernel.registry.EntityKind;
import work.gpflow.kernel.registry.EntityRegistry;
import work.gpflow.kernel.value.TypedValue;

/**
 * State shared by the commands of one workflow run: properties, entity registries and collaborators.
 * Commands are run one at a time, so nothing here is synchronized.
 */
public final class WorkflowContext {
    private final Path workingDirectory;
    private final PropertyStore properties;
    private final Collaborators collaborators;
    private final EntityRegistry<GeoLayer> layers = new EntityRegistry<>(EntityKind.GEO_LAYER);
    private final EntityRegistry<DataTable> tables = new EntityRegistry<>(EntityKind.TABLE);
    private final EntityRegistry<DataStore> dataStores = new EntityRegistry<>(EntityKind.DATA_STORE);
    private final CheckDispatcher checks;
    private List<Command> commands = List.of();

    public WorkflowContext(Path workingDirectory, PropertyStore properties, Collaborators collaborators) {
        this.workingDirectory = workingDirectory == null
            ? Paths.get("").toAbsolutePath().normalize()
            : workingDirectory.toAbsolutePath().normalize();
        this.properties = Objects.requireNonNull(properties, "properties");
        this.collaborators = Objects.requireNonNull(collaborators, "collaborators");
        this.checks = new CheckDispatcher(this);
    }

    /**
     * Fresh context with the built-in properties followed by {@code initialProperties}.
     */
    public static WorkflowContext create(
        Path workingDirectory,
        Map<String, TypedValue> initialProperties,
        Collaborators collaborators
    ) {
        var root = workingDirectory == null ? Paths.get("").toAbsolutePath() : workingDirectory;
        var properties = PropertyStore.withBuiltIns(root, Path.of(System.getProperty("java.io.tmpdir")));
        if (initialProperties != null) {
            initialProperties.forEach(properties::set);
        }
        return new WorkflowContext(root, properties, collaborators);
    }

    public Path workingDirectory() {
        return workingDirectory;
    }

    public PropertyStore properties() {
        return properties;
    }

    public Collaborators collaborators() {
        return collaborators;
    }

    public CheckDispatcher checks() {
        return checks;
    }

    public EntityRegistry<GeoLayer> layers() {
        return layers;
    }

    public EntityRegistry<DataTable> tables() {
        return tables;
    }

    public EntityRegistry<DataStore> dataStores() {
        return dataStores;
    }

    public EntityRegistry<?> registry(EntityKind kind) {
        return switch (kind) {
            case GEO_LAYER -> layers;
            case TABLE -> tables;
            case DATA_STORE -> dataStores;
        };
    }

    /**
     * Absolute, normalized path; relative paths are resolved against the working directory.
     */
    public Path resolvePath(String raw) {
        var path = Path.of(raw.trim());
        return (path.isAbsolute() ? path : workingDirectory.resolve(path)).normalize();
    }

    /**
     * Commands of the run in progress, for commands that report on the whole workflow.
     */
    public List<Command> commands() {
        return commands;
    }

    void attachCommands(List<Command> commands) {
        this.commands = List.copyOf(commands);
    }
}
