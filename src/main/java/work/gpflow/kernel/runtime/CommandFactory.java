package work.gpflow.kernel.runtime;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.commands.datastores.CloseDataStore;
import work.gpflow.kernel.commands.datastores.OpenDataStore;
import work.gpflow.kernel.commands.files.CopyFile;
import work.gpflow.kernel.commands.files.CreateFolder;
import work.gpflow.kernel.commands.files.RemoveFile;
import work.gpflow.kernel.commands.files.UnzipFile;
import work.gpflow.kernel.commands.files.WebGet;
import work.gpflow.kernel.commands.files.WriteCommandSummaryToFile;
import work.gpflow.kernel.commands.layers.ClipGeoLayer;
import work.gpflow.kernel.commands.layers.CopyGeoLayer;
import work.gpflow.kernel.commands.layers.FreeGeoLayers;
import work.gpflow.kernel.commands.layers.MergeGeoLayers;
import work.gpflow.kernel.commands.layers.ReadGeoLayerFromGeoJSON;
import work.gpflow.kernel.commands.layers.SetGeoLayerCRS;
import work.gpflow.kernel.commands.layers.WriteGeoLayerToGeoJSON;
import work.gpflow.kernel.commands.properties.SetProperty;
import work.gpflow.kernel.commands.properties.WritePropertiesToFile;
import work.gpflow.kernel.commands.tables.ReadTableFromDelimitedFile;
import work.gpflow.kernel.commands.tables.WriteTableToDelimitedFile;
import work.gpflow.kernel.commands.util.Exit;
import work.gpflow.kernel.commands.util.Message;

/**
 * Fixed catalogue of command types, looked up case-insensitively by name.
 */
public final class CommandFactory {
    private final Map<String, Supplier<? extends Command>> commands = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    public CommandFactory register(String name, Supplier<? extends Command> supplier) {
        commands.put(name, supplier);
        return this;
    }

    public Optional<Command> newCommand(String name) {
        var supplier = commands.get(name);
        return supplier == null ? Optional.empty() : Optional.of(supplier.get());
    }

    public boolean isKnown(String name) {
        return commands.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(commands.keySet());
    }

    /**
     * Factory holding every built-in command.
     */
    public static CommandFactory create() {
        return new CommandFactory()
            .register(Exit.NAME, Exit::new)
            .register(Message.NAME, Message::new)
            .register(SetProperty.NAME, SetProperty::new)
            .register(WritePropertiesToFile.NAME, WritePropertiesToFile::new)
            .register(CreateFolder.NAME, CreateFolder::new)
            .register(CopyFile.NAME, CopyFile::new)
            .register(RemoveFile.NAME, RemoveFile::new)
            .register(UnzipFile.NAME, UnzipFile::new)
            .register(WebGet.NAME, WebGet::new)
            .register(WriteCommandSummaryToFile.NAME, WriteCommandSummaryToFile::new)
            .register(ReadGeoLayerFromGeoJSON.NAME, ReadGeoLayerFromGeoJSON::new)
            .register(WriteGeoLayerToGeoJSON.NAME, WriteGeoLayerToGeoJSON::new)
            .register(CopyGeoLayer.NAME, CopyGeoLayer::new)
            .register(FreeGeoLayers.NAME, FreeGeoLayers::new)
            .register(SetGeoLayerCRS.NAME, SetGeoLayerCRS::new)
            .register(ClipGeoLayer.NAME, ClipGeoLayer::new)
            .register(MergeGeoLayers.NAME, MergeGeoLayers::new)
            .register(ReadTableFromDelimitedFile.NAME, ReadTableFromDelimitedFile::new)
            .register(WriteTableToDelimitedFile.NAME, WriteTableToDelimitedFile::new)
            .register(OpenDataStore.NAME, OpenDataStore::new)
            .register(CloseDataStore.NAME, CloseDataStore::new);
    }
}
