package work.gpflow.kernel.commands.datastores;

import java.util.List;
import work.gpflow.kernel.check.CheckRequest;
import work.gpflow.kernel.check.FailPolicy;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.command.Effect;
import work.gpflow.kernel.command.ParameterMetadata;
import work.gpflow.kernel.command.ParameterType;
import work.gpflow.kernel.model.DataStore;
import work.gpflow.kernel.registry.EntityKind;
import work.gpflow.kernel.runtime.WorkflowContext;

/**
 * Registers a datastore descriptor: a server database, or a file database for SQLite.
 */
public final class OpenDataStore extends Command {
    public static final String NAME = "OpenDataStore";

    public OpenDataStore() {
        super(NAME, List.of(
            ParameterMetadata.required("DataStoreID", ParameterType.STRING),
            ParameterMetadata.requiredChoice("DatabaseDialect", "PostgreSQL", "SQLServer", "MySQL", "Oracle", "SQLite"),
            ParameterMetadata.optional("DatabaseServer", ParameterType.STRING),
            ParameterMetadata.optional("DatabaseName", ParameterType.STRING),
            ParameterMetadata.optional("File", ParameterType.PATH),
            ParameterMetadata.collision("IfDataStoreIDExists")
        ));
    }

    @Override
    protected void validateParameters(WorkflowContext ctx) {
        boolean fileDatabase = "SQLite".equals(text("DatabaseDialect"));
        if (fileDatabase && !has("File")) {
            failParameter("SQLite datastores require the File parameter.", "Specify the database File.");
        }
        if (!fileDatabase && (!has("DatabaseServer") || !has("DatabaseName"))) {
            failParameter(
                "Server datastores require DatabaseServer and DatabaseName.",
                "Specify DatabaseServer and DatabaseName."
            );
        }
    }

    @Override
    protected Effect prepareRun(WorkflowContext ctx) {
        var id = expand(ctx, "DataStoreID");
        var policy = collisionPolicy("IfDataStoreIDExists");
        var file = has("File") ? path(ctx, "File") : "";
        if (!file.isEmpty()) {
            require(ctx, CheckRequest.filePath("File", file), FailPolicy.FAIL);
        }
        requireOutput(ctx, EntityKind.DATA_STORE, "DataStoreID", id, policy);
        var dataStore = new DataStore(
            id,
            text("DatabaseDialect"),
            expand(ctx, "DatabaseServer"),
            expand(ctx, "DatabaseName"),
            file
        );
        return () -> registerOutput(ctx.dataStores(), id, dataStore, policy);
    }
}
