package work.gpflow.kernel.commands.datastores;

import java.util.List;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.command.Effect;
import work.gpflow.kernel.command.ParameterMetadata;
import work.gpflow.kernel.command.ParameterType;
import work.gpflow.kernel.registry.EntityKind;
import work.gpflow.kernel.runtime.WorkflowContext;

public final class CloseDataStore extends Command {
    public static final String NAME = "CloseDataStore";

    public CloseDataStore() {
        super(NAME, List.of(ParameterMetadata.required("DataStoreID", ParameterType.STRING)));
    }

    @Override
    protected Effect prepareRun(WorkflowContext ctx) {
        var id = expand(ctx, "DataStoreID");
        if (!requireInput(ctx, EntityKind.DATA_STORE, "DataStoreID", id)) {
            return null;
        }
        return () -> ctx.dataStores().remove(id);
    }
}
