package work.gpflow.kernel.command;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.gpflow.kernel.check.CheckRequest;
import work.gpflow.kernel.check.CheckResult;
import work.gpflow.kernel.check.FailPolicy;
import work.gpflow.kernel.properties.PathFormatter;
import work.gpflow.kernel.properties.PropertyException;
import work.gpflow.kernel.registry.CollisionPolicy;
import work.gpflow.kernel.registry.EntityKind;
import work.gpflow.kernel.registry.EntityRegistry;
import work.gpflow.kernel.runtime.WorkflowContext;
import work.gpflow.kernel.status.CommandPhase;
import work.gpflow.kernel.status.CommandStatus;
import work.gpflow.kernel.status.LogRecord;
import work.gpflow.kernel.status.Severity;
import work.gpflow.kernel.value.TypedValue;

/**
 * Base class of every workflow command. A command is validated once, optionally discovered, then run once:
 * {@code CREATED -> VALIDATING -> (VALIDATION_FAILED | READY) -> RUNNING -> (COMPLETED | SKIPPED)}.
 *
 * <p>Subclasses declare their parameters, add cross-parameter checks in {@link #validateParameters} and
 * implement {@link #prepareRun}, which runs the precondition checks and returns the effect to apply.
 */
public abstract class Command {
    private static final Logger LOG = LoggerFactory.getLogger(Command.class);

    protected static final String CHECK_LOG = "Check the log file for details.";

    private final String name;
    private final List<ParameterMetadata> parameterMetadata;
    private final Map<String, String> rawParameters = new LinkedHashMap<>();
    private final Map<String, TypedValue> values = new LinkedHashMap<>();
    private final CommandStatus status = new CommandStatus();
    private CommandState state = CommandState.CREATED;
    private int warningCount;
    private boolean blocked;

    protected Command(String name, List<ParameterMetadata> parameterMetadata) {
        this.name = Objects.requireNonNull(name, "name");
        this.parameterMetadata = List.copyOf(parameterMetadata);
    }

    public String name() {
        return name;
    }

    public List<ParameterMetadata> parameterMetadata() {
        return parameterMetadata;
    }

    public Optional<ParameterMetadata> parameter(String parameterName) {
        return parameterMetadata.stream().filter(meta -> meta.name().equals(parameterName)).findFirst();
    }

    public Map<String, String> rawParameters() {
        return Collections.unmodifiableMap(rawParameters);
    }

    public void setRawParameters(Map<String, String> parameters) {
        if (state != CommandState.CREATED) {
            throw new IllegalStateException("Parameters of " + name + " can only be set before validation");
        }
        rawParameters.clear();
        if (parameters != null) {
            rawParameters.putAll(parameters);
        }
    }

    public CommandStatus status() {
        return status;
    }

    public CommandState state() {
        return state;
    }

    public int warningCount() {
        return warningCount;
    }

    public String toCommandString() {
        var order = new ArrayList<String>();
        parameterMetadata.forEach(meta -> order.add(meta.name()));
        return CommandStringParser.render(name, order, rawParameters);
    }

    @Override
    public String toString() {
        return toCommandString();
    }

    public final Outcome validate(Map<String, String> parameters, WorkflowContext ctx) {
        setRawParameters(parameters);
        return validate(ctx);
    }

    /**
     * Checks parameter names, presence, types and choices. Every problem is an INITIALIZATION FAILURE.
     */
    public final Outcome validate(WorkflowContext ctx) {
        transition(CommandState.VALIDATING);
        values.clear();
        for (String key : rawParameters.keySet()) {
            if (parameter(key).isEmpty()) {
                failParameter(
                    "Unrecognized parameter " + key + " for command " + name + ".",
                    "Remove the parameter or correct its name; valid parameters are " + parameterNames() + "."
                );
            }
        }
        for (ParameterMetadata meta : parameterMetadata) {
            var raw = rawParameters.get(meta.name());
            if (raw == null || raw.isBlank()) {
                if (meta.required()) {
                    failParameter(
                        "Required parameter " + meta.name() + " is not specified.",
                        "Specify the " + meta.name() + " parameter."
                    );
                } else if (meta.defaultValue() != null) {
                    coerce(meta, meta.defaultValue(), ctx);
                }
                continue;
            }
            coerce(meta, raw, ctx);
        }
        if (status.phaseSeverity(CommandPhase.INITIALIZATION) != Severity.FAILURE) {
            try {
                validateParameters(ctx);
            } catch (RuntimeException ex) {
                LOG.error("Unexpected error validating {}", name, ex);
                failParameter("Unexpected error validating " + name + ": " + describe(ex), CHECK_LOG);
            }
        }
        if (status.phaseSeverity(CommandPhase.INITIALIZATION) == Severity.FAILURE) {
            transition(CommandState.VALIDATION_FAILED);
            return new Outcome.ValidationFailed(status.records(CommandPhase.INITIALIZATION));
        }
        status.refreshPhaseSeverity(CommandPhase.INITIALIZATION, Severity.SUCCESS);
        transition(CommandState.READY);
        return new Outcome.Ready();
    }

    /**
     * Light pre-run pass that may publish expected outputs (e.g. properties) without running the effect.
     */
    public final void discover(WorkflowContext ctx) {
        if (state != CommandState.READY) {
            throw new IllegalStateException("Command " + name + " cannot be discovered in state " + state);
        }
        try {
            discoverOutputs(ctx);
        } catch (PropertyException ex) {
            log(LogRecord.warning(CommandPhase.DISCOVERY, ex.getMessage(), "Check the parameter values."));
        }
        status.refreshPhaseSeverity(CommandPhase.DISCOVERY, Severity.SUCCESS);
    }

    /**
     * Runs the precondition checks and, unless one of them blocks, the effect. Failures in either step are
     * logged and never rethrown; a failing check skips the effect.
     */
    public final Outcome run(WorkflowContext ctx) {
        transition(CommandState.RUNNING);
        blocked = false;
        Effect effect;
        try {
            effect = prepareRun(ctx);
        } catch (PropertyException ex) {
            block(ex.getMessage(), "Check the parameter values and the properties they use.");
            effect = null;
        } catch (RuntimeException ex) {
            LOG.error("Unexpected error checking {}", name, ex);
            block("Unexpected error checking " + name + ": " + describe(ex), CHECK_LOG);
            effect = null;
        }
        if (blocked || effect == null) {
            transition(CommandState.SKIPPED);
            return new Outcome.Skipped(status.records(CommandPhase.RUN), warningCount);
        }
        try {
            effect.apply();
        } catch (Exception ex) {
            LOG.error("Unexpected error running {}", name, ex);
            logRun(Severity.FAILURE, "Unexpected error running " + name + ": " + describe(ex), CHECK_LOG);
        }
        status.refreshPhaseSeverity(CommandPhase.RUN, Severity.SUCCESS);
        transition(CommandState.COMPLETED);
        return new Outcome.Completed(status.records(CommandPhase.RUN), warningCount);
    }

    protected void validateParameters(WorkflowContext ctx) {}

    protected void discoverOutputs(WorkflowContext ctx) {}

    /**
     * Checks run preconditions and returns the effect, or {@code null}/{@link #block} to skip it.
     */
    protected abstract Effect prepareRun(WorkflowContext ctx);

    // Parameter access

    protected final boolean has(String parameterName) {
        return values.containsKey(parameterName);
    }

    protected final Optional<TypedValue> value(String parameterName) {
        return Optional.ofNullable(values.get(parameterName));
    }

    protected final String text(String parameterName) {
        var value = values.get(parameterName);
        return value == null ? "" : value.render();
    }

    protected final boolean bool(String parameterName) {
        return values.get(parameterName) instanceof TypedValue.Bool bool && bool.value();
    }

    protected final long integer(String parameterName, long fallback) {
        return values.get(parameterName) instanceof TypedValue.Int number ? number.value() : fallback;
    }

    protected final double decimal(String parameterName, double fallback) {
        return values.get(parameterName) instanceof TypedValue.Decimal number ? number.value() : fallback;
    }

    protected final List<String> items(String parameterName) {
        return values.get(parameterName) instanceof TypedValue.Items list ? list.values() : List.of();
    }

    protected final CollisionPolicy collisionPolicy(String parameterName) {
        return CollisionPolicy.lookup(text(parameterName)).orElse(CollisionPolicy.REPLACE);
    }

    /**
     * Expands {@code ${...}} tokens in a text parameter; unresolved tokens are kept and logged as a RUN warning.
     */
    protected final String expand(WorkflowContext ctx, String parameterName) {
        return expandText(ctx, parameterName, text(parameterName));
    }

    protected final String expandText(WorkflowContext ctx, String parameterName, String raw) {
        var result = ctx.properties().expand(raw);
        for (String unresolved : result.unresolved()) {
            logRun(
                Severity.WARNING,
                "Property ${" + unresolved + "} used by " + parameterName + " is not defined and was left as is.",
                "Define the property before this command or correct its name."
            );
        }
        return result.value();
    }

    /**
     * Expanded path parameter resolved against the working directory.
     */
    protected final String path(WorkflowContext ctx, String parameterName) {
        var expanded = expand(ctx, parameterName);
        return expanded.isEmpty() ? "" : ctx.resolvePath(expanded).toString();
    }

    /**
     * Expanded text parameter with path formatter codes ({@code %f}, {@code %F}, ...) applied to {@code path}.
     */
    protected final String formatted(WorkflowContext ctx, String parameterName, String path) {
        return PathFormatter.format(expand(ctx, parameterName), path);
    }

    // Checks and registration

    protected final boolean require(WorkflowContext ctx, CheckRequest request, FailPolicy failPolicy) {
        return record(ctx.checks().evaluate(request, failPolicy));
    }

    protected final boolean require(
        WorkflowContext ctx,
        String conditionName,
        String value,
        List<String> contextValues,
        FailPolicy failPolicy
    ) {
        return record(ctx.checks().evaluate(conditionName, value, contextValues, failPolicy));
    }

    /**
     * Input reference: a missing ID always blocks.
     */
    protected final boolean requireInput(WorkflowContext ctx, EntityKind kind, String parameterName, String id) {
        return require(ctx, CheckRequest.idExisting(kind, parameterName, id), FailPolicy.FAIL);
    }

    /**
     * Output ID: escalation follows the collision policy (Warn keeps the old entry and skips, Fail fails).
     */
    protected final boolean requireOutput(
        WorkflowContext ctx,
        EntityKind kind,
        String parameterName,
        String id,
        CollisionPolicy policy
    ) {
        return require(ctx, CheckRequest.outputIdAvailable(kind, parameterName, id, policy), FailPolicy.forCollision(policy));
    }

    protected final <T> boolean registerOutput(EntityRegistry<T> registry, String id, T entity, CollisionPolicy policy) {
        var outcome = registry.register(id, entity, policy);
        var label = registry.kind().label();
        if (outcome.failed()) {
            logRun(
                Severity.FAILURE,
                "The " + label + " ID " + id + " already exists and the new " + label + " was not registered.",
                "Specify a new " + label + " ID or change the collision policy."
            );
        } else if (outcome.warned() && outcome.inserted()) {
            logRun(
                Severity.WARNING,
                "The " + label + " ID " + id + " already existed and was replaced.",
                "Specify a new " + label + " ID to keep both."
            );
        } else if (outcome.warned()) {
            logRun(
                Severity.WARNING,
                "The " + label + " ID " + id + " already exists; the existing " + label + " was kept.",
                "Specify a new " + label + " ID or change the collision policy."
            );
        }
        return outcome.inserted();
    }

    protected final void block(String message, String recommendation) {
        logRun(Severity.FAILURE, message, recommendation);
        blocked = true;
    }

    protected final boolean isBlocked() {
        return blocked;
    }

    // Logging

    protected final void failParameter(String message, String recommendation) {
        log(LogRecord.failure(CommandPhase.INITIALIZATION, message, recommendation));
    }

    protected final void logRun(Severity severity, String message, String recommendation) {
        log(new LogRecord(CommandPhase.RUN, severity, message, recommendation));
        if (severity.isAtLeast(Severity.WARNING)) {
            warningCount++;
        }
    }

    private void log(LogRecord record) {
        status.addLog(record);
        switch (record.severity()) {
            case FAILURE -> LOG.error("[{}] {} {}", name, record.message(), record.recommendation());
            case WARNING -> LOG.warn("[{}] {} {}", name, record.message(), record.recommendation());
            default -> LOG.info("[{}] {}", name, record.message());
        }
    }

    private boolean record(CheckResult result) {
        if (result.passed()) {
            return true;
        }
        if (result.unknownCondition()) {
            LOG.error("Command {} requested a check that does not exist: {}", name, result.message());
        }
        logRun(result.severity(), result.message(), result.recommendation());
        if (result.blocksEffect()) {
            blocked = true;
        }
        return false;
    }

    private void coerce(ParameterMetadata meta, String raw, WorkflowContext ctx) {
        var text = raw;
        if (meta.type().expandsBeforeCoercion()) {
            var expansion = ctx.properties().expand(raw);
            if (!expansion.complete()) {
                failParameter(
                    "Parameter " + meta.name() + " uses undefined properties " + expansion.unresolved() + ".",
                    "Define the properties before this command."
                );
                return;
            }
            text = expansion.value().trim();
        }
        var coerced = ParameterCoercion.coerce(meta, text);
        if (coerced.isEmpty()) {
            failParameter(
                "The " + meta.name() + " parameter value (" + raw + ") is not a valid " + describe(meta) + ".",
                "Specify " + expected(meta) + " for the " + meta.name() + " parameter."
            );
            return;
        }
        values.put(meta.name(), coerced.get());
    }

    private List<String> parameterNames() {
        return parameterMetadata.stream().map(ParameterMetadata::name).toList();
    }

    private void transition(CommandState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Command " + name + " cannot move from " + state + " to " + next);
        }
        state = next;
    }

    private static String describe(ParameterMetadata meta) {
        return switch (meta.type()) {
            case BOOLEAN -> "boolean";
            case INTEGER -> "integer";
            case DECIMAL -> "number";
            case CHOICE -> "choice";
            default -> "value";
        };
    }

    private static String expected(ParameterMetadata meta) {
        return switch (meta.type()) {
            case BOOLEAN -> "True or False";
            case INTEGER -> "an integer";
            case DECIMAL -> "a number";
            case CHOICE -> "one of " + meta.choices();
            default -> "a value";
        };
    }

    protected static String describe(Exception ex) {
        var message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }
}
