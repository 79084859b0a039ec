package work.gpflow.kernel.commands.properties;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import work.gpflow.kernel.check.CheckRequest;
import work.gpflow.kernel.check.FailPolicy;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.command.Effect;
import work.gpflow.kernel.command.ParameterMetadata;
import work.gpflow.kernel.command.ParameterType;
import work.gpflow.kernel.properties.PropertyStore;
import work.gpflow.kernel.registry.CollisionPolicy;
import work.gpflow.kernel.runtime.WorkflowContext;
import work.gpflow.kernel.status.Severity;
import work.gpflow.kernel.value.TypedValue;

/**
 * Sets a user property from a single value or a comma-separated list of values.
 */
public final class SetProperty extends Command {
    public static final String NAME = "SetProperty";

    public SetProperty() {
        super(NAME, List.of(
            ParameterMetadata.required("PropertyName", ParameterType.STRING),
            ParameterMetadata.choice("PropertyType", "str", "bool", "float", "int", "str"),
            ParameterMetadata.optional("PropertyValue", ParameterType.STRING),
            ParameterMetadata.optional("PropertyValues", ParameterType.STRING),
            ParameterMetadata.collision("IfPropertyExists")
        ));
    }

    @Override
    protected void validateParameters(WorkflowContext ctx) {
        boolean single = rawParameters().containsKey("PropertyValue");
        boolean multiple = rawParameters().containsKey("PropertyValues");
        if (single == multiple) {
            failParameter(
                "Exactly one of PropertyValue and PropertyValues must be specified.",
                "Specify PropertyValue for a single value or PropertyValues for a list."
            );
        }
    }

    @Override
    protected void discoverOutputs(WorkflowContext ctx) {
        var name = ctx.properties().expand(text("PropertyName")).value();
        if (PropertyStore.isWriteOnce(name) && ctx.properties().contains(name)) {
            return;
        }
        var raw = ctx.properties().expand(rawValue()).value();
        convert(raw).ifPresent(value -> ctx.properties().set(name, value));
    }

    @Override
    protected Effect prepareRun(WorkflowContext ctx) {
        var name = expand(ctx, "PropertyName");
        var policy = collisionPolicy("IfPropertyExists");
        if (PropertyStore.isWriteOnce(name) && ctx.properties().contains(name)) {
            block("Property " + name + " is a built-in that cannot be changed.", "Use a different property name.");
            return null;
        }
        require(ctx, CheckRequest.propertyUnique("PropertyName", name, policy), FailPolicy.forCollision(policy));
        var raw = expandText(ctx, valueParameter(), rawValue());
        var value = convert(raw);
        if (value.isEmpty()) {
            block(
                "The value (" + raw + ") cannot be converted to property type " + text("PropertyType") + ".",
                "Specify a value matching the PropertyType."
            );
            return null;
        }
        boolean existed = ctx.properties().contains(name);
        return () -> {
            ctx.properties().set(name, value.get());
            if (existed && policy == CollisionPolicy.REPLACE_AND_WARN) {
                logRun(Severity.WARNING, "Property " + name + " already existed and was replaced.", "Use a new property name to keep both.");
            }
        };
    }

    private String valueParameter() {
        return rawParameters().containsKey("PropertyValues") ? "PropertyValues" : "PropertyValue";
    }

    private String rawValue() {
        return text(valueParameter());
    }

    private Optional<TypedValue> convert(String raw) {
        var type = text("PropertyType").toLowerCase(Locale.ROOT);
        if (rawParameters().containsKey("PropertyValues")) {
            var items = new ArrayList<String>();
            for (String part : raw.split(",")) {
                var trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    if (convertSingle(type, trimmed).isEmpty()) {
                        return Optional.empty();
                    }
                    items.add(trimmed);
                }
            }
            return Optional.of(new TypedValue.Items(items));
        }
        return convertSingle(type, raw);
    }

    private static Optional<TypedValue> convertSingle(String type, String raw) {
        var trimmed = raw.trim();
        try {
            return switch (type) {
                case "bool" -> switch (trimmed.toLowerCase(Locale.ROOT)) {
                    case "true" -> Optional.of(new TypedValue.Bool(true));
                    case "false" -> Optional.of(new TypedValue.Bool(false));
                    default -> Optional.empty();
                };
                case "int" -> Optional.of(new TypedValue.Int(Long.parseLong(trimmed)));
                case "float" -> Optional.of(new TypedValue.Decimal(Double.parseDouble(trimmed)));
                default -> Optional.of(new TypedValue.Text(raw));
            };
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
