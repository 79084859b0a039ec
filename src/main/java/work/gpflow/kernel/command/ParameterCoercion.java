package work.gpflow.kernel.command;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import work.gpflow.kernel.value.TypedValue;

/**
 * Converts raw parameter text into the {@link TypedValue} of its declared type.
 */
final class ParameterCoercion {
    private ParameterCoercion() {}

    static Optional<TypedValue> coerce(ParameterMetadata meta, String text) {
        return switch (meta.type()) {
            case STRING, PATH -> Optional.of(new TypedValue.Text(text));
            case BOOLEAN -> parseBoolean(text);
            case INTEGER -> parseInteger(text);
            case DECIMAL -> parseDecimal(text);
            case LIST -> Optional.of(new TypedValue.Items(splitList(text)));
            case CHOICE -> meta.choices().stream()
                .filter(choice -> choice.equalsIgnoreCase(text))
                .findFirst()
                .map(TypedValue.Text::new);
        };
    }

    static List<String> splitList(String text) {
        var items = new ArrayList<String>();
        for (String part : text.split(",")) {
            var trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return items;
    }

    private static Optional<TypedValue> parseBoolean(String text) {
        return switch (text.toLowerCase(Locale.ROOT)) {
            case "true" -> Optional.of(new TypedValue.Bool(true));
            case "false" -> Optional.of(new TypedValue.Bool(false));
            default -> Optional.empty();
        };
    }

    private static Optional<TypedValue> parseInteger(String text) {
        try {
            return Optional.of(new TypedValue.Int(Long.parseLong(text)));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    private static Optional<TypedValue> parseDecimal(String text) {
        try {
            return Optional.of(new TypedValue.Decimal(Double.parseDouble(text)));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
