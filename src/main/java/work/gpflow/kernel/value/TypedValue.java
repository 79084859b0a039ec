package work.gpflow.kernel.value;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Small value union used for property values and coerced command parameters.
 */
public sealed interface TypedValue
    permits TypedValue.Text, TypedValue.Bool, TypedValue.Int, TypedValue.Decimal, TypedValue.FilePath, TypedValue.Items {

    /**
     * Text substituted for {@code ${Name}} tokens.
     */
    String render();

    static TypedValue of(Object raw) {
        if (raw == null) {
            return new Text("");
        }
        if (raw instanceof TypedValue typed) {
            return typed;
        }
        if (raw instanceof Boolean bool) {
            return new Bool(bool);
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short) {
            return new Int(((Number) raw).longValue());
        }
        if (raw instanceof Number number) {
            return new Decimal(number.doubleValue());
        }
        if (raw instanceof Path path) {
            return new FilePath(path);
        }
        if (raw instanceof List<?> list) {
            return new Items(list.stream().map(String::valueOf).toList());
        }
        return new Text(String.valueOf(raw));
    }

    record Text(String value) implements TypedValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String render() {
            return value;
        }
    }

    record Bool(boolean value) implements TypedValue {
        @Override
        public String render() {
            return value ? "True" : "False";
        }
    }

    record Int(long value) implements TypedValue {
        @Override
        public String render() {
            return Long.toString(value);
        }
    }

    record Decimal(double value) implements TypedValue {
        @Override
        public String render() {
            return Double.toString(value);
        }
    }

    record FilePath(Path value) implements TypedValue {
        public FilePath {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String render() {
            return value.toString();
        }
    }

    record Items(List<String> values) implements TypedValue {
        public Items {
            values = List.copyOf(values);
        }

        @Override
        public String render() {
            return "[" + String.join(",", values) + "]";
        }
    }
}
