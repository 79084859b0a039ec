package work.gpflow.kernel.command;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses and renders the textual form {@code Name(Param1="value1",Param2="value2")}. Quoted values may contain
 * commas and parentheses and end at the next double quote, so backslashes are literal ({@code "C:\Temp\"}).
 */
public final class CommandStringParser {
    private CommandStringParser() {}

    public static ParsedCommand parse(String line) {
        if (line == null) {
            throw new CommandSyntaxException("Empty command", 0);
        }
        var cursor = new Cursor(line);
        cursor.skipSpaces();
        var name = cursor.identifier("command name");
        cursor.skipSpaces();
        cursor.expect('(');
        var parameters = new LinkedHashMap<String, String>();
        cursor.skipSpaces();
        if (!cursor.consume(')')) {
            do {
                cursor.skipSpaces();
                int at = cursor.pos;
                var key = cursor.identifier("parameter name");
                cursor.skipSpaces();
                cursor.expect('=');
                cursor.skipSpaces();
                var value = cursor.value();
                if (parameters.containsKey(key)) {
                    throw new CommandSyntaxException("Duplicate parameter " + key, at);
                }
                parameters.put(key, value);
                cursor.skipSpaces();
            } while (cursor.consume(','));
            cursor.expect(')');
        }
        cursor.skipSpaces();
        if (!cursor.atEnd()) {
            throw new CommandSyntaxException("Unexpected text after command", cursor.pos);
        }
        return new ParsedCommand(name, parameters);
    }

    /**
     * Leading identifier of a line, or empty when it does not start with one.
     */
    public static String commandName(String line) {
        var trimmed = line == null ? "" : line.strip();
        int end = 0;
        while (end < trimmed.length() && isIdentifierPart(trimmed.charAt(end))) {
            end++;
        }
        return trimmed.substring(0, end);
    }

    /**
     * Renders parameters in {@code order} first, then any others in insertion order. Empty values are omitted.
     */
    public static String render(String name, Collection<String> order, Map<String, String> parameters) {
        var keys = new ArrayList<String>();
        for (String key : order) {
            if (parameters.containsKey(key)) {
                keys.add(key);
            }
        }
        for (String key : parameters.keySet()) {
            if (!keys.contains(key)) {
                keys.add(key);
            }
        }
        var parts = new ArrayList<String>();
        for (String key : keys) {
            var value = parameters.get(key);
            if (value == null || value.isEmpty()) {
                continue;
            }
            parts.add(key + "=\"" + escapeQuotes(value) + "\"");
        }
        return name + "(" + String.join(",", parts) + ")";
    }

    public static String render(String name, Map<String, String> parameters) {
        return render(name, List.of(), parameters);
    }

    /**
     * A double quote cannot appear inside a quoted value; it is written as a single quote.
     */
    private static String escapeQuotes(String value) {
        return value.replace('"', '\'');
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static final class Cursor {
        private final String text;
        private int pos;

        Cursor(String text) {
            this.text = text;
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        void skipSpaces() {
            while (!atEnd() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        boolean consume(char expected) {
            if (!atEnd() && text.charAt(pos) == expected) {
                pos++;
                return true;
            }
            return false;
        }

        void expect(char expected) {
            if (!consume(expected)) {
                throw new CommandSyntaxException("Expected '" + expected + "'", pos);
            }
        }

        String identifier(String what) {
            int start = pos;
            while (!atEnd() && isIdentifierPart(text.charAt(pos))) {
                pos++;
            }
            if (start == pos) {
                throw new CommandSyntaxException("Expected " + what, pos);
            }
            return text.substring(start, pos);
        }

        String value() {
            if (consume('"')) {
                int start = pos;
                while (!atEnd() && text.charAt(pos) != '"') {
                    pos++;
                }
                if (atEnd()) {
                    throw new CommandSyntaxException("Unterminated quoted value", start - 1);
                }
                var value = text.substring(start, pos);
                pos++;
                return value;
            }
            int start = pos;
            while (!atEnd() && text.charAt(pos) != ',' && text.charAt(pos) != ')') {
                pos++;
            }
            return text.substring(start, pos).strip();
        }
    }
}
