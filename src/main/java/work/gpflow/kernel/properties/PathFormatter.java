package work.gpflow.kernel.properties;

/**
 * Path formatter codes applied to a resolved path: {@code %F} name with extension, {@code %f} name without
 * extension, {@code %P} full path, {@code %p} parent folder, {@code %E} extension with its leading dot.
 */
public final class PathFormatter {
    private PathFormatter() {}

    public static String apply(String path, String code) {
        if (code == null) {
            throw new UnknownFormatterException("null");
        }
        var normalized = code.startsWith("%") ? code.substring(1) : code;
        if (normalized.length() != 1) {
            throw new UnknownFormatterException(code);
        }
        return apply(path, normalized.charAt(0));
    }

    public static String apply(String path, char code) {
        var value = path == null ? "" : path;
        return switch (code) {
            case 'F' -> fileName(value);
            case 'f' -> stem(fileName(value));
            case 'P' -> value;
            case 'p' -> parent(value);
            case 'E' -> extension(fileName(value));
            default -> throw new UnknownFormatterException("%" + code);
        };
    }

    /**
     * Replaces every {@code %X} code in {@code template}; {@code %%} is a literal percent sign.
     */
    public static String format(String template, String path) {
        if (template == null || template.indexOf('%') < 0) {
            return template;
        }
        var out = new StringBuilder(template.length());
        for (int i = 0; i < template.length(); i++) {
            char c = template.charAt(i);
            if (c != '%') {
                out.append(c);
                continue;
            }
            if (i + 1 >= template.length()) {
                throw new UnknownFormatterException("%");
            }
            char code = template.charAt(++i);
            if (code == '%') {
                out.append('%');
            } else {
                out.append(apply(path, code));
            }
        }
        return out.toString();
    }

    public static boolean hasCodes(String template) {
        return template != null && template.indexOf('%') >= 0;
    }

    private static int lastSeparator(String path) {
        return Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
    }

    private static String fileName(String path) {
        return path.substring(lastSeparator(path) + 1);
    }

    private static String parent(String path) {
        int idx = lastSeparator(path);
        if (idx < 0) {
            return "";
        }
        if (idx == 0) {
            return path.substring(0, 1);
        }
        return path.substring(0, idx);
    }

    private static String stem(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String extension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : "";
    }
}
