package work.gpflow.kernel.properties;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.UnaryOperator;
import work.gpflow.kernel.value.TypedValue;

/**
 * Named properties shared by every command of one workflow run, with {@code ${Name}} expansion.
 */
public final class PropertyStore {
    public static final String WORKING_DIR = "WorkingDir";
    public static final String TEMP_DIR = "TempDir";
    public static final String USER_HOME_DIR = "UserHomeDir";
    public static final String USER_NAME = "UserName";
    public static final String COMPUTER_NAME = "ComputerName";
    public static final String INSTALL_DIR = "InstallDir";

    private static final Set<String> WRITE_ONCE = Set.of(WORKING_DIR, TEMP_DIR);
    private static final String ENV_PREFIX = "ENV:";

    private final Map<String, TypedValue> values = new LinkedHashMap<>();
    private final UnaryOperator<String> environment;

    public PropertyStore() {
        this(System::getenv);
    }

    public PropertyStore(UnaryOperator<String> environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    /**
     * Store seeded with the built-in properties of a workflow run.
     */
    public static PropertyStore withBuiltIns(Path workingDirectory, Path tempDirectory) {
        var store = new PropertyStore();
        store.initializeBuiltIns(workingDirectory, tempDirectory);
        return store;
    }

    public void initializeBuiltIns(Path workingDirectory, Path tempDirectory) {
        set(WORKING_DIR, new TypedValue.FilePath(workingDirectory.toAbsolutePath().normalize()));
        set(TEMP_DIR, new TypedValue.FilePath(tempDirectory.toAbsolutePath().normalize()));
        var home = System.getProperty("user.home");
        if (home != null) {
            set(USER_HOME_DIR, new TypedValue.FilePath(Path.of(home)));
        }
        set(USER_NAME, new TypedValue.Text(Objects.toString(System.getProperty("user.name"), "")));
        set(COMPUTER_NAME, new TypedValue.Text(hostName()));
        set(INSTALL_DIR, new TypedValue.FilePath(Path.of(System.getProperty("user.dir", ".")).toAbsolutePath()));
    }

    public TypedValue get(String name) {
        var value = values.get(name);
        if (value == null) {
            throw new MissingPropertyException(name);
        }
        return value;
    }

    public TypedValue get(String name, TypedValue defaultValue) {
        var value = values.get(name);
        return value == null ? defaultValue : value;
    }

    public Optional<TypedValue> find(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public void set(String name, TypedValue value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        if (WRITE_ONCE.contains(name) && values.containsKey(name)) {
            throw new ImmutablePropertyException(name);
        }
        values.put(name, value);
    }

    public void set(String name, String value) {
        set(name, new TypedValue.Text(value));
    }

    public static boolean isWriteOnce(String name) {
        return WRITE_ONCE.contains(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(values.keySet());
    }

    /**
     * Sorted copy of the current values.
     */
    public Map<String, TypedValue> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(values));
    }

    /**
     * Replaces every {@code ${Name}} or {@code ${ENV:Name}} token. Substituted text is not rescanned and
     * unresolved tokens are kept verbatim.
     */
    public ExpansionResult expand(String raw) {
        if (raw == null) {
            return new ExpansionResult("", List.of());
        }
        var text = raw.replace("\\\"", "\"").replace("\\'", "'");
        var unresolved = new ArrayList<String>();
        var out = new StringBuilder(text.length());
        int pos = 0;
        while (pos < text.length()) {
            int start = text.indexOf("${", pos);
            if (start < 0) {
                break;
            }
            int end = text.indexOf('}', start + 2);
            if (end < 0) {
                break;
            }
            out.append(text, pos, start);
            var name = text.substring(start + 2, end);
            var resolved = resolve(name);
            if (resolved == null) {
                out.append(text, start, end + 1);
                unresolved.add(name);
            } else {
                out.append(resolved);
            }
            pos = end + 1;
        }
        out.append(text.substring(pos));
        return new ExpansionResult(out.toString(), unresolved);
    }

    private String resolve(String name) {
        if (name.length() > ENV_PREFIX.length()
            && name.substring(0, ENV_PREFIX.length()).toUpperCase(Locale.ROOT).equals(ENV_PREFIX)) {
            return environment.apply(name.substring(ENV_PREFIX.length()));
        }
        var value = values.get(name);
        return value == null ? null : value.render();
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException ex) {
            return Objects.toString(System.getenv("HOSTNAME"), "");
        }
    }
}
