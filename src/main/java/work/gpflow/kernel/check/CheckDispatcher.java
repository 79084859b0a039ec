package work.gpflow.kernel.check;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;
import java.util.regex.Pattern;
import work.gpflow.kernel.registry.CollisionPolicy;
import work.gpflow.kernel.runtime.WorkflowContext;

/**
 * Evaluates {@link Condition}s against a workflow context and applies the caller's {@link FailPolicy}.
 * Predicates only read the context.
 */
public final class CheckDispatcher {
    private static final Pattern CRS_CODE = Pattern.compile("^[A-Za-z][A-Za-z0-9_-]*:[A-Za-z0-9_.-]+$");
    private static final Set<String> URL_SCHEMES = Set.of("http", "https", "ftp", "file");

    private final WorkflowContext context;

    public CheckDispatcher(WorkflowContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    public CheckResult evaluate(CheckRequest request, FailPolicy failPolicy) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(failPolicy, "failPolicy");
        var verdict = test(request);
        if (verdict.passed()) {
            return CheckResult.pass(request.condition());
        }
        return CheckResult.fail(request.condition(), failPolicy, verdict.message(), verdict.recommendation());
    }

    /**
     * Name-based entry point. An unknown name is a defect in the caller: it always yields a blocking FAILURE,
     * whatever {@code failPolicy} says.
     */
    public CheckResult evaluate(String conditionName, String value, List<String> contextValues, FailPolicy failPolicy) {
        var condition = Condition.lookup(conditionName);
        if (condition.isEmpty()) {
            return CheckResult.unknown(conditionName);
        }
        return evaluate(CheckRequest.fromContext(condition.get(), value, contextValues), failPolicy);
    }

    private Verdict test(CheckRequest request) {
        return switch (request.condition()) {
            case FILE_PATH_VALID -> filePathValid(request);
            case FOLDER_PATH_VALID -> folderPathValid(request);
            case FILE_PATH_HAS_VALID_FOLDER -> fileFolderValid(request);
            case VALUE_IN_SET -> valueInSet(request);
            case ID_EXISTING -> idExisting(request);
            case OUTPUT_ID_AVAILABLE -> outputIdAvailable(request);
            case CRS_MATCH -> crsMatch(request);
            case GEOMETRY_KIND -> geometryKind(request);
            case CRS_CODE_VALID -> crsCode(request);
            case INT_IN_RANGE -> intInRange(request);
            case LIST_LENGTH_CORRECT -> listLength(request);
            case PROPERTY_UNIQUE -> propertyUnique(request);
            case ATTRIBUTES_EXIST -> attributesExist(request);
            case URL_VALID -> urlValid(request);
        };
    }

    private Verdict filePathValid(CheckRequest request) {
        var path = resolve(request.value());
        if (path != null && Files.isRegularFile(path)) {
            return Verdict.OK;
        }
        return Verdict.failed(
            "The " + request.label() + " (" + request.value() + ") is not a valid file.",
            "Specify a valid file for the " + request.label() + " parameter."
        );
    }

    private Verdict folderPathValid(CheckRequest request) {
        var path = resolve(request.value());
        if (path != null && Files.isDirectory(path)) {
            return Verdict.OK;
        }
        return Verdict.failed(
            "The " + request.label() + " (" + request.value() + ") is not a valid folder.",
            "Specify a valid folder for the " + request.label() + " parameter."
        );
    }

    private Verdict fileFolderValid(CheckRequest request) {
        var path = resolve(request.value());
        var parent = path == null ? null : path.getParent();
        if (parent != null && Files.isDirectory(parent)) {
            return Verdict.OK;
        }
        return Verdict.failed(
            "The " + request.label() + " (" + request.value() + ") does not have a valid folder.",
            "Specify a file in an existing folder for the " + request.label() + " parameter."
        );
    }

    private Verdict valueInSet(CheckRequest request) {
        for (String allowed : request.values()) {
            if (allowed.equalsIgnoreCase(request.value())) {
                return Verdict.OK;
            }
        }
        return Verdict.failed(
            "The " + request.label() + " (" + request.value() + ") is not one of " + request.values() + ".",
            "Specify one of " + request.values() + " for the " + request.label() + " parameter."
        );
    }

    private Verdict idExisting(CheckRequest request) {
        var label = request.kind().label();
        if (context.registry(request.kind()).exists(request.value())) {
            return Verdict.OK;
        }
        return Verdict.failed(
            "The " + request.label() + " (" + request.value() + ") is not a valid " + label + " ID.",
            "Specify a valid " + label + " ID."
        );
    }

    private Verdict outputIdAvailable(CheckRequest request) {
        if (!context.registry(request.kind()).exists(request.value()) || replaces(request.collisionPolicy())) {
            return Verdict.OK;
        }
        var label = request.kind().label();
        return Verdict.failed(
            "The " + request.label() + " (" + request.value() + ") value is already in use as a " + label + " ID.",
            "Specify a new " + request.label() + "."
        );
    }

    private Verdict crsMatch(CheckRequest request) {
        var first = context.layers().get(request.value());
        var secondId = request.values().isEmpty() ? "" : request.values().get(0);
        var second = context.layers().get(secondId);
        if (first.isEmpty() || second.isEmpty()) {
            var missing = first.isEmpty() ? request.value() : secondId;
            return Verdict.failed(
                "Cannot compare coordinate systems: GeoLayer " + missing + " is not registered.",
                "Specify valid GeoLayer IDs."
            );
        }
        if (first.get().crs().equalsIgnoreCase(second.get().crs())) {
            return Verdict.OK;
        }
        return Verdict.failed(
            "The GeoLayers " + request.value() + " (" + first.get().crs() + ") and " + secondId + " ("
                + second.get().crs() + ") do not have the same coordinate reference system.",
            "Specify GeoLayers that share a coordinate reference system."
        );
    }

    private Verdict geometryKind(CheckRequest request) {
        var layer = context.layers().get(request.value());
        if (layer.isEmpty()) {
            return Verdict.failed(
                "The " + request.label() + " (" + request.value() + ") is not a valid GeoLayer ID.",
                "Specify a valid GeoLayer ID."
            );
        }
        var actual = geometryFamily(layer.get().handle().geometryType());
        for (String kind : request.values()) {
            if (geometryFamily(kind).equals(actual)) {
                return Verdict.OK;
            }
        }
        return Verdict.failed(
            "The " + request.label() + " (" + request.value() + ") does not have geometry in " + request.values()
                + " (found " + layer.get().handle().geometryType() + ").",
            "Specify a GeoLayer with geometry in " + request.values() + "."
        );
    }

    private Verdict crsCode(CheckRequest request) {
        if (CRS_CODE.matcher(request.value().trim()).matches()) {
            return Verdict.OK;
        }
        return Verdict.failed(
            "The " + request.label() + " (" + request.value() + ") is not a valid coordinate reference system code.",
            "Specify a code of the form AUTHORITY:CODE, e.g. EPSG:4326."
        );
    }

    private Verdict intInRange(CheckRequest request) {
        var value = parseLong(request.value());
        if (value.isPresent() && value.getAsLong() >= request.min() && value.getAsLong() <= request.max()) {
            return Verdict.OK;
        }
        return Verdict.failed(
            "The " + request.label() + " (" + request.value() + ") is not an integer between " + request.min()
                + " and " + request.max() + ".",
            "Specify an integer between " + request.min() + " and " + request.max() + "."
        );
    }

    private Verdict listLength(CheckRequest request) {
        if (request.values().size() == request.min()) {
            return Verdict.OK;
        }
        return Verdict.failed(
            "The " + request.label() + " has " + request.values().size() + " items, expected " + request.min() + ".",
            "Specify exactly " + request.min() + " items for the " + request.label() + " parameter."
        );
    }

    private Verdict propertyUnique(CheckRequest request) {
        if (!context.properties().contains(request.value()) || replaces(request.collisionPolicy())) {
            return Verdict.OK;
        }
        return Verdict.failed(
            "The property " + request.value() + " is already set.",
            "Specify a new " + request.label() + " or allow the property to be replaced."
        );
    }

    private Verdict attributesExist(CheckRequest request) {
        var layer = context.layers().get(request.value());
        if (layer.isEmpty()) {
            return Verdict.failed(
                "The " + request.label() + " (" + request.value() + ") is not a valid GeoLayer ID.",
                "Specify a valid GeoLayer ID."
            );
        }
        var present = layer.get().handle().attributeNames();
        var missing = new ArrayList<String>();
        for (String attribute : request.values()) {
            if (!present.contains(attribute)) {
                missing.add(attribute);
            }
        }
        if (missing.isEmpty()) {
            return Verdict.OK;
        }
        return Verdict.failed(
            "The GeoLayer " + request.value() + " does not have the attributes " + missing + ".",
            "Specify attributes that exist in " + present + "."
        );
    }

    private Verdict urlValid(CheckRequest request) {
        if (isSupportedUrl(request.value())) {
            return Verdict.OK;
        }
        return Verdict.failed(
            "The " + request.label() + " (" + request.value() + ") is not a valid URL.",
            "Specify a valid http, https, ftp or file URL."
        );
    }

    private Path resolve(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return context.resolvePath(raw);
        } catch (InvalidPathException ex) {
            return null;
        }
    }

    private static OptionalLong parseLong(String raw) {
        try {
            return OptionalLong.of(Long.parseLong(raw.trim()));
        } catch (NumberFormatException ex) {
            return OptionalLong.empty();
        }
    }

    private static boolean isSupportedUrl(String raw) {
        URI uri;
        try {
            uri = new URI(raw.trim());
        } catch (URISyntaxException ex) {
            return false;
        }
        var scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        boolean hostOk = "file".equals(scheme) || (uri.getHost() != null && !uri.getHost().isBlank());
        return URL_SCHEMES.contains(scheme) && hostOk;
    }

    private static boolean replaces(CollisionPolicy policy) {
        return policy == CollisionPolicy.REPLACE || policy == CollisionPolicy.REPLACE_AND_WARN;
    }

    private static String geometryFamily(String geometryType) {
        var lower = geometryType == null ? "" : geometryType.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith("multi") ? lower.substring("multi".length()) : lower;
    }

    private record Verdict(boolean passed, String message, String recommendation) {
        static final Verdict OK = new Verdict(true, "", "");

        static Verdict failed(String message, String recommendation) {
            return new Verdict(false, message, recommendation);
        }
    }
}
