package work.gpflow.kernel.commands.properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.gpflow.kernel.command.Outcome;
import work.gpflow.kernel.properties.PropertyStore;
import work.gpflow.kernel.runtime.WorkflowContext;
import work.gpflow.kernel.status.Severity;
import work.gpflow.kernel.support.WorkflowTestSupport;
import work.gpflow.kernel.value.TypedValue;

class PropertyCommandsTest {
    @TempDir
    Path workDir;

    private WorkflowContext ctx;

    @BeforeEach
    void setUp() {
        ctx = WorkflowTestSupport.context(workDir);
    }

    private Outcome set(Map<String, String> params) {
        return WorkflowTestSupport.validateAndRun(new SetProperty(), params, ctx);
    }

    @Test
    void setsTypedValues() {
        assertFalse(set(Map.of("PropertyName", "Name", "PropertyValue", "${WorkingDir}/x")).failed());
        assertEquals(workDir.toAbsolutePath().normalize() + "/x", ctx.properties().get("Name").render());

        set(Map.of("PropertyName", "Count", "PropertyType", "int", "PropertyValue", "12"));
        assertEquals(new TypedValue.Int(12), ctx.properties().get("Count"));

        set(Map.of("PropertyName", "Ratio", "PropertyType", "float", "PropertyValue", "0.5"));
        assertEquals(new TypedValue.Decimal(0.5), ctx.properties().get("Ratio"));

        set(Map.of("PropertyName", "On", "PropertyType", "bool", "PropertyValue", "TRUE"));
        assertEquals(new TypedValue.Bool(true), ctx.properties().get("On"));

        set(Map.of("PropertyName", "Years", "PropertyType", "int", "PropertyValues", "2020, 2021,2022"));
        assertEquals(new TypedValue.Items(List.of("2020", "2021", "2022")), ctx.properties().get("Years"));
    }

    @Test
    void badValuesAreBlocked() {
        var outcome = set(Map.of("PropertyName", "Count", "PropertyType", "int", "PropertyValue", "twelve"));
        assertInstanceOf(Outcome.Skipped.class, outcome);
        assertFalse(ctx.properties().contains("Count"));

        var list = set(Map.of("PropertyName", "Years", "PropertyType", "int", "PropertyValues", "2020,soon"));
        assertInstanceOf(Outcome.Skipped.class, list);
    }

    @Test
    void exactlyOneValueParameter() {
        assertInstanceOf(Outcome.ValidationFailed.class,
            new SetProperty().validate(Map.of("PropertyName", "X"), ctx));
        assertInstanceOf(Outcome.ValidationFailed.class,
            new SetProperty().validate(Map.of("PropertyName", "X", "PropertyValue", "1", "PropertyValues", "1,2"), ctx));
    }

    @Test
    void builtInDirectoriesCannotBeChanged() {
        var outcome = set(Map.of("PropertyName", PropertyStore.WORKING_DIR, "PropertyValue", "/elsewhere"));
        assertInstanceOf(Outcome.Skipped.class, outcome);
        assertEquals(workDir.toAbsolutePath().normalize().toString(), ctx.properties().get(PropertyStore.WORKING_DIR).render());
    }

    @Test
    void existingPropertiesFollowCollisionPolicy() {
        set(Map.of("PropertyName", "Mode", "PropertyValue", "a"));

        var warn = set(Map.of("PropertyName", "Mode", "PropertyValue", "b", "IfPropertyExists", "Warn"));
        assertInstanceOf(Outcome.Skipped.class, warn);
        assertEquals("a", ctx.properties().get("Mode").render());

        var replaceAndWarn = set(Map.of("PropertyName", "Mode", "PropertyValue", "c", "IfPropertyExists", "ReplaceAndWarn"));
        assertInstanceOf(Outcome.Completed.class, replaceAndWarn);
        assertEquals(Severity.WARNING, replaceAndWarn.records().get(0).severity());
        assertEquals("c", ctx.properties().get("Mode").render());

        assertFalse(set(Map.of("PropertyName", "Mode", "PropertyValue", "d")).failed());
        assertEquals("d", ctx.properties().get("Mode").render());
    }

    @Test
    void discoverySetsThePropertyWithoutRunning() {
        var command = new SetProperty();
        command.validate(Map.of("PropertyName", "Planned", "PropertyType", "int", "PropertyValue", "3"), ctx);
        command.discover(ctx);
        assertEquals(new TypedValue.Int(3), ctx.properties().get("Planned"));
    }

    @Test
    void writesNameValueFiles() throws Exception {
        ctx.properties().set("Alpha", "one \"quoted\"");
        ctx.properties().set("Beta", new TypedValue.Int(2));
        ctx.properties().set("Gamma", new TypedValue.Bool(false));

        var outcome = WorkflowTestSupport.validateAndRun(new WritePropertiesToFile(), Map.of(
            "OutputFile", "props.txt",
            "IncludeProperties", "Alpha,B*,Gamma",
            "SortOrder", "Descending"
        ), ctx);
        assertFalse(outcome.failed());
        assertEquals(
            List.of("Gamma=False", "Beta=2", "Alpha=\"one \\\"quoted\\\"\""),
            Files.readAllLines(workDir.resolve("props.txt"))
        );
    }

    @Test
    void writesJsonFiles() throws Exception {
        ctx.properties().set("Layers", new TypedValue.Items(List.of("a", "b")));
        ctx.properties().set("Limit", new TypedValue.Decimal(2.5));

        WorkflowTestSupport.validateAndRun(new WritePropertiesToFile(), Map.of(
            "OutputFile", "props.json",
            "IncludeProperties", "L*",
            "FileFormat", "json"
        ), ctx);
        var json = new ObjectMapper().readTree(workDir.resolve("props.json").toFile());
        assertEquals(2, json.size());
        assertEquals("b", json.get("Layers").get(1).asText());
        assertEquals(2.5, json.get("Limit").asDouble());
    }

    @Test
    void selectMatchesGlobsAndSorts() {
        var store = new PropertyStore(name -> null);
        store.set("b1", "x");
        store.set("a1", "x");
        store.set("a2", "x");
        assertEquals(List.of("a1", "a2", "b1"), List.copyOf(WritePropertiesToFile.select(store, List.of("*"), "Ascending").keySet()));
        assertEquals(List.of("b1", "a1"), List.copyOf(WritePropertiesToFile.select(store, List.of("?1"), "None").keySet()));
        assertTrue(WritePropertiesToFile.globToPattern("a.b*").matcher("a.bcd").matches());
        assertFalse(WritePropertiesToFile.globToPattern("a.b*").matcher("axbcd").matches());
    }
}
