package work.gpflow.kernel.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.gpflow.kernel.runtime.RunSummary;
import work.gpflow.kernel.support.WorkflowTestSupport;
import work.gpflow.kernel.value.TypedValue;

class WorkflowRunnerTest {
    @TempDir
    Path workDir;

    @Test
    void runsAWorkflowEndToEnd() throws Exception {
        var commandFile = WorkflowTestSupport.copyResource("workflows/read-and-write.gp", workDir);
        WorkflowTestSupport.copyResource("data/polygons.geojson", workDir);
        WorkflowTestSupport.copyResource("data/stations.csv", workDir);

        var result = new WorkflowRunner().run(RunConfiguration.builder()
            .commandFile(commandFile)
            .summaryFile(workDir.resolve("reports/summary.json"))
            .build());

        assertEquals(RunResult.Status.SUCCESS, result.status(), result.toPrettyJson());
        assertEquals(0, result.status().exitCode());
        assertTrue(Files.exists(workDir.resolve("out/polygons-copy.geojson")));
        assertEquals("id|name|elevation", Files.readAllLines(workDir.resolve("out/stations.txt")).get(0));

        @SuppressWarnings("unchecked")
        var summary = (Map<String, Object>) result.metadata().get("summary");
        assertEquals(11, summary.get("executed"));
        assertEquals(0, summary.get("failed"));

        var report = new ObjectMapper().readTree(workDir.resolve("reports/summary.json").toFile());
        assertEquals(13, report.size());
        assertEquals("CREATED", report.get(12).get("state").asText());
    }

    @Test
    void reportsPartialFailure() throws Exception {
        var commandFile = WorkflowTestSupport.copyResource("workflows/partial-failure.gp", workDir);
        var result = new WorkflowRunner().run(RunConfiguration.builder().commandFile(commandFile).build());

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals(1, result.status().exitCode());
        assertEquals("1 of 3 commands failed", result.metadata().get("error"));
        var json = new ObjectMapper().readTree(result.toPrettyJson());
        assertEquals("failure", json.get("status").asText());
        assertEquals(2, json.get("metadata").get("summary").get("failures").get(0).get("index").asInt());
    }

    @Test
    void missingCommandFileIsAFailureResult() {
        var result = new WorkflowRunner().run(RunConfiguration.builder().commandFile(workDir.resolve("none.gp")).build());
        assertEquals(RunResult.Status.FAILURE, result.status());
        assertTrue(((String) result.metadata().get("error")).startsWith("Failed to read command file"));
    }

    @Test
    void initialPropertiesReachTheWorkflow() throws Exception {
        var commandFile = Files.writeString(workDir.resolve("props.gp"),
            "WritePropertiesToFile(OutputFile=\"${Target}\",IncludeProperties=\"Target\")\n");
        var result = new WorkflowRunner().run(RunConfiguration.builder()
            .commandFile(commandFile)
            .property("Target", new TypedValue.Text("props.txt"))
            .build());

        assertEquals(RunResult.Status.SUCCESS, result.status());
        assertEquals("Target=\"props.txt\"", Files.readString(workDir.resolve("props.txt")).strip());
    }

    @Test
    void configurationDefaults() {
        var config = RunConfiguration.builder().commandFile(Path.of("flows/main.gp")).build();
        assertEquals(Path.of("flows").toAbsolutePath().normalize(), config.workingDirectory());
        assertEquals(LogLevel.INFO, config.logLevel());
        assertTrue(config.summaryFile().isEmpty());
        assertThrows(NullPointerException.class, () -> RunConfiguration.builder().build());
    }

    @Test
    void logLevels() {
        assertEquals(LogLevel.DEBUG, LogLevel.from("debug"));
        assertEquals(LogLevel.INFO, LogLevel.from(null));
        assertEquals("ERROR", LogLevel.FATAL.backendName());
        assertThrows(IllegalArgumentException.class, () -> LogLevel.from("loud"));
    }

    @Test
    void summaryCountsSucceedOnlyWithoutFailures() {
        assertTrue(new RunSummary(2, 0, List.of()).succeeded());
    }
}
