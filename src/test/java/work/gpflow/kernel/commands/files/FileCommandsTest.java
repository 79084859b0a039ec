package work.gpflow.kernel.commands.files;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.gpflow.kernel.command.CommandState;
import work.gpflow.kernel.command.Outcome;
import work.gpflow.kernel.external.Collaborators;
import work.gpflow.kernel.runtime.CommandFileLoader;
import work.gpflow.kernel.runtime.WorkflowContext;
import work.gpflow.kernel.runtime.WorkflowProcessor;
import work.gpflow.kernel.status.Severity;
import work.gpflow.kernel.support.WorkflowTestSupport;

class FileCommandsTest {
    @TempDir
    Path workDir;

    private WorkflowContext ctx;

    @BeforeEach
    void setUp() {
        ctx = WorkflowTestSupport.context(workDir);
    }

    @Test
    void createFolderWithAndWithoutParents() {
        var nested = WorkflowTestSupport.validateAndRun(
            new CreateFolder(), Map.of("Folder", "a/b/c", "CreateParentFolders", "True"), ctx);
        assertFalse(nested.failed());
        assertTrue(Files.isDirectory(workDir.resolve("a/b/c")));

        var noParents = WorkflowTestSupport.validateAndRun(new CreateFolder(), Map.of("Folder", "x/y"), ctx);
        assertInstanceOf(Outcome.Skipped.class, noParents);
        assertFalse(Files.exists(workDir.resolve("x")));
    }

    @Test
    void existingFolderFollowsIfFolderExists() {
        assertFalse(WorkflowTestSupport.validateAndRun(new CreateFolder(), Map.of("Folder", "."), ctx).failed());

        var warn = WorkflowTestSupport.validateAndRun(new CreateFolder(), Map.of("Folder", ".", "IfFolderExists", "Warn"), ctx);
        assertInstanceOf(Outcome.Completed.class, warn);
        assertEquals(1, warn.warningCount());

        var fail = WorkflowTestSupport.validateAndRun(new CreateFolder(), Map.of("Folder", ".", "IfFolderExists", "Fail"), ctx);
        assertInstanceOf(Outcome.Skipped.class, fail);
    }

    @Test
    void copyFileAndMissingSources() throws Exception {
        Files.writeString(workDir.resolve("in.txt"), "payload");
        var copied = WorkflowTestSupport.validateAndRun(
            new CopyFile(), Map.of("SourceFile", "in.txt", "DestinationFile", "out.txt"), ctx);
        assertFalse(copied.failed());
        assertEquals("payload", Files.readString(workDir.resolve("out.txt")));

        var warn = WorkflowTestSupport.validateAndRun(
            new CopyFile(), Map.of("SourceFile", "gone.txt", "DestinationFile", "out2.txt"), ctx);
        assertInstanceOf(Outcome.Skipped.class, warn);
        assertEquals(Severity.WARNING, warn.records().get(0).severity());

        var ignore = WorkflowTestSupport.validateAndRun(
            new CopyFile(), Map.of("SourceFile", "gone.txt", "DestinationFile", "out2.txt", "IfSourceFileNotFound", "Ignore"), ctx);
        assertInstanceOf(Outcome.Completed.class, ignore);
        assertFalse(ignore.failed());

        var fail = WorkflowTestSupport.validateAndRun(
            new CopyFile(), Map.of("SourceFile", "gone.txt", "DestinationFile", "out2.txt", "IfSourceFileNotFound", "Fail"), ctx);
        assertEquals(Severity.FAILURE, fail.records().get(0).severity());
        assertFalse(Files.exists(workDir.resolve("out2.txt")));
    }

    @Test
    void removeFileAndFolders() throws Exception {
        Files.writeString(workDir.resolve("old.txt"), "x");
        Files.createDirectories(workDir.resolve("tree/leaf"));
        Files.writeString(workDir.resolve("tree/leaf/file.txt"), "y");

        assertFalse(WorkflowTestSupport.validateAndRun(new RemoveFile(), Map.of("SourceFile", "old.txt"), ctx).failed());
        assertFalse(Files.exists(workDir.resolve("old.txt")));

        var folder = WorkflowTestSupport.validateAndRun(new RemoveFile(), Map.of("SourceFile", "tree"), ctx);
        assertInstanceOf(Outcome.Skipped.class, folder);
        assertTrue(Files.exists(workDir.resolve("tree")));

        assertFalse(WorkflowTestSupport.validateAndRun(
            new RemoveFile(), Map.of("SourceFile", "tree", "RemoveIfFolder", "True"), ctx).failed());
        assertFalse(Files.exists(workDir.resolve("tree")));

        var missing = WorkflowTestSupport.validateAndRun(new RemoveFile(), Map.of("SourceFile", "old.txt"), ctx);
        assertInstanceOf(Outcome.Skipped.class, missing);
    }

    @Test
    void unzipExtractsAndOptionallyDeletesTheArchive() throws Exception {
        var zip = workDir.resolve("bundle.zip");
        try (var out = new ZipArchiveOutputStream(zip.toFile())) {
            out.putArchiveEntry(new ZipArchiveEntry("inner/readme.txt"));
            out.write("hello".getBytes(StandardCharsets.UTF_8));
            out.closeArchiveEntry();
        }

        var outcome = WorkflowTestSupport.validateAndRun(
            new UnzipFile(), Map.of("File", "bundle.zip", "OutputFolder", "extracted", "DeleteFile", "True"), ctx);
        assertFalse(outcome.failed());
        assertEquals("hello", Files.readString(workDir.resolve("extracted/inner/readme.txt")));
        assertFalse(Files.exists(zip));
    }

    @Test
    void unzipNeedsAKnownArchiveType() throws Exception {
        Files.writeString(workDir.resolve("data.bin"), "??");
        var unknown = WorkflowTestSupport.validateAndRun(new UnzipFile(), Map.of("File", "data.bin"), ctx);
        assertInstanceOf(Outcome.Skipped.class, unknown);

        var badChoice = new UnzipFile().validate(Map.of("File", "data.bin", "FileType", "rar"), ctx);
        assertInstanceOf(Outcome.ValidationFailed.class, badChoice);
    }

    @Test
    void webGetDownloadsThroughTheService() {
        var requests = new ArrayList<String>();
        var timeouts = new ArrayList<Optional<Duration>>();
        var collaborators = Collaborators.defaults().withDownloadService((url, destination, timeout) -> {
            requests.add(url + " -> " + destination.getFileName());
            timeouts.add(timeout);
            Files.writeString(destination, "downloaded");
        });
        ctx = WorkflowContext.create(workDir, Map.of(), collaborators);

        assertFalse(WorkflowTestSupport.validateAndRun(
            new WebGet(), Map.of("FileURL", "https://example.org/files/data.zip", "Timeout", "30"), ctx).failed());
        assertFalse(WorkflowTestSupport.validateAndRun(
            new WebGet(), Map.of("FileURL", "https://example.org/", "OutputFile", "page.html"), ctx).failed());
        assertFalse(WorkflowTestSupport.validateAndRun(
            new WebGet(), Map.of("FileURL", "https://example.org/"), ctx).failed());

        assertEquals(List.of(
            URI.create("https://example.org/files/data.zip") + " -> data.zip",
            "https://example.org/ -> page.html",
            "https://example.org/ -> index.html"
        ), requests);
        assertEquals(Optional.of(Duration.ofSeconds(30)), timeouts.get(0));
        assertEquals(Optional.empty(), timeouts.get(1));
        assertTrue(Files.exists(workDir.resolve("index.html")));
    }

    @Test
    void webGetIgnoresSpacesAroundTheUrl() {
        var requests = new ArrayList<URI>();
        ctx = WorkflowContext.create(workDir, Map.of(), Collaborators.defaults()
            .withDownloadService((url, destination, timeout) -> requests.add(url)));

        var webGet = new WebGet();
        var outcome = WorkflowTestSupport.validateAndRun(webGet, Map.of("FileURL", " https://example.org/a.zip "), ctx);

        assertFalse(outcome.failed());
        assertEquals(CommandState.COMPLETED, webGet.state());
        assertEquals(List.of(URI.create("https://example.org/a.zip")), requests);
    }

    @Test
    void webGetRejectsBadUrlsAndTimeouts() {
        var badTimeout = new WebGet().validate(Map.of("FileURL", "https://example.org/a", "Timeout", "soon"), ctx);
        assertInstanceOf(Outcome.ValidationFailed.class, badTimeout);

        var hugeTimeout = new WebGet().validate(Map.of("FileURL", "https://example.org/a", "Timeout", "99999999999999999999h"), ctx);
        assertInstanceOf(Outcome.ValidationFailed.class, hugeTimeout);

        var badUrl = WorkflowTestSupport.validateAndRun(new WebGet(), Map.of("FileURL", "nowhere"), ctx);
        assertInstanceOf(Outcome.Skipped.class, badUrl);
    }

    @Test
    void commandSummaryReportsEveryCommand() throws Exception {
        var workflow = String.join("\n",
            "Message(Message=\"fine\")",
            "Message(Message=\"odd\",CommandStatus=\"Warning\")",
            "WriteCommandSummaryToFile(OutputFile=\"summary.json\")"
        );
        var processor = new WorkflowProcessor(workDir).addCommands(new CommandFileLoader().parse(workflow));
        processor.executeAll();

        var summary = new ObjectMapper().readTree(workDir.resolve("summary.json").toFile());
        assertEquals(3, summary.size());
        assertEquals(1, summary.get(0).get("index").asInt());
        assertEquals("COMPLETED", summary.get(0).get("state").asText());
        assertEquals("SUCCESS", summary.get(0).get("severity").asText());
        assertEquals("WARNING", summary.get(1).get("severity").asText());
        assertEquals("odd", summary.get(1).get("phases").get("RUN").get("records").get(0).get("message").asText());
        assertEquals("RUNNING", summary.get(2).get("state").asText());
    }

    @Test
    void missingSourceHandlingMapsToFailPolicies() {
        assertTrue(MissingSourceHandling.failPolicy("Ignore").isEmpty());
        assertEquals("WarnButDoNotRun", MissingSourceHandling.failPolicy("Warn").orElseThrow().externalName());
        assertEquals("Fail", MissingSourceHandling.failPolicy("Fail").orElseThrow().externalName());
    }
}
