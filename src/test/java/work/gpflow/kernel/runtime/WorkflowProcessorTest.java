package work.gpflow.kernel.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.command.CommandState;
import work.gpflow.kernel.command.Effect;
import work.gpflow.kernel.commands.properties.SetProperty;
import work.gpflow.kernel.commands.util.Message;
import work.gpflow.kernel.external.Collaborators;
import work.gpflow.kernel.status.CommandPhase;
import work.gpflow.kernel.status.Severity;
import work.gpflow.kernel.support.WorkflowTestSupport;
import work.gpflow.kernel.value.TypedValue;

class WorkflowProcessorTest {
    @TempDir
    Path workDir;

    private final CommandFileLoader loader = new CommandFileLoader();

    private WorkflowProcessor processor(String workflow) {
        var collaborators = Collaborators.defaults().withGeometryEngine(new WorkflowTestSupport.RecordingGeometryEngine());
        return new WorkflowProcessor(workDir, Map.of(), collaborators).addCommands(loader.parse(workflow));
    }

    @Test
    void failingCommandDoesNotStopTheWorkflow() {
        var processor = processor(String.join("\n",
            "Message(Message=\"first\")",
            "CopyGeoLayer(CopiedGeoLayerID=\"copy\")",
            "Message(Message=\"third\")"
        ));
        var summary = processor.executeAll();

        assertEquals(3, summary.executed());
        assertEquals(1, summary.failed());
        assertEquals(2, summary.failures().get(0).index());
        assertEquals("CopyGeoLayer", summary.failures().get(0).commandName());
        assertEquals("Parameter error: Required parameter GeoLayerID is not specified.", summary.failures().get(0).reason());

        var commands = processor.commands();
        assertEquals(CommandState.COMPLETED, commands.get(0).state());
        assertEquals(CommandState.VALIDATION_FAILED, commands.get(1).state());
        assertEquals(CommandState.COMPLETED, commands.get(2).state());
    }

    @Test
    void warningsAndSkipsAreFailures() {
        var summary = processor(String.join("\n",
            "Message(Message=\"careful\",CommandStatus=\"Warning\")",
            "WriteGeoLayerToGeoJSON(GeoLayerID=\"ghost\",OutputFile=\"out.geojson\")"
        )).executeAll();

        assertEquals(2, summary.executed());
        assertEquals(2, summary.failed());
        assertEquals("There were 1 warnings processing the command.", summary.failures().get(0).reason());
        assertFalse(summary.succeeded());
    }

    @Test
    void commentBlockContentsAreNeitherRunNorFailed() {
        var processor = processor(String.join("\n",
            "# leading comment",
            "",
            "/*",
            "Message(Message=\"hidden\",CommandStatus=\"Failure\")",
            "NotACommand(X=\"1\")",
            "*/",
            "Message(Message=\"visible\")"
        ));
        var summary = processor.executeAll();

        assertEquals(5, summary.executed());
        assertEquals(0, summary.failed());
        assertEquals(CommandState.CREATED, processor.commands().get(3).state());
        assertEquals(CommandState.CREATED, processor.commands().get(4).state());
        assertEquals(CommandState.COMPLETED, processor.commands().get(6).state());
    }

    @Test
    void exitStopsTheWorkflow() {
        var processor = processor(String.join("\n",
            "Message(Message=\"before\")",
            "Exit()",
            "Message(Message=\"after\",CommandStatus=\"Failure\")"
        ));
        var summary = processor.executeAll();

        assertEquals(2, summary.executed());
        assertTrue(summary.succeeded());
        assertEquals(CommandState.CREATED, processor.commands().get(2).state());
    }

    @Test
    void unknownLinesFailWithTheirReason() {
        var summary = processor("Frobnicate(Level=\"11\")").executeAll();
        assertEquals(1, summary.failed());
        assertEquals("Parameter error: Unrecognized command Frobnicate.", summary.failures().get(0).reason());
    }

    @Test
    void failingChecksSkipTheCommandAndTheWorkflowGoesOn() {
        var exploding = new Command("Explode", List.of()) {
            @Override
            protected Effect prepareRun(WorkflowContext ctx) {
                throw new IllegalArgumentException("bad state");
            }
        };
        var processor = new WorkflowProcessor(workDir)
            .addCommand(exploding)
            .addCommand(new Message());
        processor.commands().get(1).setRawParameters(Map.of("Message", "still runs"));

        var summary = processor.executeAll();
        assertEquals(2, summary.executed());
        assertEquals(1, summary.failed());
        assertEquals(CommandState.SKIPPED, exploding.state());
        assertEquals("Unexpected error checking Explode: bad state", exploding.status().records(CommandPhase.RUN).get(0).message());
        assertEquals(CommandState.COMPLETED, processor.commands().get(1).state());
    }

    @Test
    void unexpectedExceptionsAreCountedAgainstTheCommand() {
        var message = new Message();
        message.setRawParameters(Map.of("Message", "twice"));
        var processor = new WorkflowProcessor(workDir).addCommand(message).addCommand(message);

        var summary = processor.executeAll();
        assertEquals(2, summary.executed());
        assertEquals(1, summary.failed());
        assertEquals(2, summary.failures().get(0).index());
        assertTrue(summary.failures().get(0).reason().startsWith("Unexpected error: Command Message cannot move from COMPLETED"));
        assertEquals(Severity.FAILURE, message.status().phaseSeverity(CommandPhase.RUN));
    }

    @Test
    void validationErrorsFailOnlyTheirCommand() {
        var broken = new Command("Broken", List.of()) {
            @Override
            protected void validateParameters(WorkflowContext ctx) {
                throw new IllegalStateException("no metadata");
            }

            @Override
            protected Effect prepareRun(WorkflowContext ctx) {
                return () -> {};
            }
        };
        var summary = new WorkflowProcessor(workDir).addCommand(broken).executeAll();

        assertEquals(1, summary.failed());
        assertEquals(CommandState.VALIDATION_FAILED, broken.state());
        assertEquals("Parameter error: Unexpected error validating Broken: no metadata", summary.failures().get(0).reason());
    }

    @Test
    void discoveryErrorsDoNotEndTheDiscoveryPass() {
        var broken = new Command("Broken", List.of()) {
            @Override
            protected void discoverOutputs(WorkflowContext ctx) {
                throw new IllegalStateException("cannot discover");
            }

            @Override
            protected Effect prepareRun(WorkflowContext ctx) {
                return () -> {};
            }
        };
        var message = new Message();
        message.setRawParameters(Map.of("Message", "after"));
        var processor = new WorkflowProcessor(workDir).addCommand(broken).addCommand(message);

        var summary = processor.discoverAll();
        assertEquals(2, summary.executed());
        assertEquals(1, summary.failed());
        assertEquals("Unexpected error: cannot discover", summary.failures().get(0).reason());
        assertEquals(Severity.FAILURE, broken.status().phaseSeverity(CommandPhase.DISCOVERY));
        assertEquals(CommandState.READY, message.state());
    }

    @Test
    void propertiesFlowBetweenCommands() {
        var processor = processor(String.join("\n",
            "SetProperty(PropertyName=\"Region\",PropertyValue=\"north\")",
            "Message(Message=\"Region is ${Region}\")"
        ));
        var summary = processor.executeAll();

        assertTrue(summary.succeeded());
        assertEquals("north", processor.context().properties().get("Region").render());
        var records = processor.commands().get(1).status().records(CommandPhase.RUN);
        assertEquals("Region is north", records.get(0).message());
    }

    @Test
    void initialPropertiesSeedEveryPass() {
        var processor = new WorkflowProcessor(workDir, Map.of("Mode", new TypedValue.Text("test")), Collaborators.defaults())
            .addCommands(loader.parse("Message(Message=\"${Mode}\")"));
        processor.executeAll();
        assertEquals("test", processor.context().properties().get("Mode").render());
        assertEquals(workDir.toAbsolutePath().normalize().toString(),
            processor.context().properties().get("WorkingDir").render());
    }

    @Test
    void discoverAllPublishesPropertiesWithoutRunning() {
        var processor = processor(String.join("\n",
            "SetProperty(PropertyName=\"Out\",PropertyValue=\"results\")",
            "CreateFolder(Folder=\"${Out}\")",
            "Message()"
        ));
        var summary = processor.discoverAll();

        assertEquals(3, summary.executed());
        assertEquals(1, summary.failed());
        assertEquals("results", processor.context().properties().get("Out").render());
        assertEquals(CommandState.READY, processor.commands().get(1).state());
        assertFalse(Files.exists(workDir.resolve("results")));
    }

    @Test
    void commandsAreSingleUse() {
        var processor = processor("Message(Message=\"once\")");
        processor.executeAll();
        var first = processor.context();
        assertThrows(IllegalStateException.class, processor::executeAll);
        assertThrows(IllegalStateException.class, processor::discoverAll);
        assertEquals(first, processor.context());

        var second = processor("Message(Message=\"again\")");
        second.executeAll();
        assertNotSame(first, second.context());
    }

    @Test
    void contextListsTheCommandsOfThePass() {
        var processor = processor("Message(Message=\"a\")\nMessage(Message=\"b\")");
        processor.executeAll();
        assertEquals(2, processor.context().commands().size());
        assertTrue(processor.context().commands().get(0) instanceof Message);
    }

    @Test
    void summarySerializes() {
        var summary = new RunSummary(2, 1, List.of(new RunSummary.Failure(2, "Message", "boom")));
        var map = summary.toSerializableMap();
        assertEquals(2, map.get("executed"));
        assertEquals(1, map.get("failed"));
        assertEquals(List.of(Map.of("index", 2, "command", "Message", "reason", "boom")), map.get("failures"));
    }

    @Test
    void setPropertyIsRegistered() {
        assertTrue(CommandFactory.create().newCommand("setproperty").orElseThrow() instanceof SetProperty);
    }
}
