package work.gpflow.kernel.command;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CommandStringParserTest {
    @Test
    void parsesQuotedParameters() {
        var parsed = CommandStringParser.parse("ReadGeoLayerFromGeoJSON(SpatialDataFile=\"data/a.geojson\", GeoLayerID=\"a\")");
        assertEquals("ReadGeoLayerFromGeoJSON", parsed.name());
        assertEquals(Map.of("SpatialDataFile", "data/a.geojson", "GeoLayerID", "a"), parsed.parameters());
        assertEquals(List.of("SpatialDataFile", "GeoLayerID"), List.copyOf(parsed.parameters().keySet()));
    }

    @Test
    void quotedValuesMayHoldCommasAndParentheses() {
        var parsed = CommandStringParser.parse("Message(Message=\"done (1, 2), ok\")");
        assertEquals("done (1, 2), ok", parsed.parameters().get("Message"));
    }

    @Test
    void backslashesAreLiteral() {
        var parsed = CommandStringParser.parse("CreateFolder(Folder=\"C:\\Temp\\\",CreateParentFolders=\"True\")");
        assertEquals("C:\\Temp\\", parsed.parameters().get("Folder"));
        assertEquals("True", parsed.parameters().get("CreateParentFolders"));

        var rendered = CommandStringParser.render("CreateFolder", parsed.parameters());
        assertEquals("CreateFolder(Folder=\"C:\\Temp\\\",CreateParentFolders=\"True\")", rendered);
        assertEquals(parsed.parameters(), CommandStringParser.parse(rendered).parameters());
    }

    @Test
    void acceptsUnquotedValuesAndEmptyLists() {
        var parsed = CommandStringParser.parse("  Exit( )  ");
        assertEquals("Exit", parsed.name());
        assertTrue(parsed.parameters().isEmpty());

        var unquoted = CommandStringParser.parse("CreateFolder(Folder = out , CreateParentFolders=True)");
        assertEquals("out", unquoted.parameters().get("Folder"));
        assertEquals("True", unquoted.parameters().get("CreateParentFolders"));
    }

    @Test
    void rejectsMalformedLines() {
        assertThrows(CommandSyntaxException.class, () -> CommandStringParser.parse("NoParens"));
        assertThrows(CommandSyntaxException.class, () -> CommandStringParser.parse("Cmd(A=\"unterminated)"));
        assertThrows(CommandSyntaxException.class, () -> CommandStringParser.parse("Cmd(A=\"1\" B=\"2\")"));
        assertThrows(CommandSyntaxException.class, () -> CommandStringParser.parse("Cmd(A=\"1\") trailing"));
        assertThrows(CommandSyntaxException.class, () -> CommandStringParser.parse("Cmd(=\"1\")"));
        var duplicate = assertThrows(CommandSyntaxException.class, () -> CommandStringParser.parse("Cmd(A=\"1\",A=\"2\")"));
        assertTrue(duplicate.getMessage().contains("Duplicate parameter A"));
    }

    @Test
    void commandNameIsTheLeadingIdentifier() {
        assertEquals("SetProperty", CommandStringParser.commandName("  SetProperty(PropertyName=\"x\""));
        assertEquals("", CommandStringParser.commandName("(oops)"));
        assertEquals("", CommandStringParser.commandName(null));
    }

    @Test
    void renderOrdersByMetadataAndOmitsEmptyValues() {
        var params = new LinkedHashMap<String, String>();
        params.put("Extra", "x");
        params.put("B", "");
        params.put("A", "say \"hi\"");
        var rendered = CommandStringParser.render("Cmd", List.of("A", "B"), params);
        assertEquals("Cmd(A=\"say 'hi'\",Extra=\"x\")", rendered);
    }

    @Test
    void renderedCommandParsesBack() {
        var params = new LinkedHashMap<String, String>();
        params.put("Message", "a, (b) \\d\\");
        params.put("CommandStatus", "Warning");
        var rendered = CommandStringParser.render("Message", params);
        var parsed = CommandStringParser.parse(rendered);
        assertEquals("Message", parsed.name());
        assertEquals(params, parsed.parameters());
        assertEquals(rendered, CommandStringParser.render(parsed.name(), parsed.parameters()));
    }
}
