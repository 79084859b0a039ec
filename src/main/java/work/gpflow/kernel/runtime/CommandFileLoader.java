package work.gpflow.kernel.runtime;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.gpflow.kernel.command.Command;
import work.gpflow.kernel.command.CommandStringParser;
import work.gpflow.kernel.command.CommandSyntaxException;
import work.gpflow.kernel.commands.util.Blank;
import work.gpflow.kernel.commands.util.Comment;
import work.gpflow.kernel.commands.util.CommentBlockEnd;
import work.gpflow.kernel.commands.util.CommentBlockStart;
import work.gpflow.kernel.commands.util.UnknownCommand;

/**
 * Turns the lines of a command file into command instances, one per line. Unknown or malformed lines become
 * {@link UnknownCommand}s so they are reported when the workflow runs.
 */
public final class CommandFileLoader {
    private final CommandFactory factory;

    public CommandFileLoader() {
        this(CommandFactory.create());
    }

    public CommandFileLoader(CommandFactory factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    public List<Command> load(Path commandFile) {
        try {
            return parseLines(Files.readAllLines(commandFile, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read command file: " + commandFile, ex);
        }
    }

    public List<Command> parse(String text) {
        return parseLines(text.lines().toList());
    }

    public List<Command> parseLines(List<String> lines) {
        var commands = new ArrayList<Command>(lines.size());
        for (String line : lines) {
            commands.add(parseLine(line));
        }
        return commands;
    }

    public Command parseLine(String line) {
        var trimmed = line.strip();
        if (trimmed.isEmpty()) {
            return new Blank();
        }
        if (trimmed.startsWith("#")) {
            return new Comment(line);
        }
        if (trimmed.startsWith(CommentBlockStart.MARKER)) {
            return new CommentBlockStart();
        }
        if (trimmed.startsWith(CommentBlockEnd.MARKER)) {
            return new CommentBlockEnd();
        }
        var name = CommandStringParser.commandName(trimmed);
        var command = factory.newCommand(name);
        if (command.isEmpty()) {
            return new UnknownCommand(line, "Unrecognized command " + (name.isEmpty() ? "(no name)" : name) + ".");
        }
        try {
            var parsed = CommandStringParser.parse(trimmed);
            command.get().setRawParameters(parsed.parameters());
            return command.get();
        } catch (CommandSyntaxException ex) {
            return new UnknownCommand(line, "Invalid syntax for command " + name + ": " + ex.getMessage());
        }
    }
}
