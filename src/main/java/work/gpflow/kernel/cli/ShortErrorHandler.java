package work.gpflow.kernel.cli;

import picocli.CommandLine;

/**
 * Prints a one-line {@code gpflow: <reason>} instead of a stack trace; set {@code -Dgpflow.debug=true}
 * to get the trace as well.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "gpflow.debug";

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, CommandLine.ParseResult parseResult) {
        commandLine.getErr().println(commandLine.getColorScheme().errorText("gpflow: " + describe(ex)));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Throwable error) {
        var reason = error.getMessage();
        var cause = error.getCause();
        if (reason == null || reason.isBlank()) {
            reason = error.getClass().getSimpleName();
        }
        if (cause != null && cause.getMessage() != null && !reason.contains(cause.getMessage())) {
            reason += " (" + cause.getMessage() + ")";
        }
        return reason;
    }
}
