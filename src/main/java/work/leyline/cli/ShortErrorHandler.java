package work.leyline.cli;

import java.nio.file.NoSuchFileException;
import picocli.CommandLine;

/**
 * Keeps CLI failures short: source diagnostics are printed as they are, with their caret excerpt,
 * and the stack trace only shows with {@code -Dleyline.debug=true}.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        commandLine.getErr().println(commandLine.getColorScheme().errorText(describe(ex)));
        if (Boolean.getBoolean("leyline.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    private static String describe(Exception ex) {
        if (ex instanceof NoSuchFileException missing) {
            return "no such file: " + missing.getFile();
        }
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return message;
    }
}
