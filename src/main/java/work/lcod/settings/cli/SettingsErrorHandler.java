package work.lcod.settings.cli;

import java.io.PrintWriter;
import picocli.CommandLine;
import work.lcod.settings.manifest.ManifestException;
import work.lcod.settings.runtime.SettingsException;
import work.lcod.settings.validation.ValidationException;

/**
 * Renders registry and manifest failures as plain messages instead of stack traces.
 * Set {@code -Dlcod.settings.debug=true} to get the trace as well.
 */
final class SettingsErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "lcod.settings.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        PrintWriter err = commandLine.getErr();
        var colors = commandLine.getColorScheme();
        if (ex instanceof ValidationException validation) {
            for (String violation : validation.violations()) {
                err.println(colors.errorText(violation));
            }
            return SettingsCheckCommand.EXIT_INVALID;
        }
        err.println(colors.errorText(describe(ex)));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(err);
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Exception ex) {
        String message = ex.getMessage() == null || ex.getMessage().isBlank() ? null : ex.getMessage();
        if (ex instanceof ManifestException) {
            return "Invalid manifest: " + (message != null ? message : "unreadable document");
        }
        if (ex instanceof SettingsException && message != null) {
            return message;
        }
        if (ex instanceof IllegalArgumentException && message != null) {
            return "Invalid declaration: " + message;
        }
        String type = ex.getClass().getSimpleName();
        return message != null ? type + ": " + message : type;
    }
}
