package work.lcod.settings.cli;

import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    static final String LOGBACK_PROPERTY = "logback.configurationFile";
    static final String LOGGING_CONFIG = "lcod-settings-cli-logback.xml";

    private Main() {}

    public static void main(String[] args) {
        configureLogging();
        System.exit(commandLine(new SettingsCheckCommand()).execute(args));
    }

    static CommandLine commandLine(SettingsCheckCommand command) {
        return new CommandLine(command).setExecutionExceptionHandler(new SettingsErrorHandler());
    }

    /**
     * Points logback at the CLI configuration unless the caller chose one. Must run before the first logger is created.
     */
    static void configureLogging() {
        if (System.getProperty(LOGBACK_PROPERTY) == null) {
            System.setProperty(LOGBACK_PROPERTY, LOGGING_CONFIG);
        }
    }
}
