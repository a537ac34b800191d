package work.lcod.settings.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.settings.api.RegistryConfiguration;
import work.lcod.settings.api.SettingsRegistry;
import work.lcod.settings.manifest.ManifestLoader;
import work.lcod.settings.runtime.EnvironmentSource;
import work.lcod.settings.validation.BuiltinValidationEngine;
import work.lcod.settings.validation.ExtendedValidationEngine;
import work.lcod.settings.validation.ValidationEngine;
import work.lcod.settings.validation.ValidationException;

@CommandLine.Command(
    name = "lcod-settings",
    description = "Resolve and validate the variables declared in a settings manifest.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class SettingsCheckCommand implements Callable<Integer> {
    static final int EXIT_INVALID = 1;
    static final List<String> ENGINES = List.of("builtin", "extended");

    private final EnvironmentSource environment;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-m", "--manifest"},
        required = true,
        paramLabel = "PATH",
        description = "Declaration manifest (.toml or .json)."
    )
    private Path manifest;

    @CommandLine.Option(
        names = {"-E", "--env"},
        paramLabel = "KEY=VALUE",
        description = "Overrides a process environment entry (repeatable)."
    )
    private Map<String, String> overrides = new LinkedHashMap<>();

    @CommandLine.Option(
        names = "--no-validate",
        description = "Print the snapshot without running validation."
    )
    private boolean skipValidation;

    @CommandLine.Option(
        names = "--only",
        paramLabel = "NAME",
        description = "Limit the printed snapshot to these variables (repeatable)."
    )
    private List<String> only = new ArrayList<>();

    @CommandLine.Option(
        names = "--engine",
        description = "Validation engine (builtin|extended).",
        defaultValue = "builtin"
    )
    private String engineName;

    SettingsCheckCommand() {
        this(EnvironmentSource.system());
    }

    SettingsCheckCommand(EnvironmentSource environment) {
        this.environment = environment;
    }

    @Override
    public Integer call() {
        var configuration = RegistryConfiguration.builder()
            .environment(environment.overlay(overrides))
            .validationEngine(resolveEngine())
            .build();
        var registry = ManifestLoader.apply(ManifestLoader.load(manifest), new SettingsRegistry(configuration));

        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        int exitCode = 0;
        if (!skipValidation) {
            try {
                registry.validateAll();
            } catch (ValidationException ex) {
                for (String violation : ex.violations()) {
                    err.println(violation);
                }
                exitCode = EXIT_INVALID;
            }
        }
        out.println(only.isEmpty() ? registry.toJson() : registry.toJson(only));
        out.flush();
        err.flush();
        return exitCode;
    }

    private ValidationEngine resolveEngine() {
        String name = engineName == null ? "builtin" : engineName.trim().toLowerCase(Locale.ROOT);
        return switch (name) {
            case "builtin" -> new BuiltinValidationEngine();
            case "extended" -> new ExtendedValidationEngine();
            default -> throw new CommandLine.ParameterException(
                spec.commandLine(),
                "Unsupported --engine value: " + engineName + " (expected one of " + String.join(", ", ENGINES) + ")"
            );
        };
    }
}
